package it.cavallium.searchcore.index;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

/**
 * Read access to a single index snapshot
 */
public interface IndexReader extends DocumentStore, Closeable {

	/**
	 * Name of the index, reported in every match
	 */
	String name();

	/**
	 * Open a new cursor over the postings of a term. The caller owns the cursor and must close it
	 * @param includePositions fill {@link PostingsCursor#positions()}
	 */
	PostingsCursor postings(String field, String term, boolean includePositions) throws IOException;

	/**
	 * Open a new cursor over every document of the index
	 */
	PostingsCursor allDocuments() throws IOException;

	/**
	 * Sorted term dictionary of a field
	 */
	List<String> terms(String field) throws IOException;

	long docCount() throws IOException;

	long docFrequency(String field, String term) throws IOException;

	@Nullable String externalId(BytesRef internalId) throws IOException;
}
