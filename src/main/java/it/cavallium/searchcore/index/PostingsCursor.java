package it.cavallium.searchcore.index;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

/**
 * Forward-only cursor over the postings of a single term, ordered by internal document id
 */
public interface PostingsCursor extends Closeable {

	/**
	 * @return the current document id, or null if the cursor is not positioned or exhausted
	 */
	@Nullable BytesRef docId();

	/**
	 * Move to the next document
	 * @return the new current document id, or null if there are no more documents
	 */
	@Nullable BytesRef nextDoc() throws IOException;

	/**
	 * Move to the first document whose id is greater than or equal to {@code target}.
	 * If the cursor is already positioned on such a document it does not move.
	 * @return the new current document id, or null if there are no more documents
	 */
	@Nullable BytesRef advance(BytesRef target) throws IOException;

	/**
	 * Term frequency in the current document
	 */
	int freq();

	/**
	 * Field length normalization factor of the current document
	 */
	double norm();

	/**
	 * Positions of the term in the current document, empty if positions were not requested
	 */
	List<LLTermPosition> positions();

	/**
	 * Number of documents this cursor can return
	 */
	long cost();
}
