package it.cavallium.searchcore.index;

import java.io.IOException;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

public interface DocumentStore {

	/**
	 * Load a stored document
	 * @return the document, or null if it does not exist
	 */
	@Nullable LLDocument document(BytesRef internalId) throws IOException;
}
