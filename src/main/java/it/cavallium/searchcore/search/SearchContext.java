package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.SEARCH_CONTEXT;

import org.apache.lucene.util.Accountable;

/**
 * State of a single query execution, shared by every searcher of the tree
 */
public final class SearchContext implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(SEARCH_CONTEXT);

	private final DocumentMatchPool documentMatchPool;
	private final MemoryTracker memoryTracker;

	public SearchContext(DocumentMatchPool documentMatchPool) {
		this(documentMatchPool, new MemoryTracker());
	}

	public SearchContext(DocumentMatchPool documentMatchPool, MemoryTracker memoryTracker) {
		this.documentMatchPool = documentMatchPool;
		this.memoryTracker = memoryTracker;
	}

	/**
	 * Create a context whose pool is big enough for the whole searcher tree, plus some matches retained by the caller
	 */
	public static SearchContext forSearcher(Searcher searcher, int retainedMatches, int sortSize) {
		return new SearchContext(new DocumentMatchPool(searcher.documentMatchPoolSize() + retainedMatches, sortSize));
	}

	public DocumentMatchPool documentMatchPool() {
		return documentMatchPool;
	}

	public MemoryTracker memoryTracker() {
		return memoryTracker;
	}

	@Override
	public long ramBytesUsed() {
		return BASE_RAM_BYTES_USED + documentMatchPool.ramBytesUsed();
	}
}
