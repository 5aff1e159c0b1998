package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.DOCUMENT_MATCH_POOL;
import static it.cavallium.searchcore.utils.LLUtils.MARKER_POOL;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.Accountable;
import org.jetbrains.annotations.Nullable;

/**
 * Recycles {@link DocumentMatch} instances during the execution of a single query.
 * <p>
 * A match obtained with {@link #get()} belongs to the caller until it's given back with {@link #put(DocumentMatch)}.
 * Not thread safe: a pool must not be shared between concurrent queries.
 */
public class DocumentMatchPool implements Accountable {

	private static final Logger LOG = LogManager.getLogger(DocumentMatchPool.class);
	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(DOCUMENT_MATCH_POOL);

	/**
	 * Detect the usage of matches that have been released
	 */
	public static final boolean POOL_CHECKS
			= Boolean.parseBoolean(System.getProperty("it.cavallium.searchcore.pool.checks", "true"));

	private final ObjectArrayList<DocumentMatch> available;
	private final int sortSize;
	private long allocated;
	private boolean grown;

	/**
	 * @param size     number of matches to preallocate
	 * @param sortSize expected number of sort values of each match
	 */
	public DocumentMatchPool(int size, int sortSize) {
		if (size < 0) {
			throw new IllegalArgumentException("Pool size must be positive, got " + size);
		}
		this.sortSize = sortSize;
		this.available = new ObjectArrayList<>(size);
		for (int i = 0; i < size; i++) {
			available.add(allocate());
		}
	}

	private DocumentMatch allocate() {
		var match = new DocumentMatch(sortSize);
		match.pooled = true;
		allocated++;
		return match;
	}

	/**
	 * Get a cleared match. If the pool is empty a new match is allocated
	 */
	public DocumentMatch get() {
		DocumentMatch match;
		if (available.isEmpty()) {
			if (!grown) {
				grown = true;
				LOG.debug(MARKER_POOL, "Pool exhausted after {} preallocated matches, allocating more", allocated);
			}
			match = allocate();
		} else {
			match = available.pop();
		}
		match.pooled = false;
		return match;
	}

	/**
	 * Give a match back to the pool. The caller must not use the match anymore
	 *
	 * @throws IllegalStateException if the match is already in the pool
	 */
	public void put(@Nullable DocumentMatch match) {
		if (match == null) {
			return;
		}
		if (match.pooled) {
			throw new IllegalStateException("DocumentMatch " + match + " has already been released");
		}
		match.reset();
		match.pooled = true;
		available.push(match);
	}

	/**
	 * Number of matches ready to be reused
	 */
	public int available() {
		return available.size();
	}

	/**
	 * Number of matches allocated by this pool since its creation
	 */
	public long allocated() {
		return allocated;
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED + available.size() * HeapOverhead.SIZE_OF_REFERENCE;
		for (DocumentMatch match : available) {
			sizeInBytes += match.ramBytesUsed();
		}
		return sizeInBytes;
	}

	@Override
	public String toString() {
		return "DocumentMatchPool[" + "available=" + available.size() + ", allocated=" + allocated + ']';
	}
}
