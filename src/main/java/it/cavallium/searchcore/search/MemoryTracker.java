package it.cavallium.searchcore.search;

/**
 * Cumulative count of the bytes attributed to the construction of the results of a single query.
 * It is a meter, not a quota: limits are enforced by whoever reads {@link #usage()}.
 * Not thread safe.
 */
public final class MemoryTracker {

	private long bytes;

	/**
	 * @param bytes unsigned number of bytes. The total saturates at {@link Long#MAX_VALUE}
	 */
	public void add(long bytes) {
		if (bytes < 0 || this.bytes > Long.MAX_VALUE - bytes) {
			this.bytes = Long.MAX_VALUE;
		} else {
			this.bytes += bytes;
		}
	}

	public long usage() {
		return bytes;
	}

	@Override
	public String toString() {
		return "MemoryTracker[" + "bytes=" + bytes + ']';
	}
}
