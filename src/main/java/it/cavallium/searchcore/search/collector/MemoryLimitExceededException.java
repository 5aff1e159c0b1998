package it.cavallium.searchcore.search.collector;

import it.cavallium.searchcore.utils.SearchException;

public class MemoryLimitExceededException extends SearchException {

	private final long usage;
	private final long limit;

	public MemoryLimitExceededException(long usage, long limit) {
		super("Query memory usage " + usage + " bytes exceeds the limit of " + limit + " bytes");
		this.usage = usage;
		this.limit = limit;
	}

	public long usage() {
		return usage;
	}

	public long limit() {
		return limit;
	}
}
