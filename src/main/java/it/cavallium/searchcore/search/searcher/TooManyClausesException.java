package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.utils.SearchException;

public class TooManyClausesException extends SearchException {

	private final int clauses;
	private final int maxClauseCount;

	public TooManyClausesException(int clauses, int maxClauseCount) {
		super("Too many clauses: " + clauses + " > " + maxClauseCount);
		this.clauses = clauses;
		this.maxClauseCount = maxClauseCount;
	}

	public int clauses() {
		return clauses;
	}

	public int maxClauseCount() {
		return maxClauseCount;
	}
}
