package it.cavallium.searchcore.search.collector;

import it.cavallium.searchcore.utils.SearchException;
import java.time.Duration;

public class SearchTimeoutException extends SearchException {

	private final long collected;

	public SearchTimeoutException(Duration timeout, long collected) {
		super("Search timed out after " + timeout + ", " + collected + " hits collected");
		this.collected = collected;
	}

	public long collected() {
		return collected;
	}
}
