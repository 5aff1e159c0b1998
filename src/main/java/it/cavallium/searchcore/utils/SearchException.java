package it.cavallium.searchcore.utils;

public class SearchException extends IllegalStateException {

	public SearchException(String message) {
		super(message);
	}

	public SearchException(String message, Exception cause) {
		super(message, cause);
	}

	public SearchException(Exception cause) {
		super(cause);
	}

	public SearchException() {
		super();
	}
}
