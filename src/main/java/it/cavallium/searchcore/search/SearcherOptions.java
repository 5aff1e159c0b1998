package it.cavallium.searchcore.search;

import io.soabase.recordbuilder.core.RecordBuilder;

/**
 * @param explain            build an {@link Explanation} for every match
 * @param includeTermVectors fill the term locations of every match
 */
@RecordBuilder
public record SearcherOptions(boolean explain, boolean includeTermVectors) {

	public static final SearcherOptions DEFAULT = new SearcherOptions(false, false);

	public SearcherOptions withTermVectors() {
		return includeTermVectors ? this : new SearcherOptions(explain, true);
	}
}
