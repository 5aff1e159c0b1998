package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.NumericTerms;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Matches the documents with a numeric value inside a range. A missing bound leaves that side open
 */
public class NumericRangeSearcher {

	private NumericRangeSearcher() {
	}

	public static Searcher create(IndexReader reader,
			String field,
			@Nullable Double min,
			boolean minInclusive,
			@Nullable Double max,
			boolean maxInclusive,
			double boost,
			SearcherOptions options) throws IOException {
		var terms = expand(reader.terms(field), min, minInclusive, max, maxInclusive);
		return MultiTermSearcher.create(reader, field, terms, boost, options);
	}

	static List<String> expand(List<String> dictionary,
			@Nullable Double min,
			boolean minInclusive,
			@Nullable Double max,
			boolean maxInclusive) {
		// numeric terms sort before every other term, in numeric order
		int start;
		if (min != null) {
			var minTerm = NumericTerms.encode(min);
			start = Collections.binarySearch(dictionary, minTerm);
			if (start < 0) {
				start = -start - 1;
			} else if (!minInclusive) {
				start++;
			}
		} else {
			start = 0;
		}
		var maxTerm = max != null ? NumericTerms.encode(max) : null;
		var terms = new ObjectArrayList<String>();
		for (int i = start; i < dictionary.size(); i++) {
			var term = dictionary.get(i);
			if (!NumericTerms.isNumeric(term)) {
				break;
			}
			if (maxTerm != null) {
				int cmp = term.compareTo(maxTerm);
				if (cmp > 0 || (cmp == 0 && !maxInclusive)) {
					break;
				}
			}
			terms.add(term);
		}
		return terms;
	}
}
