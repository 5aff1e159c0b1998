package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Matches the documents containing any term that starts with a prefix
 */
public class PrefixSearcher {

	private PrefixSearcher() {
	}

	public static Searcher create(IndexReader reader, String field, String prefix, double boost, SearcherOptions options)
			throws IOException {
		return MultiTermSearcher.create(reader, field, expand(reader.terms(field), prefix), boost, options);
	}

	static List<String> expand(List<String> dictionary, String prefix) {
		int start = Collections.binarySearch(dictionary, prefix);
		if (start < 0) {
			start = -start - 1;
		}
		var terms = new ObjectArrayList<String>();
		for (int i = start; i < dictionary.size(); i++) {
			var term = dictionary.get(i);
			if (!term.startsWith(prefix)) {
				break;
			}
			terms.add(term);
		}
		return terms;
	}
}
