package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.List;
import org.apache.lucene.util.automaton.CharacterRunAutomaton;
import org.apache.lucene.util.automaton.LevenshteinAutomata;

/**
 * Matches the documents containing any term within a maximum edit distance from the given term
 */
public class FuzzySearcher {

	public static final int MAX_EDITS = LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE;

	private FuzzySearcher() {
	}

	/**
	 * @param maxEdits     maximum Levenshtein distance, from 0 to {@link #MAX_EDITS}
	 * @param prefixLength number of leading characters that must match exactly
	 */
	public static Searcher create(IndexReader reader,
			String field,
			String term,
			int maxEdits,
			int prefixLength,
			double boost,
			SearcherOptions options) throws IOException {
		if (maxEdits < 0 || maxEdits > MAX_EDITS) {
			throw new IllegalArgumentException("Max edits must be between 0 and " + MAX_EDITS + ", got " + maxEdits);
		}
		if (prefixLength < 0) {
			throw new IllegalArgumentException("Prefix length must not be negative, got " + prefixLength);
		}
		return MultiTermSearcher.create(reader, field, expand(reader.terms(field), term, maxEdits, prefixLength), boost,
				options);
	}

	static List<String> expand(List<String> dictionary, String term, int maxEdits, int prefixLength) {
		var prefix = term.substring(0, Math.min(prefixLength, term.length()));
		List<String> candidates = prefix.isEmpty() ? dictionary : PrefixSearcher.expand(dictionary, prefix);
		var automaton = new LevenshteinAutomata(term.substring(prefix.length()), false).toAutomaton(maxEdits, prefix);
		var runAutomaton = new CharacterRunAutomaton(automaton);
		var terms = new ObjectArrayList<String>();
		for (String candidate : candidates) {
			if (runAutomaton.run(candidate)) {
				terms.add(candidate);
			}
		}
		return terms;
	}
}
