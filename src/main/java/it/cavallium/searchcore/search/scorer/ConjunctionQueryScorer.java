package it.cavallium.searchcore.search.scorer;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Explanation;
import it.cavallium.searchcore.search.SearcherOptions;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.List;

/**
 * Sums the scores of the children that matched the same document
 */
public class ConjunctionQueryScorer {

	private final SearcherOptions options;

	public ConjunctionQueryScorer(SearcherOptions options) {
		this.options = options;
	}

	/**
	 * Combine the constituents into the first of them, which is returned.
	 * The other constituents are left untouched, the caller must release them.
	 */
	public DocumentMatch score(List<DocumentMatch> constituents) {
		double sum = 0;
		List<Explanation> childExplanations = options.explain() ? new ObjectArrayList<>(constituents.size()) : null;
		for (DocumentMatch constituent : constituents) {
			sum += constituent.score();
			if (childExplanations != null && constituent.explanation() != null) {
				childExplanations.add(constituent.explanation());
			}
		}

		var match = constituents.get(0);
		match.setScore(sum);
		if (childExplanations != null) {
			match.setExplanation(new Explanation(sum, "sum of:", childExplanations));
		}
		ScorerUtils.mergeLocations(match, constituents);
		return match;
	}
}
