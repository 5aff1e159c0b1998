package it.cavallium.searchcore.search.scorer;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Explanation;
import it.cavallium.searchcore.search.SearcherOptions;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.List;

/**
 * Sums the scores of the children that matched the same document,
 * scaled by the fraction of children that matched
 */
public class DisjunctionQueryScorer {

	private final SearcherOptions options;

	public DisjunctionQueryScorer(SearcherOptions options) {
		this.options = options;
	}

	/**
	 * Combine the constituents into the first of them, which is returned.
	 * The other constituents are left untouched, the caller must release them.
	 */
	public DocumentMatch score(List<DocumentMatch> constituents, int countMatch, int countTotal) {
		double sum = 0;
		List<Explanation> childExplanations = options.explain() ? new ObjectArrayList<>(constituents.size()) : null;
		for (DocumentMatch constituent : constituents) {
			sum += constituent.score();
			if (childExplanations != null && constituent.explanation() != null) {
				childExplanations.add(constituent.explanation());
			}
		}

		double coord = (double) countMatch / (double) countTotal;
		double score = sum * coord;

		var match = constituents.get(0);
		match.setScore(score);
		if (childExplanations != null) {
			var sumExplanation = new Explanation(sum, "sum of:", childExplanations);
			var coordExplanation = Explanation.of(coord, "coord(" + countMatch + "/" + countTotal + ")");
			match.setExplanation(Explanation.of(score, "product of:", sumExplanation, coordExplanation));
		}
		ScorerUtils.mergeLocations(match, constituents);
		return match;
	}
}
