package it.cavallium.searchcore.search.scorer;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Explanation;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.SearcherOptions;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

/**
 * Gives the same score to every document
 */
public class ConstantScorer {

	private final double constant;
	private final double boost;
	private final SearcherOptions options;
	private double queryNorm;
	private double queryWeight = 1.0;
	private @Nullable Explanation queryWeightExplanation;

	public ConstantScorer(double constant, double boost, SearcherOptions options) {
		this.constant = constant;
		this.boost = boost;
		this.options = options;
	}

	public double weight() {
		return boost * boost;
	}

	public void setQueryNorm(double queryNorm) {
		this.queryNorm = queryNorm;
		this.queryWeight = boost * queryNorm;
		if (options.explain()) {
			this.queryWeightExplanation = Explanation.of(queryWeight, "weight(^" + boost + "), product of:",
					Explanation.of(boost, "boost"),
					Explanation.of(queryNorm, "queryNorm")
			);
		}
	}

	public DocumentMatch score(SearchContext ctx, BytesRef internalId) {
		double score = constant;
		Explanation scoreExplanation = null;
		if (options.explain()) {
			scoreExplanation = Explanation.of(score, "ConstantScore()");
		}

		// if the query weight isn't 1, multiply
		if (queryWeight != 1.0) {
			score = score * queryWeight;
			if (options.explain()) {
				scoreExplanation = Explanation.of(score, "weight(^" + boost + "), product of:",
						queryWeightExplanation,
						scoreExplanation
				);
			}
		}

		var match = ctx.documentMatchPool().get();
		match.setInternalId(internalId);
		match.setScore(score);
		if (scoreExplanation != null) {
			match.setExplanation(scoreExplanation);
		}
		return match;
	}
}
