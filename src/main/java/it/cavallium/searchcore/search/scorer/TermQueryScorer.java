package it.cavallium.searchcore.search.scorer;

import it.cavallium.searchcore.index.LLTermPosition;
import it.cavallium.searchcore.index.PostingsCursor;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Explanation;
import it.cavallium.searchcore.search.Location;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.SearcherOptions;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * tf-idf scoring of a single term
 */
public class TermQueryScorer {

	public static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(TermQueryScorer.class);

	private static final int MAX_SQRT_CACHE = 64;
	private static final double[] SQRT_CACHE = new double[MAX_SQRT_CACHE];

	static {
		for (int i = 0; i < MAX_SQRT_CACHE; i++) {
			SQRT_CACHE[i] = Math.sqrt(i);
		}
	}

	private final String queryTerm;
	private final String queryField;
	private final double queryBoost;
	private final long docTerm;
	private final long docTotal;
	private final double idf;
	private final SearcherOptions options;
	private final @Nullable Explanation idfExplanation;
	private double queryNorm;
	private double queryWeight = 1.0;
	private @Nullable Explanation queryWeightExplanation;

	public TermQueryScorer(String queryTerm,
			String queryField,
			double queryBoost,
			long docTotal,
			long docTerm,
			SearcherOptions options) {
		this.queryTerm = queryTerm;
		this.queryField = queryField;
		this.queryBoost = queryBoost;
		this.docTerm = docTerm;
		this.docTotal = docTotal;
		this.idf = 1.0 + Math.log((double) docTotal / (docTerm + 1.0));
		this.options = options;
		if (options.explain()) {
			this.idfExplanation = Explanation.of(idf, "idf(docFreq=" + docTerm + ", maxDocs=" + docTotal + ")");
		} else {
			this.idfExplanation = null;
		}
	}

	public double weight() {
		double sum = queryBoost * idf;
		return sum * sum;
	}

	public void setQueryNorm(double queryNorm) {
		this.queryNorm = queryNorm;
		this.queryWeight = queryBoost * idf * queryNorm;
		if (options.explain()) {
			this.queryWeightExplanation = Explanation.of(queryWeight,
					"queryWeight(" + queryField + ":" + queryTerm + "^" + queryBoost + "), product of:",
					Explanation.of(queryBoost, "boost"),
					idfExplanation,
					Explanation.of(queryNorm, "queryNorm")
			);
		}
	}

	public long docTerm() {
		return docTerm;
	}

	/**
	 * Score the document the cursor is positioned on
	 */
	public DocumentMatch score(SearchContext ctx, BytesRef internalId, PostingsCursor cursor) {
		int freq = cursor.freq();
		double norm = cursor.norm();
		double tf = freq < MAX_SQRT_CACHE ? SQRT_CACHE[freq] : Math.sqrt(freq);
		double score = tf * norm * idf;

		Explanation scoreExplanation = null;
		if (options.explain()) {
			scoreExplanation = Explanation.of(score,
					"fieldWeight(" + queryField + ":" + queryTerm + " in " + ctxId(internalId) + "), product of:",
					Explanation.of(tf, "tf(termFreq(" + queryField + ":" + queryTerm + ")=" + freq + ")"),
					Explanation.of(norm, "fieldNorm(field=" + queryField + ", doc=" + ctxId(internalId) + ")"),
					idfExplanation
			);
		}

		// if the query weight isn't 1, multiply
		if (queryWeight != 1.0) {
			score = score * queryWeight;
			if (options.explain()) {
				scoreExplanation = Explanation.of(score,
						"weight(" + queryField + ":" + queryTerm + "^" + queryBoost + " in " + ctxId(internalId)
								+ "), product of:",
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

		List<LLTermPosition> positions = cursor.positions();
		if (options.includeTermVectors() && !positions.isEmpty()) {
			var termLocations = match.locationsOrCreate().field(queryField);
			for (LLTermPosition position : positions) {
				termLocations.addLocation(queryTerm,
						new Location(position.pos(), position.start(), position.end(), position.arrayPositions())
				);
			}
		}
		return match;
	}

	private static String ctxId(BytesRef internalId) {
		return internalId.toString();
	}
}
