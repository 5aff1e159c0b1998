package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.search.scorer.ConjunctionQueryScorer;
import it.cavallium.searchcore.utils.LLUtils;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Combination of a required clause, an optional clause and an excluded clause.
 * <p>
 * The candidates come from {@code must}, or from {@code should} when {@code must} is missing.
 * When both are present, {@code should} only adds to the score, unless its {@link Searcher#min()} is greater than
 * zero: in that case it's required too. Documents matched by {@code mustNot} are never returned.
 * Without {@code must} and {@code should} nothing matches.
 */
public class BooleanSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(BooleanSearcher.class);

	private final @Nullable Searcher mustSearcher;
	private final @Nullable Searcher shouldSearcher;
	private final @Nullable Searcher mustNotSearcher;
	private final ConjunctionQueryScorer scorer;
	private final DocumentMatch[] matches = new DocumentMatch[2];
	private @Nullable DocumentMatch currMust;
	private @Nullable DocumentMatch currShould;
	private @Nullable DocumentMatch currMustNot;
	private boolean initialized;

	public BooleanSearcher(@Nullable Searcher mustSearcher,
			@Nullable Searcher shouldSearcher,
			@Nullable Searcher mustNotSearcher,
			SearcherOptions options) {
		this.mustSearcher = mustSearcher;
		this.shouldSearcher = shouldSearcher;
		this.mustNotSearcher = mustNotSearcher;
		this.scorer = new ConjunctionQueryScorer(options);
		setQueryNorm(queryNorm(weight()));
	}

	private void initSearchers(SearchContext ctx) throws IOException {
		if (mustSearcher != null) {
			currMust = mustSearcher.next(ctx);
		}
		if (shouldSearcher != null) {
			currShould = shouldSearcher.next(ctx);
		}
		if (mustNotSearcher != null) {
			currMustNot = mustNotSearcher.next(ctx);
		}
		initialized = true;
	}

	/**
	 * Internal id of the current candidate, or null if there are no more candidates
	 */
	private @Nullable BytesRef currentId() {
		if (mustSearcher != null) {
			return currMust != null ? currMust.internalId() : null;
		} else {
			return currShould != null ? currShould.internalId() : null;
		}
	}

	/**
	 * Move to the next candidate
	 *
	 * @param skipReturn match that has been returned to the caller, it must not be released
	 */
	private void advanceNextMust(SearchContext ctx, @Nullable DocumentMatch skipReturn) throws IOException {
		var pool = ctx.documentMatchPool();
		if (mustSearcher != null) {
			if (currMust != skipReturn) {
				pool.put(currMust);
			}
			currMust = null;
			currMust = mustSearcher.next(ctx);
		} else if (shouldSearcher != null) {
			if (currShould != skipReturn) {
				pool.put(currShould);
			}
			currShould = null;
			currShould = shouldSearcher.next(ctx);
		}
	}

	private DocumentMatch scoreWithShould() {
		List<DocumentMatch> constituents;
		if (currMust != null) {
			matches[0] = currMust;
			matches[1] = currShould;
			constituents = Arrays.asList(matches);
		} else {
			constituents = List.of(Objects.requireNonNull(currShould));
		}
		return scorer.score(constituents);
	}

	private DocumentMatch scoreMustOnly() {
		return scorer.score(List.of(Objects.requireNonNull(currMust)));
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		if (!initialized) {
			initSearchers(ctx);
		}
		var pool = ctx.documentMatchPool();
		DocumentMatch rv = null;
		BytesRef currentId;
		while ((currentId = currentId()) != null) {
			if (currMustNot != null) {
				int cmp = currMustNot.internalId().compareTo(currentId);
				if (cmp < 0) {
					pool.put(currMustNot);
					currMustNot = null;
					currMustNot = Objects.requireNonNull(mustNotSearcher).advance(ctx, currentId);
					if (currMustNot != null && currMustNot.internalId().equals(currentId)) {
						// the candidate is excluded
						advanceNextMust(ctx, null);
						continue;
					}
				} else if (cmp == 0) {
					// the candidate is excluded
					advanceNextMust(ctx, null);
					continue;
				}
			}

			// 1 also when there are no more optional matches
			int shouldCmpOrNull = 1;
			if (currShould != null) {
				shouldCmpOrNull = currShould.internalId().compareTo(currentId);
			}

			if (shouldCmpOrNull < 0) {
				var shouldSearcher = Objects.requireNonNull(this.shouldSearcher);
				pool.put(currShould);
				currShould = null;
				currShould = shouldSearcher.advance(ctx, currentId);
				if (currShould != null && currShould.internalId().equals(currentId)) {
					rv = scoreWithShould();
					advanceNextMust(ctx, rv);
					break;
				} else if (shouldSearcher.min() == 0) {
					rv = scoreMustOnly();
					advanceNextMust(ctx, rv);
					break;
				}
			} else if (shouldCmpOrNull == 0) {
				rv = scoreWithShould();
				advanceNextMust(ctx, rv);
				break;
			} else if (shouldSearcher == null || shouldSearcher.min() == 0) {
				if (currMust != null) {
					rv = scoreMustOnly();
					advanceNextMust(ctx, rv);
					break;
				}
			}

			advanceNextMust(ctx, null);
		}
		return rv;
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException {
		if (!initialized) {
			initSearchers(ctx);
		}
		var pool = ctx.documentMatchPool();
		var currentId = currentId();
		if (currentId != null && currentId.compareTo(target) < 0) {
			if (currMust != null) {
				pool.put(currMust);
				currMust = null;
				currMust = Objects.requireNonNull(mustSearcher).advance(ctx, target);
			}
			if (currShould != null && currShould.internalId().compareTo(target) < 0) {
				pool.put(currShould);
				currShould = null;
				currShould = Objects.requireNonNull(shouldSearcher).advance(ctx, target);
			}
			if (currMustNot != null && currMustNot.internalId().compareTo(target) < 0) {
				pool.put(currMustNot);
				currMustNot = null;
				currMustNot = Objects.requireNonNull(mustNotSearcher).advance(ctx, target);
			}
		}
		return nextMatch(ctx);
	}

	private Stream<Searcher> children() {
		return Stream.of(mustSearcher, shouldSearcher, mustNotSearcher).filter(Objects::nonNull);
	}

	@Override
	public double weight() {
		double sum = 0;
		if (mustSearcher != null) {
			sum += mustSearcher.weight();
		}
		if (shouldSearcher != null) {
			sum += shouldSearcher.weight();
		}
		return sum;
	}

	@Override
	public void setQueryNorm(double queryNorm) {
		children().forEach(searcher -> searcher.setQueryNorm(queryNorm));
	}

	@Override
	public long count() {
		if (mustSearcher != null) {
			return mustSearcher.count();
		} else if (shouldSearcher != null) {
			return shouldSearcher.count();
		} else {
			return 0;
		}
	}

	@Override
	public int documentMatchPoolSize() {
		return 3 + children().mapToInt(Searcher::documentMatchPoolSize).sum();
	}

	@Override
	protected void doClose() throws IOException {
		LLUtils.closeAll(children().toList());
	}

	@Override
	protected long searcherRamBytesUsed() {
		return BASE_RAM_BYTES_USED + children().mapToLong(Searcher::ramBytesUsed).sum();
	}

	@Override
	public String toString() {
		return "BooleanSearcher[must=" + mustSearcher + ", should=" + shouldSearcher + ", mustNot=" + mustNotSearcher
				+ "]";
	}
}
