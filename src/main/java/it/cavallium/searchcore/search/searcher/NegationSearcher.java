package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.utils.LLUtils;
import java.io.IOException;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Matches the documents of {@code universe} that are not matched by {@code excluded}.
 * The excluded searcher is advanced only up to the current candidate, and its scores are ignored.
 */
public class NegationSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(NegationSearcher.class);

	private final Searcher universe;
	private final Searcher excluded;
	private @Nullable DocumentMatch currExcluded;
	private boolean excludedExhausted;

	public NegationSearcher(Searcher universe, Searcher excluded) {
		this.universe = universe;
		this.excluded = excluded;
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		return skipExcluded(ctx, universe.next(ctx));
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException {
		return skipExcluded(ctx, universe.advance(ctx, target));
	}

	private @Nullable DocumentMatch skipExcluded(SearchContext ctx, @Nullable DocumentMatch candidate)
			throws IOException {
		var pool = ctx.documentMatchPool();
		while (candidate != null) {
			if (!isExcluded(ctx, candidate.internalId())) {
				return candidate;
			}
			pool.put(candidate);
			candidate = universe.next(ctx);
		}
		return null;
	}

	private boolean isExcluded(SearchContext ctx, BytesRef candidateId) throws IOException {
		if (excludedExhausted) {
			return false;
		}
		if (currExcluded == null || currExcluded.internalId().compareTo(candidateId) < 0) {
			ctx.documentMatchPool().put(currExcluded);
			currExcluded = null;
			currExcluded = excluded.advance(ctx, candidateId);
			if (currExcluded == null) {
				excludedExhausted = true;
				return false;
			}
		}
		return currExcluded.internalId().compareTo(candidateId) == 0;
	}

	@Override
	public double weight() {
		return universe.weight();
	}

	@Override
	public void setQueryNorm(double queryNorm) {
		universe.setQueryNorm(queryNorm);
	}

	@Override
	public long count() {
		return universe.count();
	}

	@Override
	public int documentMatchPoolSize() {
		return 2 + universe.documentMatchPoolSize() + excluded.documentMatchPoolSize();
	}

	@Override
	protected void doClose() throws IOException {
		LLUtils.closeAll(universe, excluded);
	}

	@Override
	protected long searcherRamBytesUsed() {
		return BASE_RAM_BYTES_USED + universe.ramBytesUsed() + excluded.ramBytesUsed();
	}

	@Override
	public String toString() {
		return "NegationSearcher[" + universe + " - " + excluded + "]";
	}
}
