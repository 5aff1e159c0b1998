package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

public class MatchNoneSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(MatchNoneSearcher.class);

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) {
		return null;
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) {
		return null;
	}

	@Override
	public double weight() {
		return 0;
	}

	@Override
	public void setQueryNorm(double queryNorm) {
	}

	@Override
	public long count() {
		return 0;
	}

	@Override
	public int documentMatchPoolSize() {
		return 0;
	}

	@Override
	protected void doClose() {
	}

	@Override
	protected long searcherRamBytesUsed() {
		return BASE_RAM_BYTES_USED;
	}

	@Override
	public String toString() {
		return "MatchNoneSearcher";
	}
}
