package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.search.scorer.DisjunctionQueryScorer;
import it.cavallium.searchcore.utils.LLUtils;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Matches the documents matched by at least {@code min} children.
 * Each step collects the children positioned on the smallest internal id, then moves all of them forward.
 */
public class DisjunctionSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(DisjunctionSearcher.class);

	private final Searcher[] searchers;
	private final DocumentMatch[] currs;
	private final int min;
	private final DisjunctionQueryScorer scorer;
	private final ObjectArrayList<DocumentMatch> matching;
	private final IntArrayList matchingIdxs;
	private int remaining;
	private boolean initialized;

	public DisjunctionSearcher(List<? extends Searcher> searchers, int min, SearcherOptions options) {
		if (min < 0) {
			throw new IllegalArgumentException("Minimum number of matching clauses must not be negative, got " + min);
		}
		this.searchers = searchers.toArray(Searcher[]::new);
		this.currs = new DocumentMatch[this.searchers.length];
		this.min = min;
		this.scorer = new DisjunctionQueryScorer(options);
		this.matching = new ObjectArrayList<>(this.searchers.length);
		this.matchingIdxs = new IntArrayList(this.searchers.length);
		setQueryNorm(queryNorm(weight()));
	}

	private void initSearchers(SearchContext ctx) throws IOException {
		for (int i = 0; i < searchers.length; i++) {
			currs[i] = searchers[i].next(ctx);
		}
		updateMatches();
		initialized = true;
	}

	/**
	 * Find the children positioned on the smallest internal id
	 */
	private void updateMatches() {
		matching.clear();
		matchingIdxs.clear();
		remaining = 0;
		for (int i = 0; i < currs.length; i++) {
			var curr = currs[i];
			if (curr == null) {
				continue;
			}
			remaining++;
			if (!matching.isEmpty()) {
				int cmp = curr.internalId().compareTo(matching.get(0).internalId());
				if (cmp > 0) {
					continue;
				}
				if (cmp < 0) {
					matching.clear();
					matchingIdxs.clear();
				}
			}
			matching.add(curr);
			matchingIdxs.add(i);
		}
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		if (!initialized) {
			initSearchers(ctx);
		}
		var pool = ctx.documentMatchPool();
		DocumentMatch rv = null;
		boolean found = false;
		while (!found && !matching.isEmpty() && remaining >= min) {
			if (matching.size() >= min) {
				found = true;
				rv = scorer.score(matching, matching.size(), searchers.length);
			}
			try {
				for (int k = 0; k < matchingIdxs.size(); k++) {
					int i = matchingIdxs.getInt(k);
					if (currs[i] != rv) {
						pool.put(currs[i]);
					}
					currs[i] = null;
					currs[i] = searchers[i].next(ctx);
				}
			} catch (IOException | RuntimeException ex) {
				pool.put(rv);
				throw ex;
			}
			updateMatches();
		}
		return rv;
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException {
		if (!initialized) {
			initSearchers(ctx);
		}
		var pool = ctx.documentMatchPool();
		for (int i = 0; i < searchers.length; i++) {
			if (currs[i] != null) {
				if (currs[i].internalId().compareTo(target) >= 0) {
					continue;
				}
				pool.put(currs[i]);
				currs[i] = null;
				currs[i] = searchers[i].advance(ctx, target);
			}
		}
		updateMatches();
		return nextMatch(ctx);
	}

	@Override
	public double weight() {
		double sum = 0;
		for (Searcher searcher : searchers) {
			sum += searcher.weight();
		}
		return sum;
	}

	@Override
	public void setQueryNorm(double queryNorm) {
		for (Searcher searcher : searchers) {
			searcher.setQueryNorm(queryNorm);
		}
	}

	@Override
	public long count() {
		long sum = 0;
		for (Searcher searcher : searchers) {
			sum += searcher.count();
		}
		return sum;
	}

	@Override
	public int min() {
		return min;
	}

	@Override
	public int documentMatchPoolSize() {
		int size = currs.length;
		for (Searcher searcher : searchers) {
			size += searcher.documentMatchPoolSize();
		}
		return size;
	}

	@Override
	protected void doClose() throws IOException {
		LLUtils.closeAll(Arrays.asList(searchers));
	}

	@Override
	protected long searcherRamBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED + 4L * RamUsageEstimator.NUM_BYTES_ARRAY_HEADER
				+ 3L * searchers.length * RamUsageEstimator.NUM_BYTES_OBJECT_REF + (long) searchers.length * Integer.BYTES;
		for (Searcher searcher : searchers) {
			sizeInBytes += searcher.ramBytesUsed();
		}
		return sizeInBytes;
	}

	@Override
	public String toString() {
		return "DisjunctionSearcher(min=" + min + ")" + Arrays.toString(searchers);
	}
}
