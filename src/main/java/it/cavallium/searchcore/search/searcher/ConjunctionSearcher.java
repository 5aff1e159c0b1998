package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.search.scorer.ConjunctionQueryScorer;
import it.cavallium.searchcore.utils.LLUtils;
import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Matches the documents matched by every child.
 * The children are visited from the most selective one, and each of them is advanced up to the greatest
 * match found so far, until they all agree.
 */
public class ConjunctionSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(ConjunctionSearcher.class);

	private final Searcher[] searchers;
	private final DocumentMatch[] currs;
	private final ConjunctionQueryScorer scorer;
	private final List<DocumentMatch> constituents;
	private int maxIdIdx;
	private boolean initialized;

	public ConjunctionSearcher(List<? extends Searcher> searchers, SearcherOptions options) {
		this.searchers = searchers.toArray(Searcher[]::new);
		// the most selective child drives the iteration
		Arrays.sort(this.searchers, Comparator.comparingLong(Searcher::count));
		this.currs = new DocumentMatch[this.searchers.length];
		this.constituents = Arrays.asList(currs);
		this.scorer = new ConjunctionQueryScorer(options);
		setQueryNorm(queryNorm(weight()));
	}

	private void initSearchers(SearchContext ctx) throws IOException {
		for (int i = 0; i < searchers.length; i++) {
			currs[i] = searchers[i].next(ctx);
		}
		initialized = true;
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		if (!initialized) {
			initSearchers(ctx);
		}
		var pool = ctx.documentMatchPool();
		DocumentMatch rv = null;
		outer:
		while (maxIdIdx < currs.length && currs[maxIdIdx] != null) {
			BytesRef maxId = currs[maxIdIdx].internalId();
			int i = 0;
			while (i < currs.length) {
				if (currs[i] == null) {
					break outer;
				}
				int cmp = maxId.compareTo(currs[i].internalId());
				if (cmp == 0) {
					i++;
					continue;
				}
				if (cmp < 0) {
					// a greater id has been found, every child must reach it
					maxIdIdx = i;
					maxId = currs[i].internalId();
					i = 0;
					continue;
				}
				pool.put(currs[i]);
				currs[i] = null;
				currs[i] = searchers[i].advance(ctx, maxId);
				if (currs[i] == null) {
					break outer;
				}
				if (maxId.compareTo(currs[i].internalId()) != 0) {
					maxIdIdx = i;
					maxId = currs[i].internalId();
					i = 0;
					continue;
				}
				i++;
			}

			// every child is on the same document
			rv = scorer.score(constituents);
			try {
				for (int j = 0; j < searchers.length; j++) {
					if (currs[j] != rv) {
						pool.put(currs[j]);
					}
					currs[j] = null;
					currs[j] = searchers[j].next(ctx);
				}
			} catch (IOException | RuntimeException ex) {
				pool.put(rv);
				throw ex;
			}
			break;
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
			if (currs[i] != null && currs[i].internalId().compareTo(target) >= 0) {
				continue;
			}
			pool.put(currs[i]);
			currs[i] = null;
			currs[i] = searchers[i].advance(ctx, target);
		}
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
		if (searchers.length == 0) {
			return 0;
		}
		long min = Long.MAX_VALUE;
		for (Searcher searcher : searchers) {
			min = Math.min(min, searcher.count());
		}
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
		long sizeInBytes = BASE_RAM_BYTES_USED + 2L * RamUsageEstimator.NUM_BYTES_ARRAY_HEADER
				+ 2L * searchers.length * RamUsageEstimator.NUM_BYTES_OBJECT_REF;
		for (Searcher searcher : searchers) {
			sizeInBytes += searcher.ramBytesUsed();
		}
		return sizeInBytes;
	}

	@Override
	public String toString() {
		return "ConjunctionSearcher" + Arrays.toString(searchers);
	}
}
