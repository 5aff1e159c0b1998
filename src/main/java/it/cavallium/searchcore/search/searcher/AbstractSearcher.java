package it.cavallium.searchcore.search.searcher;

import static it.cavallium.searchcore.utils.LLUtils.MARKER_SEARCH;

import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.utils.SimpleResource;
import java.io.IOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

/**
 * Base of every searcher.
 * <p>
 * Implements the parts of the iteration protocol that are common to every variant: cancellation after close,
 * permanent exhaustion, and the replay of the last match when {@link #advance} is called with a target that is not
 * after it.
 */
public abstract class AbstractSearcher extends SimpleResource implements Searcher {

	private static final Logger LOG = LogManager.getLogger(AbstractSearcher.class);

	/**
	 * Snapshot of the last returned match. It's never released to a pool
	 */
	private final DocumentMatch lastMatch = new DocumentMatch();
	private boolean hasLastMatch;
	private boolean exhausted;

	@Override
	public final @Nullable DocumentMatch next(SearchContext ctx) throws IOException {
		if (isClosed() || exhausted) {
			return null;
		}
		return onMatch(nextMatch(ctx));
	}

	@Override
	public final @Nullable DocumentMatch advance(SearchContext ctx, BytesRef target) throws IOException {
		if (isClosed() || exhausted) {
			return null;
		}
		if (hasLastMatch && target.compareTo(lastMatch.internalId()) <= 0) {
			return ctx.documentMatchPool().get().copyFrom(lastMatch);
		}
		return onMatch(advanceMatch(ctx, target));
	}

	private @Nullable DocumentMatch onMatch(@Nullable DocumentMatch match) {
		if (match == null) {
			exhausted = true;
			return null;
		}
		assert !hasLastMatch || match.internalId().compareTo(lastMatch.internalId()) > 0
				: "Matches out of order: " + match + " after " + lastMatch;
		lastMatch.copyFrom(match);
		hasLastMatch = true;
		return match;
	}

	/**
	 * @return the next match, or null if there are no more matches
	 */
	protected abstract @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException;

	/**
	 * Called only with targets greater than the last returned match
	 *
	 * @return the first match greater than or equal to the target, or null if there are no more matches
	 */
	protected abstract @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException;

	/**
	 * Release the resources of this searcher. Called once
	 */
	protected abstract void doClose() throws IOException;

	/**
	 * Heap usage of this searcher and of its children, excluding the replay buffer
	 */
	protected abstract long searcherRamBytesUsed();

	@Override
	protected final void onClose() throws IOException {
		LOG.trace(MARKER_SEARCH, "Closing {}", this);
		doClose();
	}

	@Override
	public int min() {
		return 0;
	}

	@Override
	public final long ramBytesUsed() {
		return searcherRamBytesUsed() + lastMatch.ramBytesUsed();
	}

	/**
	 * Compute the normalization factor of a query, given the sum of the squared weights of its clauses
	 */
	protected static double queryNorm(double sumOfSquaredWeights) {
		double queryNorm = 1.0 / Math.sqrt(sumOfSquaredWeights);
		if (Double.isInfinite(queryNorm) || Double.isNaN(queryNorm)) {
			return 1.0;
		}
		return queryNorm;
	}
}
