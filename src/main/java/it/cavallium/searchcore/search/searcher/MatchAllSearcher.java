package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.PostingsCursor;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.search.scorer.ConstantScorer;
import it.cavallium.searchcore.utils.LLUtils;
import java.io.IOException;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

public class MatchAllSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(MatchAllSearcher.class)
			+ RamUsageEstimator.shallowSizeOfInstance(ConstantScorer.class);

	private final PostingsCursor cursor;
	private final ConstantScorer scorer;
	private final long count;

	public MatchAllSearcher(IndexReader reader, double boost, SearcherOptions options) throws IOException {
		var cursor = reader.allDocuments();
		try {
			this.count = reader.docCount();
		} catch (IOException | RuntimeException ex) {
			LLUtils.closeAfterFailure(ex, List.of(cursor));
			throw ex;
		}
		this.cursor = cursor;
		this.scorer = new ConstantScorer(1.0, boost, options);
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		var docId = cursor.nextDoc();
		if (docId == null) {
			return null;
		}
		return scorer.score(ctx, docId);
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException {
		var docId = cursor.advance(target);
		if (docId == null) {
			return null;
		}
		return scorer.score(ctx, docId);
	}

	@Override
	public double weight() {
		return scorer.weight();
	}

	@Override
	public void setQueryNorm(double queryNorm) {
		scorer.setQueryNorm(queryNorm);
	}

	@Override
	public long count() {
		return count;
	}

	@Override
	public int documentMatchPoolSize() {
		return 1;
	}

	@Override
	protected void doClose() throws IOException {
		cursor.close();
	}

	@Override
	protected long searcherRamBytesUsed() {
		return BASE_RAM_BYTES_USED;
	}

	@Override
	public String toString() {
		return "MatchAllSearcher";
	}
}
