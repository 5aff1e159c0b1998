package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.PostingsCursor;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.search.scorer.TermQueryScorer;
import it.cavallium.searchcore.utils.LLUtils;
import java.io.IOException;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Matches the documents containing a term
 */
public class TermSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(TermSearcher.class);

	private final String field;
	private final String term;
	private final PostingsCursor cursor;
	private final TermQueryScorer scorer;

	public TermSearcher(IndexReader reader, String field, String term, double boost, SearcherOptions options)
			throws IOException {
		this.field = field;
		this.term = term;
		var cursor = reader.postings(field, term, options.includeTermVectors());
		try {
			this.scorer = new TermQueryScorer(term, field, boost, reader.docCount(),
					reader.docFrequency(field, term), options);
		} catch (IOException | RuntimeException ex) {
			LLUtils.closeAfterFailure(ex, List.of(cursor));
			throw ex;
		}
		this.cursor = cursor;
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		var docId = cursor.nextDoc();
		if (docId == null) {
			return null;
		}
		return scorer.score(ctx, docId, cursor);
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException {
		var docId = cursor.advance(target);
		if (docId == null) {
			return null;
		}
		return scorer.score(ctx, docId, cursor);
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
		return cursor.cost();
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
		return BASE_RAM_BYTES_USED + TermQueryScorer.BASE_RAM_BYTES_USED
				+ RamUsageEstimator.sizeOf(field) + RamUsageEstimator.sizeOf(term);
	}

	@Override
	public String toString() {
		return "TermSearcher[" + field + ":" + term + "]";
	}
}
