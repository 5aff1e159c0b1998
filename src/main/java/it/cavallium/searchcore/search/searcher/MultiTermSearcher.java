package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.utils.LLUtils;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.Collection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Matches the documents containing any of the given terms
 */
public class MultiTermSearcher {

	private static final Logger LOG = LogManager.getLogger(MultiTermSearcher.class);

	/**
	 * Maximum number of terms a single query can expand to
	 */
	public static final int MAX_CLAUSE_COUNT
			= Integer.parseInt(System.getProperty("it.cavallium.searchcore.maxclausecount", "1024"));

	private MultiTermSearcher() {
	}

	public static Searcher create(IndexReader reader,
			String field,
			Collection<String> terms,
			double boost,
			SearcherOptions options) throws IOException {
		return create(reader, field, terms, boost, options, MAX_CLAUSE_COUNT);
	}

	/**
	 * @throws TooManyClausesException if there are more than {@code maxClauseCount} terms
	 */
	public static Searcher create(IndexReader reader,
			String field,
			Collection<String> terms,
			double boost,
			SearcherOptions options,
			int maxClauseCount) throws IOException {
		if (terms.size() > maxClauseCount) {
			throw new TooManyClausesException(terms.size(), maxClauseCount);
		}
		if (terms.isEmpty()) {
			return new MatchNoneSearcher();
		}
		LOG.trace(LLUtils.MARKER_SEARCH, "Expanded field \"{}\" to {} terms", field, terms.size());
		var searchers = new ObjectArrayList<Searcher>(terms.size());
		try {
			for (String term : terms) {
				searchers.add(new TermSearcher(reader, field, term, boost, options));
			}
		} catch (IOException | RuntimeException ex) {
			LLUtils.closeAfterFailure(ex, searchers);
			throw ex;
		}
		if (searchers.size() == 1) {
			return searchers.get(0);
		}
		return new DisjunctionSearcher(searchers, 1, options);
	}
}
