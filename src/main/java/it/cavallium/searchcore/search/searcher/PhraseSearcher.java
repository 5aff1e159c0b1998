package it.cavallium.searchcore.search.searcher;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Location;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import it.cavallium.searchcore.search.TermLocationMap;
import it.cavallium.searchcore.utils.LLUtils;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import java.io.IOException;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Matches the documents containing the terms at consecutive positions, in the same array element.
 * The terms are read with their positions even when the caller didn't ask for term vectors, then the locations are
 * dropped before returning the match.
 */
public class PhraseSearcher extends AbstractSearcher {

	private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(PhraseSearcher.class);

	private final ConjunctionSearcher conjunction;
	private final String field;
	private final List<String> terms;
	private final boolean keepLocations;

	private PhraseSearcher(ConjunctionSearcher conjunction, String field, List<String> terms, boolean keepLocations) {
		this.conjunction = conjunction;
		this.field = field;
		this.terms = terms;
		this.keepLocations = keepLocations;
	}

	public static Searcher create(IndexReader reader,
			String field,
			List<String> terms,
			double boost,
			SearcherOptions options) throws IOException {
		if (terms.isEmpty()) {
			return new MatchNoneSearcher();
		}
		if (terms.size() == 1) {
			return new TermSearcher(reader, field, terms.get(0), boost, options);
		}
		var termOptions = options.withTermVectors();
		var searchers = new ObjectArrayList<Searcher>(terms.size());
		try {
			for (String term : terms) {
				searchers.add(new TermSearcher(reader, field, term, boost, termOptions));
			}
		} catch (IOException | RuntimeException ex) {
			LLUtils.closeAfterFailure(ex, searchers);
			throw ex;
		}
		return new PhraseSearcher(new ConjunctionSearcher(searchers, options), field, List.copyOf(terms),
				options.includeTermVectors());
	}

	@Override
	protected @Nullable DocumentMatch nextMatch(SearchContext ctx) throws IOException {
		return checkPhrase(ctx, conjunction.next(ctx));
	}

	@Override
	protected @Nullable DocumentMatch advanceMatch(SearchContext ctx, BytesRef target) throws IOException {
		return checkPhrase(ctx, conjunction.advance(ctx, target));
	}

	private @Nullable DocumentMatch checkPhrase(SearchContext ctx, @Nullable DocumentMatch candidate) throws IOException {
		while (candidate != null) {
			var phraseLocations = findPhrases(candidate);
			if (phraseLocations != null) {
				if (keepLocations) {
					candidate.locationsOrCreate().put(field, phraseLocations);
				} else {
					candidate.setLocations(null);
				}
				return candidate;
			}
			ctx.documentMatchPool().put(candidate);
			candidate = conjunction.next(ctx);
		}
		return null;
	}

	/**
	 * @return the locations of every occurrence of the phrase, or null if the phrase doesn't occur
	 */
	private @Nullable TermLocationMap findPhrases(DocumentMatch candidate) {
		var locations = candidate.locations();
		var termLocations = locations != null ? locations.get(field) : null;
		if (termLocations == null) {
			return null;
		}
		TermLocationMap result = null;
		// a repeated term has its locations merged once for each of its occurrences in the phrase
		var starts = new ObjectLinkedOpenHashSet<>(termLocations.locations(terms.get(0)));
		for (Location first : starts) {
			var occurrence = followPhrase(termLocations, first);
			if (occurrence != null) {
				if (result == null) {
					result = new TermLocationMap();
				}
				for (int i = 0; i < occurrence.length; i++) {
					var term = terms.get(i);
					if (!result.locations(term).contains(occurrence[i])) {
						result.addLocation(term, occurrence[i]);
					}
				}
			}
		}
		return result;
	}

	private @Nullable Location[] followPhrase(TermLocationMap termLocations, Location first) {
		var occurrence = new Location[terms.size()];
		occurrence[0] = first;
		for (int i = 1; i < terms.size(); i++) {
			long expectedPos = first.pos() + i;
			Location found = null;
			for (Location location : termLocations.locations(terms.get(i))) {
				if (location.pos() == expectedPos && location.sameArrayPositions(first)) {
					found = location;
					break;
				}
			}
			if (found == null) {
				return null;
			}
			occurrence[i] = found;
		}
		return occurrence;
	}

	@Override
	public double weight() {
		return conjunction.weight();
	}

	@Override
	public void setQueryNorm(double queryNorm) {
		conjunction.setQueryNorm(queryNorm);
	}

	@Override
	public long count() {
		return conjunction.count();
	}

	@Override
	public int documentMatchPoolSize() {
		return 1 + conjunction.documentMatchPoolSize();
	}

	@Override
	protected void doClose() throws IOException {
		conjunction.close();
	}

	@Override
	protected long searcherRamBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED + conjunction.ramBytesUsed() + RamUsageEstimator.sizeOf(field);
		for (String term : terms) {
			sizeInBytes += RamUsageEstimator.NUM_BYTES_OBJECT_REF + RamUsageEstimator.sizeOf(term);
		}
		return sizeInBytes;
	}

	@Override
	public String toString() {
		return "PhraseSearcher[" + field + ":\"" + String.join(" ", terms) + "\"]";
	}
}
