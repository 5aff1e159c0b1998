package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.Moshi;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Explanation;
import it.cavallium.searchcore.search.FieldValue;
import it.cavallium.searchcore.search.Location;
import it.cavallium.searchcore.search.collector.SearchResult;

/**
 * Moshi instance that knows how to write the search results
 */
public class SearchMoshi {

	private static final Moshi MOSHI = create();

	private SearchMoshi() {
	}

	private static Moshi create() {
		var locationAdapter = new LocationJsonAdapter();
		var explanationAdapter = new ExplanationJsonAdapter();
		var fieldValueAdapter = new FieldValueJsonAdapter();
		var documentMatchAdapter = new DocumentMatchJsonAdapter(locationAdapter, explanationAdapter, fieldValueAdapter);
		return new Moshi.Builder()
				.add(Location.class, locationAdapter.nullSafe())
				.add(Explanation.class, explanationAdapter.nullSafe())
				.add(FieldValue.class, fieldValueAdapter.nullSafe())
				.add(DocumentMatch.class, documentMatchAdapter.nullSafe())
				.add(SearchResult.class, new SearchResultJsonAdapter(documentMatchAdapter).nullSafe())
				.build();
	}

	public static Moshi moshi() {
		return MOSHI;
	}

	public static JsonAdapter<DocumentMatch> documentMatchAdapter() {
		return MOSHI.adapter(DocumentMatch.class);
	}

	public static JsonAdapter<SearchResult> searchResultAdapter() {
		return MOSHI.adapter(SearchResult.class);
	}
}
