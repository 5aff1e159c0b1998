package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.collector.SearchResult;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.time.Duration;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The duration is written in nanoseconds
 */
public class SearchResultJsonAdapter extends JsonAdapter<SearchResult> {

	private static final JsonReader.Options NAMES = JsonReader.Options.of("total_hits",
			"max_score",
			"took",
			"hits",
			"memory_usage"
	);

	private final DocumentMatchJsonAdapter documentMatchAdapter;

	public SearchResultJsonAdapter(DocumentMatchJsonAdapter documentMatchAdapter) {
		this.documentMatchAdapter = documentMatchAdapter;
	}

	@Override
	public @NotNull SearchResult fromJson(@NotNull JsonReader reader) throws IOException {
		long total = 0;
		double maxScore = 0;
		Duration took = Duration.ZERO;
		var hits = new ObjectArrayList<DocumentMatch>();
		long memoryUsage = 0;
		reader.beginObject();
		while (reader.hasNext()) {
			switch (reader.selectName(NAMES)) {
				case 0 -> total = reader.nextLong();
				case 1 -> maxScore = reader.nextDouble();
				case 2 -> took = Duration.ofNanos(reader.nextLong());
				case 3 -> {
					reader.beginArray();
					while (reader.hasNext()) {
						hits.add(documentMatchAdapter.fromJson(reader));
					}
					reader.endArray();
				}
				case 4 -> memoryUsage = reader.nextLong();
				default -> {
					reader.skipName();
					reader.skipValue();
				}
			}
		}
		reader.endObject();
		return new SearchResult(total, maxScore, took, hits, memoryUsage);
	}

	@Override
	public void toJson(@NotNull JsonWriter writer, @Nullable SearchResult value) throws IOException {
		if (value == null) {
			writer.nullValue();
			return;
		}
		writer.beginObject();
		writer.name("total_hits").value(value.total());
		writer.name("max_score").value(value.maxScore());
		writer.name("took").value(value.took().toNanos());
		writer.name("hits").beginArray();
		for (DocumentMatch hit : value.hits()) {
			documentMatchAdapter.toJson(writer, hit);
		}
		writer.endArray();
		writer.name("memory_usage").value(value.memoryUsage());
		writer.endObject();
	}
}
