package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.FieldFragmentMap;
import it.cavallium.searchcore.search.FieldTermLocationMap;
import it.cavallium.searchcore.search.FieldValue;
import it.cavallium.searchcore.search.Location;
import java.io.IOException;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * External representation of a match.
 * <p>
 * {@code id} and {@code score} are always written, the other keys only when they have a value.
 * The internal id, the loaded document and the hit number are never written.
 */
public class DocumentMatchJsonAdapter extends JsonAdapter<DocumentMatch> {

	private static final JsonReader.Options NAMES = JsonReader.Options.of("index",
			"id",
			"score",
			"explanation",
			"locations",
			"fragments",
			"sort",
			"fields"
	);

	private final LocationJsonAdapter locationAdapter;
	private final ExplanationJsonAdapter explanationAdapter;
	private final FieldValueJsonAdapter fieldValueAdapter;

	public DocumentMatchJsonAdapter(LocationJsonAdapter locationAdapter,
			ExplanationJsonAdapter explanationAdapter,
			FieldValueJsonAdapter fieldValueAdapter) {
		this.locationAdapter = locationAdapter;
		this.explanationAdapter = explanationAdapter;
		this.fieldValueAdapter = fieldValueAdapter;
	}

	@Override
	public @NotNull DocumentMatch fromJson(@NotNull JsonReader reader) throws IOException {
		var match = new DocumentMatch();
		boolean hasId = false;
		reader.beginObject();
		while (reader.hasNext()) {
			switch (reader.selectName(NAMES)) {
				case 0 -> match.setIndex(reader.nextString());
				case 1 -> {
					match.setId(reader.nextString());
					hasId = true;
				}
				case 2 -> match.setScore(reader.nextDouble());
				case 3 -> match.setExplanation(explanationAdapter.fromJson(reader));
				case 4 -> match.setLocations(readLocations(reader));
				case 5 -> match.setFragments(readFragments(reader));
				case 6 -> {
					reader.beginArray();
					while (reader.hasNext()) {
						if (reader.peek() == JsonReader.Token.NULL) {
							match.sortValues().add(reader.<String>nextNull());
						} else {
							match.sortValues().add(reader.nextString());
						}
					}
					reader.endArray();
				}
				case 7 -> {
					reader.beginObject();
					while (reader.hasNext()) {
						var name = reader.nextName();
						match.putFieldValue(name, fieldValueAdapter.fromJson(reader));
					}
					reader.endObject();
				}
				default -> {
					reader.skipName();
					reader.skipValue();
				}
			}
		}
		reader.endObject();
		if (!hasId) {
			throw new JsonDataException("Missing match id at " + reader.getPath());
		}
		return match;
	}

	private FieldTermLocationMap readLocations(JsonReader reader) throws IOException {
		var locations = new FieldTermLocationMap();
		reader.beginObject();
		while (reader.hasNext()) {
			var termLocations = locations.field(reader.nextName());
			reader.beginObject();
			while (reader.hasNext()) {
				var term = reader.nextName();
				reader.beginArray();
				while (reader.hasNext()) {
					termLocations.addLocation(term, locationAdapter.fromJson(reader));
				}
				reader.endArray();
			}
			reader.endObject();
		}
		reader.endObject();
		return locations;
	}

	private static FieldFragmentMap readFragments(JsonReader reader) throws IOException {
		var fragments = new FieldFragmentMap();
		reader.beginObject();
		while (reader.hasNext()) {
			var field = reader.nextName();
			reader.beginArray();
			while (reader.hasNext()) {
				fragments.addFragment(field, reader.nextString());
			}
			reader.endArray();
		}
		reader.endObject();
		return fragments;
	}

	@Override
	public void toJson(@NotNull JsonWriter writer, @Nullable DocumentMatch value) throws IOException {
		if (value == null) {
			writer.nullValue();
			return;
		}
		writer.beginObject();
		if (!value.index().isEmpty()) {
			writer.name("index").value(value.index());
		}
		writer.name("id").value(value.id());
		writer.name("score").value(value.score());
		if (value.explanation() != null) {
			writer.name("explanation");
			explanationAdapter.toJson(writer, value.explanation());
		}
		var locations = value.locations();
		if (locations != null && !locations.isEmpty()) {
			writer.name("locations").beginObject();
			for (var field : locations.asMap().entrySet()) {
				writer.name(field.getKey()).beginObject();
				for (var term : field.getValue().asMap().entrySet()) {
					writer.name(term.getKey()).beginArray();
					for (Location location : term.getValue()) {
						locationAdapter.toJson(writer, location);
					}
					writer.endArray();
				}
				writer.endObject();
			}
			writer.endObject();
		}
		var fragments = value.fragments();
		if (fragments != null && !fragments.isEmpty()) {
			writer.name("fragments").beginObject();
			for (var field : fragments.asMap().entrySet()) {
				writer.name(field.getKey()).beginArray();
				for (String fragment : field.getValue()) {
					writer.value(fragment);
				}
				writer.endArray();
			}
			writer.endObject();
		}
		List<String> sortValues = value.sortValues();
		if (!sortValues.isEmpty()) {
			writer.name("sort").beginArray();
			for (String sortValue : sortValues) {
				writer.value(sortValue);
			}
			writer.endArray();
		}
		var fields = value.fields();
		if (!fields.isEmpty()) {
			writer.name("fields").beginObject();
			for (var field : fields.entrySet()) {
				writer.name(field.getKey());
				fieldValueAdapter.toJson(writer, field.getValue());
			}
			writer.endObject();
		}
		writer.endObject();
	}
}
