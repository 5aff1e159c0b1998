package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import it.cavallium.searchcore.search.Explanation;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class ExplanationJsonAdapter extends JsonAdapter<Explanation> {

	private static final JsonReader.Options NAMES = JsonReader.Options.of("value", "message", "children");

	@Override
	public @NotNull Explanation fromJson(@NotNull JsonReader reader) throws IOException {
		double value = 0;
		String message = null;
		List<Explanation> children = List.of();
		reader.beginObject();
		while (reader.hasNext()) {
			switch (reader.selectName(NAMES)) {
				case 0 -> value = reader.nextDouble();
				case 1 -> message = reader.nextString();
				case 2 -> {
					var list = new ObjectArrayList<Explanation>();
					reader.beginArray();
					while (reader.hasNext()) {
						list.add(fromJson(reader));
					}
					reader.endArray();
					children = list;
				}
				default -> {
					reader.skipName();
					reader.skipValue();
				}
			}
		}
		reader.endObject();
		if (message == null) {
			throw new JsonDataException("Missing explanation message at " + reader.getPath());
		}
		return new Explanation(value, message, children);
	}

	@Override
	public void toJson(@NotNull JsonWriter writer, @Nullable Explanation value) throws IOException {
		if (value == null) {
			writer.nullValue();
			return;
		}
		writer.beginObject();
		writer.name("value").value(value.value());
		writer.name("message").value(value.message());
		if (!value.children().isEmpty()) {
			writer.name("children").beginArray();
			for (Explanation child : value.children()) {
				toJson(writer, child);
			}
			writer.endArray();
		}
		writer.endObject();
	}
}
