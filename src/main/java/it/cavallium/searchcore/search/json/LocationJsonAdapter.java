package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import it.cavallium.searchcore.search.Location;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import java.io.IOException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class LocationJsonAdapter extends JsonAdapter<Location> {

	private static final JsonReader.Options NAMES = JsonReader.Options.of("pos", "start", "end", "array_positions");

	@Override
	public @NotNull Location fromJson(@NotNull JsonReader reader) throws IOException {
		long pos = -1;
		long start = -1;
		long end = -1;
		LongList arrayPositions = LongLists.EMPTY_LIST;
		reader.beginObject();
		while (reader.hasNext()) {
			switch (reader.selectName(NAMES)) {
				case 0 -> pos = reader.nextLong();
				case 1 -> start = reader.nextLong();
				case 2 -> end = reader.nextLong();
				case 3 -> arrayPositions = readLongs(reader);
				default -> {
					reader.skipName();
					reader.skipValue();
				}
			}
		}
		reader.endObject();
		if (pos < 0 || start < 0 || end < 0) {
			throw new JsonDataException("Incomplete location at " + reader.getPath());
		}
		return new Location(pos, start, end, arrayPositions);
	}

	private static LongList readLongs(JsonReader reader) throws IOException {
		reader.beginArray();
		var values = new LongArrayList();
		while (reader.hasNext()) {
			values.add(reader.nextLong());
		}
		reader.endArray();
		return values;
	}

	@Override
	public void toJson(@NotNull JsonWriter writer, @Nullable Location value) throws IOException {
		if (value == null) {
			writer.nullValue();
			return;
		}
		writer.beginObject();
		writer.name("pos").value(value.pos());
		writer.name("start").value(value.start());
		writer.name("end").value(value.end());
		if (!value.arrayPositions().isEmpty()) {
			writer.name("array_positions").beginArray();
			for (int i = 0; i < value.arrayPositions().size(); i++) {
				writer.value(value.arrayPositions().getLong(i));
			}
			writer.endArray();
		}
		writer.endObject();
	}
}
