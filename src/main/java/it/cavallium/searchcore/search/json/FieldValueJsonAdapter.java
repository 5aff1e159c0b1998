package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import it.cavallium.searchcore.search.FieldValue;
import it.cavallium.searchcore.search.FieldValue.DateTime;
import it.cavallium.searchcore.search.FieldValue.Numeric;
import it.cavallium.searchcore.search.FieldValue.Scalar;
import it.cavallium.searchcore.search.FieldValue.Sequence;
import it.cavallium.searchcore.search.FieldValue.Text;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Text and dates are written as strings, so dates are read back as text
 */
public class FieldValueJsonAdapter extends JsonAdapter<FieldValue> {

	@Override
	public @NotNull FieldValue fromJson(@NotNull JsonReader reader) throws IOException {
		if (reader.peek() == JsonReader.Token.BEGIN_ARRAY) {
			var values = new ObjectArrayList<Scalar>();
			reader.beginArray();
			while (reader.hasNext()) {
				values.add(readScalar(reader));
			}
			reader.endArray();
			return new Sequence(values);
		}
		return readScalar(reader);
	}

	private static Scalar readScalar(JsonReader reader) throws IOException {
		return switch (reader.peek()) {
			case STRING -> new Text(reader.nextString());
			case NUMBER -> new Numeric(reader.nextDouble());
			default -> throw new JsonDataException("Expected a string or a number at " + reader.getPath());
		};
	}

	@Override
	public void toJson(@NotNull JsonWriter writer, @Nullable FieldValue value) throws IOException {
		if (value == null) {
			writer.nullValue();
		} else if (value instanceof Sequence sequence) {
			writer.beginArray();
			for (Scalar scalar : sequence.values()) {
				writeScalar(writer, scalar);
			}
			writer.endArray();
		} else {
			writeScalar(writer, (Scalar) value);
		}
	}

	private static void writeScalar(JsonWriter writer, Scalar value) throws IOException {
		if (value instanceof Text text) {
			writer.value(text.value());
		} else if (value instanceof Numeric numeric) {
			writer.value(numeric.value());
		} else if (value instanceof DateTime dateTime) {
			writer.value(dateTime.formatted());
		} else {
			throw new UnsupportedOperationException("Unsupported value: " + value);
		}
	}
}
