package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.FIELD_TERM_LOCATION_MAP;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.apache.lucene.util.Accountable;
import org.jetbrains.annotations.Nullable;

/**
 * Term locations of each field
 */
public final class FieldTermLocationMap implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(FIELD_TERM_LOCATION_MAP);

	private final Object2ObjectLinkedOpenHashMap<String, TermLocationMap> fields = new Object2ObjectLinkedOpenHashMap<>();

	/**
	 * Get the term locations of a field, creating them if missing
	 */
	public TermLocationMap field(String field) {
		return fields.computeIfAbsent(field, f -> new TermLocationMap());
	}

	public @Nullable TermLocationMap get(String field) {
		return fields.get(field);
	}

	public void put(String field, TermLocationMap termLocations) {
		fields.put(field, termLocations);
	}

	public @Nullable TermLocationMap remove(String field) {
		return fields.remove(field);
	}

	public Set<String> fieldNames() {
		return Collections.unmodifiableSet(fields.keySet());
	}

	public Map<String, TermLocationMap> asMap() {
		return Collections.unmodifiableMap(fields);
	}

	public boolean isEmpty() {
		return fields.isEmpty();
	}

	public void mergeFrom(FieldTermLocationMap other) {
		other.fields.forEach((field, termLocations) -> field(field).mergeFrom(termLocations));
	}

	/**
	 * Copy the fields of this map. The location lists are shared until modified
	 */
	public FieldTermLocationMap copy() {
		var copy = new FieldTermLocationMap();
		fields.forEach((field, termLocations) -> copy.fields.put(field, termLocations.copy()));
		return copy;
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED;
		for (var entry : fields.entrySet()) {
			sizeInBytes += HeapOverhead.sizeOf(entry.getKey()) + entry.getValue().ramBytesUsed();
		}
		return sizeInBytes;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return fields.equals(((FieldTermLocationMap) o).fields);
	}

	@Override
	public int hashCode() {
		return fields.hashCode();
	}

	@Override
	public String toString() {
		return fields.toString();
	}
}
