package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.FIELD_FRAGMENT_MAP;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.lucene.util.Accountable;

/**
 * Highlighted text fragments of each field
 */
public final class FieldFragmentMap implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(FIELD_FRAGMENT_MAP);

	private final Object2ObjectLinkedOpenHashMap<String, ObjectArrayList<String>> fragments
			= new Object2ObjectLinkedOpenHashMap<>();

	public void addFragment(String field, String fragment) {
		fragments.computeIfAbsent(field, f -> new ObjectArrayList<>(1)).add(fragment);
	}

	public List<String> fragments(String field) {
		var fieldFragments = fragments.get(field);
		if (fieldFragments == null) {
			return List.of();
		}
		return Collections.unmodifiableList(fieldFragments);
	}

	public Map<String, List<String>> asMap() {
		return Collections.unmodifiableMap(fragments);
	}

	public boolean isEmpty() {
		return fragments.isEmpty();
	}

	public FieldFragmentMap copy() {
		var copy = new FieldFragmentMap();
		fragments.forEach((field, fieldFragments) -> fieldFragments.forEach(f -> copy.addFragment(field, f)));
		return copy;
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED;
		for (var entry : fragments.entrySet()) {
			sizeInBytes += HeapOverhead.sizeOf(entry.getKey()) + HeapOverhead.SIZE_OF_LIST;
			for (String fragment : entry.getValue()) {
				sizeInBytes += HeapOverhead.sizeOf(fragment);
			}
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
		return fragments.equals(((FieldFragmentMap) o).fragments);
	}

	@Override
	public int hashCode() {
		return fragments.hashCode();
	}

	@Override
	public String toString() {
		return fragments.toString();
	}
}
