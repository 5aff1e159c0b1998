package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.TERM_LOCATION_MAP;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.lucene.util.Accountable;

/**
 * Locations of each term, in discovery order.
 * <p>
 * A copy shares the location lists with its source until one of the two is modified.
 */
public final class TermLocationMap implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(TERM_LOCATION_MAP);

	private Object2ObjectLinkedOpenHashMap<String, ObjectArrayList<Location>> locations;
	/**
	 * True if {@link #locations} may be referenced by another map
	 */
	private boolean shared;

	public TermLocationMap() {
		this.locations = new Object2ObjectLinkedOpenHashMap<>();
	}

	private TermLocationMap(Object2ObjectLinkedOpenHashMap<String, ObjectArrayList<Location>> locations) {
		this.locations = locations;
		this.shared = true;
	}

	public void addLocation(String term, Location location) {
		ensureExclusive();
		locations.computeIfAbsent(term, t -> new ObjectArrayList<>(1)).add(location);
	}

	public void addLocations(String term, List<Location> locations) {
		ensureExclusive();
		this.locations.computeIfAbsent(term, t -> new ObjectArrayList<>(locations.size())).addAll(locations);
	}

	/**
	 * @return the locations of a term, or an empty list
	 */
	public List<Location> locations(String term) {
		var termLocations = locations.get(term);
		if (termLocations == null) {
			return List.of();
		}
		return Collections.unmodifiableList(termLocations);
	}

	public Set<String> terms() {
		return Collections.unmodifiableSet(locations.keySet());
	}

	public Map<String, List<Location>> asMap() {
		return Collections.unmodifiableMap(locations);
	}

	public boolean isEmpty() {
		return locations.isEmpty();
	}

	public int size() {
		return locations.size();
	}

	public void mergeFrom(TermLocationMap other) {
		other.locations.forEach(this::addLocations);
	}

	public TermLocationMap copy() {
		shared = true;
		return new TermLocationMap(locations);
	}

	private void ensureExclusive() {
		if (shared) {
			var exclusive = new Object2ObjectLinkedOpenHashMap<String, ObjectArrayList<Location>>(locations.size());
			locations.forEach((term, termLocations) -> exclusive.put(term, new ObjectArrayList<>(termLocations)));
			locations = exclusive;
			shared = false;
		}
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED;
		for (var entry : locations.entrySet()) {
			sizeInBytes += HeapOverhead.sizeOf(entry.getKey()) + HeapOverhead.SIZE_OF_LIST;
			for (Location location : entry.getValue()) {
				sizeInBytes += location.ramBytesUsed();
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
		return locations.equals(((TermLocationMap) o).locations);
	}

	@Override
	public int hashCode() {
		return locations.hashCode();
	}

	@Override
	public String toString() {
		return locations.toString();
	}
}
