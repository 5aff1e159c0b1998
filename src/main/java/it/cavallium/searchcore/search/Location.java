package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.LOCATION;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import org.apache.lucene.util.Accountable;

/**
 * Occurrence of a term inside a field
 *
 * @param pos            position of the term within the field, starting at 1
 * @param start          start byte offset of the term in the field
 * @param end            end byte offset of the term in the field
 * @param arrayPositions positions of the term within array-valued fields
 */
public record Location(long pos, long start, long end, LongList arrayPositions) implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(LOCATION);

	public Location {
		if (arrayPositions == null || arrayPositions.isEmpty()) {
			arrayPositions = LongLists.EMPTY_LIST;
		} else {
			arrayPositions = LongLists.unmodifiable(new LongArrayList(arrayPositions));
		}
	}

	public Location(long pos, long start, long end) {
		this(pos, start, end, LongLists.EMPTY_LIST);
	}

	public boolean sameArrayPositions(Location other) {
		return arrayPositions.equals(other.arrayPositions);
	}

	@Override
	public long ramBytesUsed() {
		return BASE_RAM_BYTES_USED + arrayPositions.size() * HeapOverhead.SIZE_OF_LONG;
	}
}
