package it.cavallium.searchcore.index;

import it.unimi.dsi.fastutil.longs.LongList;

/**
 * @param pos            1-based position of the term in the field
 * @param start          start byte offset
 * @param end            end byte offset
 * @param arrayPositions positions of the field value inside array-valued fields
 */
public record LLTermPosition(long pos, long start, long end, LongList arrayPositions) {}
