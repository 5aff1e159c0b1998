package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.DOCUMENT_MATCH_COLLECTION;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.AbstractList;
import java.util.Collection;
import java.util.Comparator;
import java.util.RandomAccess;
import org.apache.lucene.util.Accountable;

/**
 * Ordered sequence of matches
 */
public class DocumentMatchCollection extends AbstractList<DocumentMatch> implements RandomAccess, Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(DOCUMENT_MATCH_COLLECTION);

	/**
	 * Natural order: higher score first. Ties are left undefined
	 */
	public static final Comparator<DocumentMatch> SCORE_DESCENDING
			= (a, b) -> Double.compare(b.score(), a.score());

	/**
	 * Higher score first, ties broken by the natural iteration order
	 */
	public static final Comparator<DocumentMatch> SCORE_DESCENDING_HIT_NUMBER_ASCENDING
			= SCORE_DESCENDING.thenComparingLong(DocumentMatch::hitNumber);

	private final ObjectArrayList<DocumentMatch> matches;

	public DocumentMatchCollection() {
		this.matches = new ObjectArrayList<>();
	}

	public DocumentMatchCollection(int capacity) {
		this.matches = new ObjectArrayList<>(capacity);
	}

	public DocumentMatchCollection(Collection<DocumentMatch> matches) {
		this.matches = new ObjectArrayList<>(matches);
	}

	@Override
	public DocumentMatch get(int index) {
		return matches.get(index);
	}

	@Override
	public DocumentMatch set(int index, DocumentMatch element) {
		return matches.set(index, element);
	}

	@Override
	public void add(int index, DocumentMatch element) {
		matches.add(index, element);
	}

	@Override
	public DocumentMatch remove(int index) {
		return matches.remove(index);
	}

	@Override
	public void clear() {
		matches.clear();
	}

	@Override
	public int size() {
		return matches.size();
	}

	public void sortByScore() {
		matches.sort(SCORE_DESCENDING_HIT_NUMBER_ASCENDING);
	}

	/**
	 * Release every match to the pool and empty this collection
	 */
	public void releaseTo(DocumentMatchPool pool) {
		for (DocumentMatch match : matches) {
			pool.put(match);
		}
		matches.clear();
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED;
		for (DocumentMatch match : matches) {
			if (match != null) {
				sizeInBytes += match.ramBytesUsed();
			}
		}
		return sizeInBytes;
	}
}
