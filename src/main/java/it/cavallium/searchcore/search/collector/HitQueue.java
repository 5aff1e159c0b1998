package it.cavallium.searchcore.search.collector;

import it.cavallium.searchcore.search.DocumentMatch;
import java.util.Comparator;
import org.apache.lucene.util.PriorityQueue;

/**
 * Bounded queue of the best hits. The worst retained hit is at the top
 */
final class HitQueue extends PriorityQueue<DocumentMatch> {

	private final Comparator<DocumentMatch> order;

	/**
	 * @param order best hit first
	 */
	HitQueue(int maxSize, Comparator<DocumentMatch> order) {
		super(maxSize);
		this.order = order;
	}

	@Override
	protected boolean lessThan(DocumentMatch a, DocumentMatch b) {
		return order.compare(a, b) > 0;
	}
}
