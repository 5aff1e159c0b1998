package it.cavallium.searchcore.search.collector;

import it.cavallium.searchcore.search.DocumentMatch;
import java.time.Duration;
import java.util.List;

/**
 * @param total       number of matching documents
 * @param maxScore    highest score among all the matching documents
 * @param took        duration of the collection
 * @param hits        returned hits, best first
 * @param memoryUsage estimated peak memory usage of the query, in bytes
 */
public record SearchResult(long total, double maxScore, Duration took, List<DocumentMatch> hits, long memoryUsage) {

	public SearchResult {
		hits = List.copyOf(hits);
	}
}
