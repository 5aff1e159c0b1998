package it.cavallium.searchcore.search.collector;

import static it.cavallium.searchcore.utils.LLUtils.MARKER_SEARCH;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.LLField;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.DocumentMatchCollection;
import it.cavallium.searchcore.search.MemoryTracker;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import java.io.IOException;
import java.time.Duration;
import java.util.Comparator;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.ArrayUtil;

/**
 * Drives a searcher tree to exhaustion, keeping only the best hits.
 * <p>
 * Every other match is given back to the pool as soon as it's known not to be needed.
 * The collector doesn't close the searcher.
 */
public class TopNCollector {

	private static final Logger LOG = LogManager.getLogger(TopNCollector.class);
	/**
	 * Matches preallocated for the retained hits, the pool grows past this on demand
	 */
	private static final int MAX_PREALLOCATED_HITS = 1000;

	private final CollectorOptions options;
	private final int retained;
	private final Comparator<DocumentMatch> order;

	public TopNCollector(CollectorOptions options) {
		this.options = options;
		long retained = (long) options.size() + options.skip();
		if (retained > Integer.MAX_VALUE - 1) {
			throw new IllegalArgumentException("Too many hits requested: " + retained);
		}
		this.retained = (int) retained;
		this.order = options.sort().comparator();
	}

	public SearchResult collect(Searcher searcher, IndexReader reader) throws IOException {
		var stopWatch = StopWatch.createStarted();
		var sort = options.sort();
		// no more hits than documents can be retained
		int queueSize = (int) Math.min(retained, Math.min(reader.docCount(), ArrayUtil.MAX_ARRAY_LENGTH - 1L));
		var ctx = SearchContext.forSearcher(searcher,
				Math.min(queueSize, MAX_PREALLOCATED_HITS) + 1,
				sort.fields().size()
		);
		var pool = ctx.documentMatchPool();
		var tracker = ctx.memoryTracker();
		tracker.add(ctx.ramBytesUsed() + searcher.ramBytesUsed());
		checkMemory(tracker);

		long deadline = options.timeout() != null ? System.nanoTime() + options.timeout().toNanos() : Long.MAX_VALUE;
		boolean computeSortValues = sort.requiresSortValues();
		int checkInterval = options.memoryCheckInterval();

		var queue = new HitQueue(queueSize, order);
		long total = 0;
		double maxScore = 0;
		long sampledSize = 0;
		try {
			DocumentMatch match;
			while ((match = searcher.next(ctx)) != null) {
				total++;
				match.setHitNumber(total);
				if (match.score() > maxScore) {
					maxScore = match.score();
				}
				if (computeSortValues) {
					sort.fillSortValues(match, reader);
				}
				pool.put(queue.insertWithOverflow(match));

				if (total % checkInterval == 0) {
					sampledSize = sampleMemory(queue, tracker, sampledSize);
					checkMemory(tracker);
					if (System.nanoTime() > deadline) {
						LOG.debug(MARKER_SEARCH, "Search timed out after {} hits", total);
						throw new SearchTimeoutException(options.timeout(), total);
					}
				}
			}

			var sorted = new DocumentMatch[queue.size()];
			for (int i = sorted.length - 1; i >= 0; i--) {
				sorted[i] = queue.pop();
			}
			var hits = new DocumentMatchCollection(Math.max(0, sorted.length - options.skip()));
			for (int i = 0; i < sorted.length; i++) {
				if (i < options.skip()) {
					pool.put(sorted[i]);
				} else {
					hits.add(sorted[i]);
				}
			}
			try {
				for (DocumentMatch hit : hits) {
					bind(hit, reader);
				}
				sampleMemory(hits, tracker, sampledSize);
				checkMemory(tracker);
			} catch (IOException | RuntimeException ex) {
				hits.releaseTo(pool);
				throw ex;
			}

			stopWatch.stop();
			var took = Duration.ofNanos(stopWatch.getNanoTime());
			LOG.debug(MARKER_SEARCH, "Collected {} of {} hits in {} ms, estimated memory usage {} bytes", hits.size(),
					total, stopWatch.getTime(TimeUnit.MILLISECONDS), tracker.usage());
			return new SearchResult(total, maxScore, took, hits, tracker.usage());
		} catch (IOException | RuntimeException ex) {
			while (queue.size() > 0) {
				pool.put(queue.pop());
			}
			throw ex;
		}
	}

	/**
	 * Account the growth of the retained hits since the last sample
	 *
	 * @return the new sample
	 */
	private static long sampleMemory(Iterable<DocumentMatch> retained, MemoryTracker tracker, long previousSample) {
		long size = 0;
		for (DocumentMatch match : retained) {
			size += match.ramBytesUsed();
		}
		if (size > previousSample) {
			tracker.add(size - previousSample);
			return size;
		}
		return previousSample;
	}

	private void checkMemory(MemoryTracker tracker) {
		long limit = options.maxMemoryBytes();
		if (limit > 0 && tracker.usage() > limit) {
			throw new MemoryLimitExceededException(tracker.usage(), limit);
		}
	}

	/**
	 * Fill the external identity and the requested stored fields of a returned hit
	 */
	private void bind(DocumentMatch hit, IndexReader reader) throws IOException {
		hit.setIndex(reader.name());
		var externalId = reader.externalId(hit.internalId());
		if (externalId != null) {
			hit.setId(externalId);
		}
		if (options.fields().isEmpty()) {
			return;
		}
		var document = hit.loadDocument(reader);
		if (document == null) {
			return;
		}
		for (LLField field : document.fields()) {
			if (options.loadsField(field.name())) {
				hit.addFieldValue(field.name(), field.value());
			}
		}
	}
}
