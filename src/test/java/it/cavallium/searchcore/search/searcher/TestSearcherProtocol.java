package it.cavallium.searchcore.search.searcher;

import static it.cavallium.searchcore.SearchTestUtils.FIELD;
import static it.cavallium.searchcore.SearchTestUtils.context;
import static it.cavallium.searchcore.SearchTestUtils.drain;
import static it.cavallium.searchcore.SearchTestUtils.id;
import static it.cavallium.searchcore.SearchTestUtils.longs;
import static it.cavallium.searchcore.SearchTestUtils.sequence;
import static it.cavallium.searchcore.SearchTestUtils.termIndex;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.memory.MemoryIndex;
import it.cavallium.searchcore.search.Searcher;
import it.cavallium.searchcore.search.SearcherOptions;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Iteration rules shared by every searcher
 */
public class TestSearcherProtocol {

	private static final Logger LOG = LogManager.getLogger(TestSearcherProtocol.class);

	private MemoryIndex index;

	@FunctionalInterface
	private interface SearcherFactory {

		Searcher create(IndexReader reader) throws IOException;
	}

	private static Stream<Arguments> provideSearchers() {
		SearcherFactory term = reader -> new TermSearcher(reader, FIELD, "a", 1.0, SearcherOptions.DEFAULT);
		SearcherFactory conjunction = reader -> new ConjunctionSearcher(List.of(
				new TermSearcher(reader, FIELD, "a", 1.0, SearcherOptions.DEFAULT),
				new TermSearcher(reader, FIELD, "b", 1.0, SearcherOptions.DEFAULT)
		), SearcherOptions.DEFAULT);
		SearcherFactory disjunction = reader -> new DisjunctionSearcher(List.of(
				new TermSearcher(reader, FIELD, "a", 1.0, SearcherOptions.DEFAULT),
				new TermSearcher(reader, FIELD, "c", 1.0, SearcherOptions.DEFAULT)
		), 1, SearcherOptions.DEFAULT);
		SearcherFactory negation = reader -> new NegationSearcher(
				new MatchAllSearcher(reader, 1.0, SearcherOptions.DEFAULT),
				new TermSearcher(reader, FIELD, "c", 1.0, SearcherOptions.DEFAULT)
		);
		SearcherFactory bool = reader -> new BooleanSearcher(
				new TermSearcher(reader, FIELD, "a", 1.0, SearcherOptions.DEFAULT),
				new DisjunctionSearcher(List.of(new TermSearcher(reader, FIELD, "b", 1.0, SearcherOptions.DEFAULT)), 0,
						SearcherOptions.DEFAULT),
				new TermSearcher(reader, FIELD, "c", 1.0, SearcherOptions.DEFAULT),
				SearcherOptions.DEFAULT
		);
		return Stream.of(
				Arguments.of("term", term),
				Arguments.of("conjunction", conjunction),
				Arguments.of("disjunction", disjunction),
				Arguments.of("negation", negation),
				Arguments.of("boolean", bool)
		);
	}

	@BeforeEach
	public void beforeEach() {
		index = termIndex(8, Map.of(
				"a", Set.of(1, 2, 4, 6, 8),
				"b", Set.of(2, 3, 4, 8),
				"c", Set.of(3, 5, 6)
		));
	}

	@AfterEach
	public void afterEach() throws IOException {
		Assertions.assertEquals(0, index.openCursors());
		index.close();
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("provideSearchers")
	public void testStrictlyIncreasing(String name, SearcherFactory factory) throws IOException {
		try (var searcher = factory.create(index)) {
			var result = drain(searcher, context(searcher));
			LOG.debug("{} matched {}", name, result);
			Assertions.assertFalse(result.isEmpty());
			for (int i = 1; i < result.size(); i++) {
				Assertions.assertTrue(result.getLong(i - 1) < result.getLong(i));
			}
		}
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("provideSearchers")
	public void testRepeatedAdvanceIsIdempotent(String name, SearcherFactory factory) throws IOException {
		try (var searcher = factory.create(index)) {
			var ctx = context(searcher);
			var first = searcher.advance(ctx, id(4));
			Assertions.assertNotNull(first);
			long firstId = sequence(first);
			double firstScore = first.score();
			ctx.documentMatchPool().put(first);

			var second = searcher.advance(ctx, id(4));
			Assertions.assertNotNull(second);
			Assertions.assertEquals(firstId, sequence(second));
			Assertions.assertEquals(firstScore, second.score());
			ctx.documentMatchPool().put(second);

			// a target before the last match doesn't move the searcher either
			var third = searcher.advance(ctx, id(1));
			Assertions.assertEquals(firstId, sequence(third));
			ctx.documentMatchPool().put(third);

			var rest = drain(searcher, ctx);
			Assertions.assertTrue(rest.isEmpty() || rest.getLong(0) > firstId);
		}
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("provideSearchers")
	public void testExhaustedStaysExhausted(String name, SearcherFactory factory) throws IOException {
		try (var searcher = factory.create(index)) {
			var ctx = context(searcher);
			drain(searcher, ctx);
			Assertions.assertNull(searcher.next(ctx));
			Assertions.assertNull(searcher.advance(ctx, id(1)));
			Assertions.assertNull(searcher.advance(ctx, id(100)));
		}
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("provideSearchers")
	public void testCloseCancels(String name, SearcherFactory factory) throws IOException {
		var searcher = factory.create(index);
		var ctx = context(searcher);
		var match = searcher.next(ctx);
		Assertions.assertNotNull(match);
		searcher.close();
		Assertions.assertEquals(0, index.openCursors());
		Assertions.assertNull(searcher.next(ctx));
		Assertions.assertNull(searcher.advance(ctx, id(2)));
		// closing twice has no effect
		searcher.close();
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("provideSearchers")
	public void testReadErrorsPropagate(String name, SearcherFactory factory) throws IOException {
		var reader = new FailingIndexReader(index, 2, false);
		try (var searcher = factory.create(reader)) {
			var ctx = context(searcher);
			var ex = Assertions.assertThrows(IOException.class, () -> drain(searcher, ctx));
			Assertions.assertTrue(ex.getMessage().startsWith("Failed to read"));
		}
	}

	@Test
	public void testCloseErrorsAreAggregated() throws IOException {
		var reader = new FailingIndexReader(index, -1, true);
		var searcher = new ConjunctionSearcher(List.of(
				new TermSearcher(reader, FIELD, "a", 1.0, SearcherOptions.DEFAULT),
				new TermSearcher(reader, FIELD, "b", 1.0, SearcherOptions.DEFAULT),
				new TermSearcher(reader, FIELD, "c", 1.0, SearcherOptions.DEFAULT)
		), SearcherOptions.DEFAULT);
		Assertions.assertEquals(longs(), drain(searcher, context(searcher)));
		var ex = Assertions.assertThrows(IOException.class, searcher::close);
		Assertions.assertEquals(2, ex.getSuppressed().length);
		// every child has been closed anyway
		Assertions.assertEquals(0, index.openCursors());
		Assertions.assertTrue(searcher.isClosed());
	}

	@Test
	public void testMatchNone() throws IOException {
		try (var searcher = new MatchNoneSearcher()) {
			Assertions.assertEquals(0, searcher.documentMatchPoolSize());
			Assertions.assertNull(searcher.next(context(searcher)));
		}
	}

	@Test
	public void testMatchAll() throws IOException {
		try (var searcher = new MatchAllSearcher(index, 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(8, searcher.count());
			Assertions.assertEquals(longs(1, 2, 3, 4, 5, 6, 7, 8), drain(searcher, context(searcher)));
		}
	}
}
