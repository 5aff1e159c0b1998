package it.cavallium.searchcore.search.searcher;

import static it.cavallium.searchcore.SearchTestUtils.FIELD;
import static it.cavallium.searchcore.SearchTestUtils.context;
import static it.cavallium.searchcore.SearchTestUtils.drain;
import static it.cavallium.searchcore.SearchTestUtils.longs;

import it.cavallium.searchcore.index.memory.MemoryIndex;
import it.cavallium.searchcore.search.SearcherOptions;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class TestMultiTermSearchers {

	private MemoryIndex index;

	@BeforeEach
	public void beforeEach() {
		var builder = MemoryIndex.builder("test");
		builder.document("d1").text(FIELD, "color").number("price", 10).add();
		builder.document("d2").text(FIELD, "colour").number("price", -5.5).add();
		builder.document("d3").text(FIELD, "colt").number("price", 100).add();
		builder.document("d4").text(FIELD, "cold").number("price", 10).date("date", Instant.parse("2020-01-01T00:00:00Z")).add();
		builder.document("d5").text(FIELD, "dolor").add();
		index = builder.build();
	}

	@AfterEach
	public void afterEach() throws IOException {
		Assertions.assertEquals(0, index.openCursors());
		index.close();
	}

	@Test
	public void testPrefix() throws IOException {
		try (var searcher = PrefixSearcher.create(index, FIELD, "col", 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1, 2, 3, 4), drain(searcher, context(searcher)));
		}
		try (var searcher = PrefixSearcher.create(index, FIELD, "colo", 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1, 2), drain(searcher, context(searcher)));
		}
		try (var searcher = PrefixSearcher.create(index, FIELD, "x", 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertInstanceOf(MatchNoneSearcher.class, searcher);
		}
	}

	@Test
	public void testPrefixExpansion() {
		var dictionary = List.of("a", "ab", "abc", "abd", "b");
		Assertions.assertEquals(List.of("ab", "abc", "abd"), PrefixSearcher.expand(dictionary, "ab"));
		Assertions.assertEquals(List.of(), PrefixSearcher.expand(dictionary, "c"));
	}

	@Test
	public void testFuzzy() throws IOException {
		try (var searcher = FuzzySearcher.create(index, FIELD, "color", 1, 0, 1.0, SearcherOptions.DEFAULT)) {
			// colour is an insertion away, dolor a substitution away
			Assertions.assertEquals(longs(1, 2, 5), drain(searcher, context(searcher)));
		}
		try (var searcher = FuzzySearcher.create(index, FIELD, "color", 1, 1, 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1, 2), drain(searcher, context(searcher)));
		}
		try (var searcher = FuzzySearcher.create(index, FIELD, "color", 0, 0, 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1), drain(searcher, context(searcher)));
		}
	}

	@Test
	public void testFuzzyTooManyEdits() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> FuzzySearcher.create(index, FIELD, "color", 3, 0, 1.0, SearcherOptions.DEFAULT));
	}

	private static Stream<Arguments> provideFuzzyExpansions() {
		return Stream.of(
				Arguments.of("color", 1, 0, List.of("color", "colour", "dolor")),
				Arguments.of("color", 2, 0, List.of("cold", "color", "colour", "colt", "dolor")),
				Arguments.of("color", 1, 1, List.of("color", "colour")),
				Arguments.of("color", 2, 10, List.of("color", "colour")),
				Arguments.of("kitten", 2, 0, List.of()),
				Arguments.of("sittin", 1, 0, List.of("sitting")),
				Arguments.of("colt", 0, 0, List.of("colt"))
		);
	}

	@ParameterizedTest
	@MethodSource("provideFuzzyExpansions")
	public void testFuzzyExpansion(String term, int maxEdits, int prefixLength, List<String> expected) {
		var dictionary = List.of("cold", "color", "colour", "colt", "dolor", "sitting");
		Assertions.assertEquals(expected, FuzzySearcher.expand(dictionary, term, maxEdits, prefixLength));
	}

	@Test
	public void testNumericRange() throws IOException {
		try (var searcher = NumericRangeSearcher.create(index, "price", 0d, true, 10d, true, 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1, 4), drain(searcher, context(searcher)));
		}
		try (var searcher = NumericRangeSearcher.create(index, "price", 0d, true, 10d, false, 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertTrue(drain(searcher, context(searcher)).isEmpty());
		}
		try (var searcher = NumericRangeSearcher.create(index, "price", null, false, 10d, false, 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(2), drain(searcher, context(searcher)));
		}
		try (var searcher = NumericRangeSearcher.create(index, "price", 10d, false, null, false, 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(3), drain(searcher, context(searcher)));
		}
	}

	@Test
	public void testDateRange() throws IOException {
		double from = Instant.parse("2019-06-01T00:00:00Z").toEpochMilli();
		try (var searcher = NumericRangeSearcher.create(index, "date", from, true, null, false, 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(4), drain(searcher, context(searcher)));
		}
	}

	@Test
	public void testTooManyClauses() {
		var ex = Assertions.assertThrows(TooManyClausesException.class,
				() -> MultiTermSearcher.create(index, FIELD, List.of("color", "colour", "colt"), 1.0,
						SearcherOptions.DEFAULT, 2));
		Assertions.assertEquals(3, ex.clauses());
		Assertions.assertEquals(2, ex.maxClauseCount());
	}

	@Test
	public void testMultiTermScoresEveryTerm() throws IOException {
		try (var searcher = MultiTermSearcher.create(index, FIELD, List.of("color", "colt"), 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertInstanceOf(DisjunctionSearcher.class, searcher);
			Assertions.assertEquals(1, searcher.min());
			Assertions.assertEquals(2, searcher.count());
			Assertions.assertEquals(longs(1, 3), drain(searcher, context(searcher)));
		}
	}
}
