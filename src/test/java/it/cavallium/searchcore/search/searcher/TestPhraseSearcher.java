package it.cavallium.searchcore.search.searcher;

import static it.cavallium.searchcore.SearchTestUtils.FIELD;
import static it.cavallium.searchcore.SearchTestUtils.context;
import static it.cavallium.searchcore.SearchTestUtils.drain;
import static it.cavallium.searchcore.SearchTestUtils.longs;

import it.cavallium.searchcore.index.memory.MemoryIndex;
import it.cavallium.searchcore.search.Location;
import it.cavallium.searchcore.search.SearcherOptions;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestPhraseSearcher {

	private MemoryIndex index;

	@BeforeEach
	public void beforeEach() {
		var builder = MemoryIndex.builder("test");
		builder.document("d1", FIELD, "the", "quick", "brown", "fox");
		builder.document("d2", FIELD, "brown", "the", "quick", "dog");
		builder.document("d3", FIELD, "quick", "the", "fox", "brown");
		builder.document("d4").textElement(FIELD, 0, "a", "quick").textElement(FIELD, 1, "brown", "b").add();
		builder.document("d5").textElement(FIELD, 0, "quick", "brown").textElement(FIELD, 1, "quick", "fox").add();
		index = builder.build();
	}

	@AfterEach
	public void afterEach() throws IOException {
		Assertions.assertEquals(0, index.openCursors());
		index.close();
	}

	@Test
	public void testConsecutiveTerms() throws IOException {
		try (var searcher = PhraseSearcher.create(index, FIELD, List.of("quick", "brown"), 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1, 5), drain(searcher, context(searcher)));
		}
	}

	@Test
	public void testLocationsDroppedWhenNotRequested() throws IOException {
		try (var searcher = PhraseSearcher.create(index, FIELD, List.of("quick", "brown"), 1.0, SearcherOptions.DEFAULT)) {
			var match = searcher.next(context(searcher));
			Assertions.assertNull(match.locations());
		}
	}

	@Test
	public void testPhraseLocations() throws IOException {
		var options = SearcherOptions.DEFAULT.withTermVectors();
		try (var searcher = PhraseSearcher.create(index, FIELD, List.of("quick", "brown"), 1.0, options)) {
			var match = searcher.next(context(searcher));
			var termLocations = match.locations().get(FIELD);
			Assertions.assertEquals(List.of(new Location(2, 4, 9)), termLocations.locations("quick"));
			Assertions.assertEquals(List.of(new Location(3, 10, 15)), termLocations.locations("brown"));
		}
	}

	@Test
	public void testRepeatedTermLocations() throws IOException {
		var options = SearcherOptions.DEFAULT.withTermVectors();
		try (var repeated = MemoryIndex.builder("repeated")
				.document("r1", FIELD, "a", "b", "a")
				.document("r2", FIELD, "a", "a", "a", "b")
				.build()) {
			try (var searcher = PhraseSearcher.create(repeated, FIELD, List.of("a", "a"), 1.0, options)) {
				var ctx = context(searcher);
				var match = searcher.next(ctx);
				Assertions.assertNotNull(match);
				var termLocations = match.locations().get(FIELD);
				Assertions.assertEquals(List.of(new Location(1, 0, 1), new Location(2, 2, 3), new Location(3, 4, 5)),
						termLocations.locations("a"));
				ctx.documentMatchPool().put(match);
				Assertions.assertNull(searcher.next(ctx));
			}
			Assertions.assertEquals(0, repeated.openCursors());
		}
	}

	@Test
	public void testSingleTerm() throws IOException {
		try (var searcher = PhraseSearcher.create(index, FIELD, List.of("fox"), 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertInstanceOf(TermSearcher.class, searcher);
			Assertions.assertEquals(longs(1, 3, 5), drain(searcher, context(searcher)));
		}
	}

	@Test
	public void testNoTerms() throws IOException {
		try (var searcher = PhraseSearcher.create(index, FIELD, List.of(), 1.0, SearcherOptions.DEFAULT)) {
			Assertions.assertTrue(drain(searcher, context(searcher)).isEmpty());
		}
	}

	@Test
	public void testThreeTerms() throws IOException {
		try (var searcher = PhraseSearcher.create(index, FIELD, List.of("the", "quick", "brown"), 1.0,
				SearcherOptions.DEFAULT)) {
			Assertions.assertEquals(longs(1), drain(searcher, context(searcher)));
		}
	}
}
