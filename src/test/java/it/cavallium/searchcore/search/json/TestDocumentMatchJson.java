package it.cavallium.searchcore.search.json;

import com.squareup.moshi.JsonDataException;
import it.cavallium.searchcore.index.LLDocument;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.Explanation;
import it.cavallium.searchcore.search.FieldValue.DateTime;
import it.cavallium.searchcore.search.FieldValue.Numeric;
import it.cavallium.searchcore.search.FieldValue.Sequence;
import it.cavallium.searchcore.search.FieldValue.Text;
import it.cavallium.searchcore.search.Location;
import it.cavallium.searchcore.search.collector.SearchResult;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestDocumentMatchJson {

	private static DocumentMatch match(String id, double score) {
		var match = new DocumentMatch();
		match.setId(id);
		match.setScore(score);
		return match;
	}

	@Test
	public void testMinimalMatch() {
		var match = match("doc1", 1.5);
		match.setInternalId(new BytesRef(new byte[] {0, 0, 0, 1}));
		match.setHitNumber(7);
		match.setDocument(new LLDocument("doc1", List.of(), 0));
		Assertions.assertEquals("{\"id\":\"doc1\",\"score\":1.5}", SearchMoshi.documentMatchAdapter().toJson(match));
	}

	@Test
	public void testEmptyCollectionsAreOmitted() {
		var match = match("doc1", 0);
		match.locationsOrCreate();
		match.fragmentsOrCreate();
		Assertions.assertEquals("{\"id\":\"doc1\",\"score\":0.0}", SearchMoshi.documentMatchAdapter().toJson(match));
	}

	@Test
	public void testFullMatch() {
		var match = match("doc2", 2.0);
		match.setIndex("docs");
		match.setExplanation(Explanation.of(2.0, "sum of:", Explanation.of(2.0, "weight(body:x)")));
		match.locationsOrCreate().field("body").addLocation("x", new Location(1, 0, 1));
		match.locationsOrCreate().field("tags").addLocation("red", new Location(3, 4, 7, LongArrayList.wrap(new long[] {2})));
		match.fragmentsOrCreate().addFragment("body", "<mark>x</mark> y");
		match.sortValues().add("_score");
		match.addFieldValue("title", new Text("a"));
		match.addFieldValue("title", new Text("b"));
		match.addFieldValue("rank", new Numeric(3));
		match.addFieldValue("created", new DateTime(Instant.parse("2021-01-02T03:04:05Z")));

		var expected = "{\"index\":\"docs\",\"id\":\"doc2\",\"score\":2.0,"
				+ "\"explanation\":{\"value\":2.0,\"message\":\"sum of:\",\"children\":[{\"value\":2.0,\"message\":\"weight(body:x)\"}]},"
				+ "\"locations\":{\"body\":{\"x\":[{\"pos\":1,\"start\":0,\"end\":1}]},"
				+ "\"tags\":{\"red\":[{\"pos\":3,\"start\":4,\"end\":7,\"array_positions\":[2]}]}},"
				+ "\"fragments\":{\"body\":[\"<mark>x</mark> y\"]},"
				+ "\"sort\":[\"_score\"],"
				+ "\"fields\":{\"title\":[\"a\",\"b\"],\"rank\":3.0,\"created\":\"2021-01-02T03:04:05Z\"}}";
		Assertions.assertEquals(expected, SearchMoshi.documentMatchAdapter().toJson(match));
	}

	@Test
	public void testReadBack() throws IOException {
		var match = match("doc3", 0.25);
		match.setIndex("docs");
		match.locationsOrCreate().field("body").addLocation("y", new Location(2, 2, 3));
		match.sortValues().add("b");
		match.addFieldValue("tag", new Text("a"));
		match.addFieldValue("tag", new Text("b"));
		match.addFieldValue("created", new DateTime(Instant.parse("2021-01-02T03:04:05Z")));

		var adapter = SearchMoshi.documentMatchAdapter();
		var read = adapter.fromJson(adapter.toJson(match));
		Assertions.assertNotNull(read);
		Assertions.assertEquals("docs", read.index());
		Assertions.assertEquals("doc3", read.id());
		Assertions.assertEquals(0.25, read.score());
		Assertions.assertEquals(match.locations(), read.locations());
		Assertions.assertEquals(List.of("b"), read.sortValues());
		Assertions.assertEquals(new Sequence(List.of(new Text("a"), new Text("b"))), read.fields().get("tag"));
		// dates are written as text
		Assertions.assertEquals(new Text("2021-01-02T03:04:05Z"), read.fields().get("created"));
		Assertions.assertEquals(0, read.internalId().length);
	}

	@Test
	public void testMissingId() throws IOException {
		var adapter = SearchMoshi.documentMatchAdapter();
		Assertions.assertThrows(JsonDataException.class, () -> adapter.fromJson("{\"score\":1.0}"));
		Assertions.assertNull(adapter.fromJson("null"));
	}

	@Test
	public void testSearchResult() throws IOException {
		var result = new SearchResult(3, 1.5, Duration.ofNanos(1200), List.of(match("doc1", 1.5)), 640);
		var adapter = SearchMoshi.searchResultAdapter();
		var json = adapter.toJson(result);
		Assertions.assertEquals("{\"total_hits\":3,\"max_score\":1.5,\"took\":1200,"
				+ "\"hits\":[{\"id\":\"doc1\",\"score\":1.5}],\"memory_usage\":640}", json);

		var read = adapter.fromJson(json);
		Assertions.assertNotNull(read);
		Assertions.assertEquals(3, read.total());
		Assertions.assertEquals(Duration.ofNanos(1200), read.took());
		Assertions.assertEquals(640, read.memoryUsage());
		Assertions.assertEquals("doc1", read.hits().get(0).id());
	}
}
