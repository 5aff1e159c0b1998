package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.SearchTestUtils.id;

import it.cavallium.searchcore.index.LLDocument;
import it.cavallium.searchcore.index.LLField;
import it.cavallium.searchcore.search.FieldValue.Numeric;
import it.cavallium.searchcore.search.FieldValue.Sequence;
import it.cavallium.searchcore.search.FieldValue.Text;
import java.util.List;
import org.apache.lucene.util.BytesRef;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestDocumentMatch {

	@Test
	public void testResetKeepsCapacity() {
		var match = new DocumentMatch(2);
		match.setInternalId(new BytesRef(new byte[] {1, 2, 3, 4}));
		match.sortValues().add("a");
		match.sortValues().add("b");
		match.sortValues().add("c");
		match.setScore(3.5);
		match.setId("doc");
		match.locationsOrCreate().field("body").addLocation("fox", new Location(1, 0, 3));
		int idCapacity = match.internalIdCapacity();
		int sortCapacity = match.sortValues().elements().length;

		match.reset();

		Assertions.assertEquals(0, match.internalId().length);
		Assertions.assertEquals(idCapacity, match.internalIdCapacity());
		Assertions.assertTrue(match.sortValues().isEmpty());
		Assertions.assertEquals(sortCapacity, match.sortValues().elements().length);
		Assertions.assertEquals(0, match.score());
		Assertions.assertEquals("", match.id());
		Assertions.assertNull(match.locations());
		Assertions.assertNull(match.explanation());
		Assertions.assertTrue(match.fields().isEmpty());
	}

	@Test
	public void testFieldValuePromotion() {
		var match = new DocumentMatch();
		match.addFieldValue("tag", new Text("a"));
		Assertions.assertEquals(new Text("a"), match.fields().get("tag"));

		match.addFieldValue("tag", new Text("b"));
		Assertions.assertEquals(new Sequence(List.of(new Text("a"), new Text("b"))), match.fields().get("tag"));

		match.addFieldValue("tag", new Numeric(3));
		Assertions.assertEquals(new Sequence(List.of(new Text("a"), new Text("b"), new Numeric(3))),
				match.fields().get("tag"));
	}

	@Test
	public void testSizeGrowsWithLocations() {
		var match = new DocumentMatch();
		match.setInternalId(id(1));
		long empty = match.ramBytesUsed();
		Assertions.assertTrue(empty > 0);

		match.locationsOrCreate().field("body").addLocation("fox", new Location(1, 0, 3));
		long oneLocation = match.ramBytesUsed();
		Assertions.assertTrue(oneLocation > empty);

		match.locationsOrCreate().field("body").addLocation("fox", new Location(5, 20, 23));
		Assertions.assertTrue(match.ramBytesUsed() > oneLocation);
	}

	@Test
	public void testSizeCountsDocument() {
		var match = new DocumentMatch();
		long empty = match.ramBytesUsed();
		match.setDocument(new LLDocument("doc1", List.of(new LLField("body", new Text("quick fox"))), 9));
		Assertions.assertTrue(match.ramBytesUsed() >= empty + 9);
	}

	@Test
	public void testCopyFromIsIndependent() {
		var source = new DocumentMatch();
		source.setInternalId(id(7));
		source.setScore(1.25);
		source.setExplanation(Explanation.of(1.25, "weight"));
		source.locationsOrCreate().field("body").addLocation("fox", new Location(2, 4, 7));
		source.addFieldValue("title", new Text("fox"));

		var copy = new DocumentMatch().copyFrom(source);
		source.locationsOrCreate().field("body").addLocation("dog", new Location(3, 8, 11));
		source.setInternalId(id(8));

		Assertions.assertEquals(id(7), copy.internalId());
		Assertions.assertEquals(1.25, copy.score());
		Assertions.assertSame(source.explanation(), copy.explanation());
		Assertions.assertEquals(1, copy.locations().get("body").size());
		Assertions.assertEquals(new Text("fox"), copy.fields().get("title"));
	}

	@Test
	public void testCopySharesLocationsUntilModified() {
		var source = new DocumentMatch();
		source.locationsOrCreate().field("body").addLocation("fox", new Location(2, 4, 7));

		var copy = new DocumentMatch().copyFrom(source);
		var sourceFox = source.locations().get("body").asMap().get("fox");
		Assertions.assertSame(sourceFox, copy.locations().get("body").asMap().get("fox"));

		copy.locations().get("body").addLocation("fox", new Location(9, 30, 33));
		Assertions.assertEquals(List.of(new Location(2, 4, 7)), source.locations().get("body").locations("fox"));
		Assertions.assertEquals(List.of(new Location(2, 4, 7), new Location(9, 30, 33)),
				copy.locations().get("body").locations("fox"));

		source.locations().get("body").addLocation("dog", new Location(3, 8, 11));
		Assertions.assertEquals(List.of(), copy.locations().get("body").locations("dog"));
		Assertions.assertEquals(2, copy.locations().get("body").locations("fox").size());
	}

	@Test
	public void testToString() {
		var match = new DocumentMatch();
		match.setInternalId(new BytesRef(new byte[] {0x0A, (byte) 0xFF}));
		match.setScore(2.0);
		Assertions.assertEquals("[0AFF-2.0]", match.toString());
	}
}
