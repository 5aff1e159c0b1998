package it.cavallium.searchcore.search.collector;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.LLField;
import it.cavallium.searchcore.index.NumericTerms;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.FieldValue;
import java.io.IOException;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A single sort criterion
 */
public sealed interface SortField {

	String SCORE_SORT_VALUE = "_score";

	/**
	 * Reverse the natural direction of this criterion
	 */
	boolean reverse();

	/**
	 * Compute the sort value of a match
	 */
	@Nullable String value(DocumentMatch match, IndexReader reader) throws IOException;

	/**
	 * Compare two matches. The best one comes first
	 *
	 * @param index position of this criterion in the sort values
	 */
	int compare(DocumentMatch a, DocumentMatch b, int index);

	/**
	 * Higher score first
	 */
	record ScoreSort(boolean reverse) implements SortField {

		@Override
		public String value(DocumentMatch match, IndexReader reader) {
			return SCORE_SORT_VALUE;
		}

		@Override
		public int compare(DocumentMatch a, DocumentMatch b, int index) {
			int cmp = Double.compare(b.score(), a.score());
			return reverse ? -cmp : cmp;
		}
	}

	/**
	 * Ascending external id
	 */
	record IdSort(boolean reverse) implements SortField {

		@Override
		public @Nullable String value(DocumentMatch match, IndexReader reader) throws IOException {
			return reader.externalId(match.internalId());
		}

		@Override
		public int compare(DocumentMatch a, DocumentMatch b, int index) {
			return compareValues(a, b, index, reverse);
		}
	}

	/**
	 * Ascending value of the first stored value of a field. Documents without the field come last
	 */
	record FieldSort(String field, boolean reverse) implements SortField {

		public FieldSort {
			Objects.requireNonNull(field);
		}

		@Override
		public @Nullable String value(DocumentMatch match, IndexReader reader) throws IOException {
			var document = match.loadDocument(reader);
			if (document == null) {
				return null;
			}
			for (LLField storedField : document.fields()) {
				if (storedField.name().equals(field)) {
					return sortableValue(storedField.value());
				}
			}
			return null;
		}

		private static String sortableValue(FieldValue.Scalar value) {
			if (value instanceof FieldValue.Text text) {
				return text.value();
			} else if (value instanceof FieldValue.Numeric numeric) {
				return NumericTerms.encode(numeric.value());
			} else if (value instanceof FieldValue.DateTime dateTime) {
				return NumericTerms.encode(dateTime.value().toEpochMilli());
			} else {
				throw new UnsupportedOperationException("Unsupported value: " + value);
			}
		}

		@Override
		public int compare(DocumentMatch a, DocumentMatch b, int index) {
			return compareValues(a, b, index, reverse);
		}
	}

	private static int compareValues(DocumentMatch a, DocumentMatch b, int index, boolean reverse) {
		var aValue = a.sortValues().get(index);
		var bValue = b.sortValues().get(index);
		if (aValue == null || bValue == null) {
			// missing values always come last
			if (aValue == bValue) {
				return 0;
			}
			return aValue == null ? 1 : -1;
		}
		int cmp = aValue.compareTo(bValue);
		return reverse ? -cmp : cmp;
	}
}
