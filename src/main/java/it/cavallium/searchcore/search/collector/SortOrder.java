package it.cavallium.searchcore.search.collector;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.collector.SortField.ScoreSort;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;

/**
 * Sort criteria, from the most significant one. Ties are broken by the order in which the matches were found
 */
public record SortOrder(List<SortField> fields) {

	public static final SortOrder BY_SCORE = new SortOrder(List.of(new ScoreSort(false)));

	public SortOrder {
		fields = List.copyOf(fields);
	}

	public static SortOrder of(SortField... fields) {
		return new SortOrder(List.of(fields));
	}

	/**
	 * @return true if the sort values must be computed for every match
	 */
	public boolean requiresSortValues() {
		for (SortField field : fields) {
			if (!(field instanceof ScoreSort)) {
				return true;
			}
		}
		return false;
	}

	public void fillSortValues(DocumentMatch match, IndexReader reader) throws IOException {
		var sortValues = match.sortValues();
		sortValues.clear();
		for (SortField field : fields) {
			sortValues.add(field.value(match, reader));
		}
	}

	/**
	 * Best match first
	 */
	public Comparator<DocumentMatch> comparator() {
		return (a, b) -> {
			for (int i = 0; i < fields.size(); i++) {
				int cmp = fields.get(i).compare(a, b, i);
				if (cmp != 0) {
					return cmp;
				}
			}
			return Long.compare(a.hitNumber(), b.hitNumber());
		};
	}
}
