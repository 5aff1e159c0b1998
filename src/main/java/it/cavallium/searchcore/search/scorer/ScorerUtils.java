package it.cavallium.searchcore.search.scorer;

import it.cavallium.searchcore.search.DocumentMatch;
import java.util.List;

class ScorerUtils {

	/**
	 * Merge the term locations of every constituent into the target
	 */
	static void mergeLocations(DocumentMatch target, List<DocumentMatch> constituents) {
		for (DocumentMatch constituent : constituents) {
			if (constituent == target) {
				continue;
			}
			var locations = constituent.locations();
			if (locations != null && !locations.isEmpty()) {
				target.locationsOrCreate().mergeFrom(locations);
			}
		}
	}
}
