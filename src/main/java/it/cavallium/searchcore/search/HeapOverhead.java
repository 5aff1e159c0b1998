package it.cavallium.searchcore.search;

import it.cavallium.searchcore.index.LLDocument;
import it.cavallium.searchcore.index.LLField;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.apache.lucene.util.RamUsageEstimator;
import org.jetbrains.annotations.Nullable;

/**
 * Fixed heap overhead of every accounted shape, computed once when this class is initialized
 */
public final class HeapOverhead {

	public static final long SIZE_OF_REFERENCE = RamUsageEstimator.NUM_BYTES_OBJECT_REF;
	public static final long SIZE_OF_LONG = Long.BYTES;
	public static final long SIZE_OF_LIST = RamUsageEstimator.shallowSizeOfInstance(ObjectArrayList.class)
			+ RamUsageEstimator.NUM_BYTES_ARRAY_HEADER;
	public static final long SIZE_OF_MAP_ENTRY = 2L * RamUsageEstimator.NUM_BYTES_OBJECT_REF;

	public enum Shape {
		SEARCH_CONTEXT(SearchContext.class, true),
		DOCUMENT_MATCH_POOL(DocumentMatchPool.class, true),
		DOCUMENT_MATCH_COLLECTION(DocumentMatchCollection.class, false),
		DOCUMENT_MATCH(DocumentMatch.class, true),
		TERM_LOCATION_MAP(TermLocationMap.class, false),
		FIELD_TERM_LOCATION_MAP(FieldTermLocationMap.class, false),
		FIELD_FRAGMENT_MAP(FieldFragmentMap.class, false),
		LOCATION(Location.class, true),
		EXPLANATION(Explanation.class, true),
		DOCUMENT(LLDocument.class, true),
		FIELD(LLField.class, true);

		private final Class<?> type;
		private final boolean referenced;

		Shape(Class<?> type, boolean referenced) {
			this.type = type;
			this.referenced = referenced;
		}
	}

	private static final Map<Shape, Long> OVERHEADS;

	static {
		var overheads = new EnumMap<Shape, Long>(Shape.class);
		for (Shape shape : Shape.values()) {
			long size = RamUsageEstimator.shallowSizeOfInstance(shape.type);
			if (shape.referenced) {
				size += RamUsageEstimator.NUM_BYTES_OBJECT_REF;
			}
			overheads.put(shape, size);
		}
		OVERHEADS = Collections.unmodifiableMap(overheads);
	}

	private HeapOverhead() {
	}

	public static long of(Shape shape) {
		return OVERHEADS.get(shape);
	}

	public static Map<Shape, Long> overheads() {
		return OVERHEADS;
	}

	/**
	 * Size of a string, including its header and its characters
	 */
	public static long sizeOf(@Nullable String s) {
		return RamUsageEstimator.sizeOf(s);
	}
}
