package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.DOCUMENT;
import static it.cavallium.searchcore.search.HeapOverhead.Shape.DOCUMENT_MATCH;

import it.cavallium.searchcore.index.DocumentStore;
import it.cavallium.searchcore.index.LLDocument;
import it.cavallium.searchcore.utils.LLUtils;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A scored candidate document.
 * <p>
 * Instances are mutable and meant to be recycled through a {@link DocumentMatchPool}: the internal id buffer and the
 * sort values buffer survive {@link #reset()}, so a recycled match does not allocate them again.
 */
public final class DocumentMatch implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(DOCUMENT_MATCH);
	private static final long DOCUMENT_RAM_BYTES_USED = HeapOverhead.of(DOCUMENT);

	private String index = "";
	private String id = "";
	private final BytesRefBuilder internalId = new BytesRefBuilder();
	private double score;
	private @Nullable Explanation explanation;
	private @Nullable FieldTermLocationMap locations;
	private @Nullable FieldFragmentMap fragments;
	private final ObjectArrayList<String> sortValues;
	private @Nullable Object2ObjectLinkedOpenHashMap<String, FieldValue> fields;
	private @Nullable LLDocument document;
	private long hitNumber;

	/**
	 * True while this instance is owned by a pool
	 */
	boolean pooled;

	public DocumentMatch() {
		this(0);
	}

	public DocumentMatch(int sortSize) {
		this.sortValues = new ObjectArrayList<>(sortSize);
	}

	public String index() {
		return index;
	}

	public void setIndex(@NotNull String index) {
		checkOwned();
		this.index = Objects.requireNonNull(index);
	}

	public String id() {
		return id;
	}

	public void setId(@NotNull String id) {
		checkOwned();
		this.id = Objects.requireNonNull(id);
	}

	/**
	 * View of the internal id. It is valid until this match is reset or its internal id is changed.
	 */
	public BytesRef internalId() {
		return internalId.get();
	}

	public void setInternalId(BytesRef internalId) {
		checkOwned();
		this.internalId.copyBytes(internalId);
	}

	/**
	 * Size of the buffer backing the internal id
	 */
	public int internalIdCapacity() {
		return internalId.bytes().length;
	}

	public double score() {
		return score;
	}

	public void setScore(double score) {
		checkOwned();
		this.score = score;
	}

	public @Nullable Explanation explanation() {
		return explanation;
	}

	public void setExplanation(@Nullable Explanation explanation) {
		checkOwned();
		this.explanation = explanation;
	}

	public @Nullable FieldTermLocationMap locations() {
		return locations;
	}

	/**
	 * Get the locations of this match, creating them if missing
	 */
	public FieldTermLocationMap locationsOrCreate() {
		checkOwned();
		if (locations == null) {
			locations = new FieldTermLocationMap();
		}
		return locations;
	}

	public void setLocations(@Nullable FieldTermLocationMap locations) {
		checkOwned();
		this.locations = locations;
	}

	public @Nullable FieldFragmentMap fragments() {
		return fragments;
	}

	public FieldFragmentMap fragmentsOrCreate() {
		checkOwned();
		if (fragments == null) {
			fragments = new FieldFragmentMap();
		}
		return fragments;
	}

	public void setFragments(@Nullable FieldFragmentMap fragments) {
		checkOwned();
		this.fragments = fragments;
	}

	/**
	 * Sort values of this match. The list is reused when the match is reset
	 */
	public ObjectArrayList<String> sortValues() {
		return sortValues;
	}

	public Map<String, FieldValue> fields() {
		if (fields == null) {
			return Map.of();
		}
		return Collections.unmodifiableMap(fields);
	}

	/**
	 * Add a value of a stored field. A field added more than once is returned as a {@link FieldValue.Sequence}
	 */
	public void addFieldValue(String name, FieldValue.Scalar value) {
		checkOwned();
		if (fields == null) {
			fields = new Object2ObjectLinkedOpenHashMap<>();
		}
		var existing = fields.get(name);
		if (existing == null) {
			fields.put(name, value);
		} else {
			fields.put(name, existing.append(value));
		}
	}

	public void putFieldValue(String name, FieldValue value) {
		checkOwned();
		if (fields == null) {
			fields = new Object2ObjectLinkedOpenHashMap<>();
		}
		fields.put(name, value);
	}

	public @Nullable LLDocument document() {
		return document;
	}

	public void setDocument(@Nullable LLDocument document) {
		checkOwned();
		this.document = document;
	}

	/**
	 * Load the stored document of this match. The document is loaded only once, then it's cached
	 */
	public @Nullable LLDocument loadDocument(DocumentStore documentStore) throws IOException {
		checkOwned();
		if (document == null) {
			document = documentStore.document(internalId());
		}
		return document;
	}

	public long hitNumber() {
		return hitNumber;
	}

	public void setHitNumber(long hitNumber) {
		checkOwned();
		this.hitNumber = hitNumber;
	}

	/**
	 * Clear this match, so that it can be reused.
	 * The internal id and the sort values keep their buffers, truncated to zero length.
	 */
	public DocumentMatch reset() {
		index = "";
		id = "";
		internalId.clear();
		score = 0;
		explanation = null;
		locations = null;
		fragments = null;
		sortValues.clear();
		fields = null;
		document = null;
		hitNumber = 0;
		return this;
	}

	/**
	 * Make this match a copy of another one, reusing the buffers of this match
	 */
	public DocumentMatch copyFrom(DocumentMatch other) {
		checkOwned();
		index = other.index;
		id = other.id;
		internalId.copyBytes(other.internalId.get());
		score = other.score;
		explanation = other.explanation;
		locations = other.locations != null ? other.locations.copy() : null;
		fragments = other.fragments != null ? other.fragments.copy() : null;
		sortValues.clear();
		sortValues.addAll(other.sortValues);
		fields = other.fields != null ? new Object2ObjectLinkedOpenHashMap<>(other.fields) : null;
		document = other.document;
		hitNumber = other.hitNumber;
		return this;
	}

	public boolean isPooled() {
		return pooled;
	}

	private void checkOwned() {
		if (DocumentMatchPool.POOL_CHECKS && pooled) {
			throw new IllegalStateException("DocumentMatch " + this + " has been released to the pool");
		}
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED + HeapOverhead.sizeOf(index) + HeapOverhead.sizeOf(id)
				+ internalId.length();

		if (explanation != null) {
			sizeInBytes += explanation.ramBytesUsed();
		}

		if (locations != null) {
			sizeInBytes += locations.ramBytesUsed();
		}

		if (fragments != null) {
			sizeInBytes += fragments.ramBytesUsed();
		}

		for (String sortValue : sortValues) {
			sizeInBytes += HeapOverhead.SIZE_OF_REFERENCE + HeapOverhead.sizeOf(sortValue);
		}

		if (fields != null) {
			for (var entry : fields.entrySet()) {
				sizeInBytes += HeapOverhead.sizeOf(entry.getKey()) + HeapOverhead.SIZE_OF_MAP_ENTRY
						+ entry.getValue().ramBytesUsed();
			}
		}

		if (document != null) {
			sizeInBytes += DOCUMENT_RAM_BYTES_USED + document.numPlainTextBytes() + HeapOverhead.sizeOf(document.id())
					+ document.fields().size() * HeapOverhead.of(HeapOverhead.Shape.FIELD);
		}

		return sizeInBytes;
	}

	@Override
	public String toString() {
		return "[" + LLUtils.toStringSafe(internalId.get()) + "-" + score + "]";
	}
}
