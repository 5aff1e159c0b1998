package it.cavallium.searchcore.index.memory;

import it.cavallium.searchcore.index.IndexReader;
import it.cavallium.searchcore.index.InternalIds;
import it.cavallium.searchcore.index.LLDocument;
import it.cavallium.searchcore.index.LLField;
import it.cavallium.searchcore.index.LLTermPosition;
import it.cavallium.searchcore.index.NumericTerms;
import it.cavallium.searchcore.index.PostingsCursor;
import it.cavallium.searchcore.search.FieldValue;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectSortedMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable in-heap index. Documents get sequential internal ids starting from 1, in insertion order.
 * Text is expected to be already tokenized.
 */
public class MemoryIndex implements IndexReader {

	private static final Logger LOG = LogManager.getLogger(MemoryIndex.class);

	private final String name;
	private final List<LLDocument> documents;
	private final Map<String, Object2ObjectSortedMap<String, MemoryPostings>> fields;
	private final Map<String, List<String>> termDictionaries;
	private final AtomicInteger openCursors = new AtomicInteger();

	private MemoryIndex(String name,
			List<LLDocument> documents,
			Map<String, Object2ObjectSortedMap<String, MemoryPostings>> fields) {
		this.name = name;
		this.documents = documents;
		this.fields = fields;
		var termDictionaries = new Object2ObjectOpenHashMap<String, List<String>>(fields.size());
		fields.forEach((field, terms) -> termDictionaries.put(field, List.copyOf(terms.keySet())));
		this.termDictionaries = termDictionaries;
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public PostingsCursor postings(String field, String term, boolean includePositions) {
		var terms = fields.get(field);
		var postings = terms != null ? terms.get(term) : null;
		if (postings == null) {
			postings = MemoryPostings.EMPTY;
		}
		return new MemoryPostingsCursor(postings, includePositions, openCursors);
	}

	@Override
	public PostingsCursor allDocuments() {
		var allDocs = new MemoryPostings(documents.size());
		for (int i = 1; i <= documents.size(); i++) {
			allDocs.add(i, 1, 1d, List.of());
		}
		return new MemoryPostingsCursor(allDocs, false, openCursors);
	}

	@Override
	public List<String> terms(String field) {
		return termDictionaries.getOrDefault(field, List.of());
	}

	@Override
	public long docCount() {
		return documents.size();
	}

	@Override
	public long docFrequency(String field, String term) {
		var terms = fields.get(field);
		var postings = terms != null ? terms.get(term) : null;
		return postings != null ? postings.size() : 0;
	}

	@Override
	public @Nullable String externalId(BytesRef internalId) {
		var document = document(internalId);
		return document != null ? document.id() : null;
	}

	@Override
	public @Nullable LLDocument document(BytesRef internalId) {
		long sequence = InternalIds.decode(internalId);
		if (sequence < 1 || sequence > documents.size()) {
			return null;
		}
		return documents.get((int) (sequence - 1));
	}

	/**
	 * Number of cursors opened and not yet closed
	 */
	public int openCursors() {
		return openCursors.get();
	}

	@Override
	public void close() throws IOException {
		int open = openCursors.get();
		if (open > 0) {
			LOG.warn("Closing index \"{}\" with {} cursors still open", name, open);
		}
	}

	public static class Builder {

		private final String name;
		private final ObjectArrayList<LLDocument> documents = new ObjectArrayList<>();
		private final Map<String, Object2ObjectSortedMap<String, MemoryPostings>> fields = new Object2ObjectOpenHashMap<>();

		private Builder(String name) {
			this.name = name;
		}

		public DocumentBuilder document(String id) {
			return new DocumentBuilder(this, documents.size() + 1L, id);
		}

		/**
		 * Add a document made of a single text field
		 */
		public Builder document(String id, String field, String... tokens) {
			return document(id).text(field, tokens).add();
		}

		private void add(long sequence, LLDocument document, Map<String, Map<String, PendingTerm>> indexedTerms) {
			documents.add(document);
			indexedTerms.forEach((field, terms) -> {
				int fieldLength = 0;
				for (PendingTerm value : terms.values()) {
					fieldLength += value.positions.size();
				}
				double norm = fieldLength > 0 ? 1d / Math.sqrt(fieldLength) : 1d;
				var fieldTerms = fields.computeIfAbsent(field, f -> new Object2ObjectRBTreeMap<>());
				for (var termEntry : terms.entrySet()) {
					var postings = fieldTerms.computeIfAbsent(termEntry.getKey(), t -> new MemoryPostings(4));
					var positions = termEntry.getValue().positions;
					postings.add(sequence, positions.size(), norm, List.copyOf(positions));
				}
			});
		}

		public MemoryIndex build() {
			LOG.debug("Built memory index \"{}\" with {} documents and {} fields", name, documents.size(), fields.size());
			return new MemoryIndex(name, List.copyOf(documents), fields);
		}
	}

	public static class DocumentBuilder {

		private final Builder builder;
		private final long sequence;
		private final String id;
		private final ObjectArrayList<LLField> storedFields = new ObjectArrayList<>();
		private final Map<String, Map<String, PendingTerm>> indexedTerms = new Object2ObjectOpenHashMap<>();
		private final Object2LongOpenHashMap<String> nextPositions = new Object2LongOpenHashMap<>();
		private long numPlainTextBytes;
		private boolean added;

		private DocumentBuilder(Builder builder, long sequence, String id) {
			this.builder = builder;
			this.sequence = sequence;
			this.id = id;
		}

		/**
		 * Add a text field made of the given tokens, separated by a single space
		 */
		public DocumentBuilder text(String field, String... tokens) {
			return text(field, LongLists.EMPTY_LIST, tokens);
		}

		/**
		 * Add an element of an array-valued text field
		 */
		public DocumentBuilder textElement(String field, long arrayPosition, String... tokens) {
			return text(field, LongLists.singleton(arrayPosition), tokens);
		}

		private DocumentBuilder text(String field, LongList arrayPositions, String... tokens) {
			long position = nextPositions.getOrDefault(field, 1L);
			long start = 0;
			var terms = indexedTerms.computeIfAbsent(field, f -> new Object2ObjectOpenHashMap<>());
			for (String token : tokens) {
				int tokenBytes = token.getBytes(StandardCharsets.UTF_8).length;
				var termPosition = new LLTermPosition(position++, start, start + tokenBytes, arrayPositions);
				terms.computeIfAbsent(token, t -> new PendingTerm()).positions.add(termPosition);
				start += tokenBytes + 1;
			}
			nextPositions.put(field, position);
			var text = String.join(" ", tokens);
			numPlainTextBytes += text.getBytes(StandardCharsets.UTF_8).length;
			storedFields.add(new LLField(field, new FieldValue.Text(text)));
			return this;
		}

		public DocumentBuilder number(String field, double value) {
			indexKeyword(field, NumericTerms.encode(value));
			storedFields.add(new LLField(field, new FieldValue.Numeric(value)));
			return this;
		}

		public DocumentBuilder date(String field, Instant value) {
			indexKeyword(field, NumericTerms.encode(value.toEpochMilli()));
			storedFields.add(new LLField(field, new FieldValue.DateTime(value)));
			return this;
		}

		private void indexKeyword(String field, String term) {
			long position = nextPositions.getOrDefault(field, 1L);
			var terms = indexedTerms.computeIfAbsent(field, f -> new Object2ObjectOpenHashMap<>());
			terms
					.computeIfAbsent(term, t -> new PendingTerm())
					.positions
					.add(new LLTermPosition(position, 0, 0, LongLists.EMPTY_LIST));
			nextPositions.put(field, position + 1);
		}

		public Builder add() {
			if (added) {
				throw new IllegalStateException("Document \"" + id + "\" has already been added");
			}
			added = true;
			builder.add(sequence, new LLDocument(id, storedFields, numPlainTextBytes), indexedTerms);
			return builder;
		}
	}

	private static final class PendingTerm {

		private final ObjectArrayList<LLTermPosition> positions = new ObjectArrayList<>();
	}

	static final class MemoryPostings {

		static final MemoryPostings EMPTY = new MemoryPostings(0);

		final LongArrayList docs;
		final IntArrayList freqs;
		final DoubleArrayList norms;
		final ObjectArrayList<List<LLTermPosition>> positions;

		MemoryPostings(int capacity) {
			this.docs = new LongArrayList(capacity);
			this.freqs = new IntArrayList(capacity);
			this.norms = new DoubleArrayList(capacity);
			this.positions = new ObjectArrayList<>(capacity);
		}

		void add(long sequence, int freq, double norm, List<LLTermPosition> positions) {
			this.docs.add(sequence);
			this.freqs.add(freq);
			this.norms.add(norm);
			this.positions.add(positions);
		}

		int size() {
			return docs.size();
		}
	}
}
