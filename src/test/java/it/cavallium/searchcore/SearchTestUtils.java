package it.cavallium.searchcore;

import it.cavallium.searchcore.index.InternalIds;
import it.cavallium.searchcore.index.memory.MemoryIndex;
import it.cavallium.searchcore.search.DocumentMatch;
import it.cavallium.searchcore.search.SearchContext;
import it.cavallium.searchcore.search.Searcher;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import org.apache.lucene.util.BytesRef;

public class SearchTestUtils {

	public static final String FIELD = "body";

	public static BytesRef id(long sequence) {
		return InternalIds.encode(sequence);
	}

	public static long sequence(DocumentMatch match) {
		return InternalIds.decode(match.internalId());
	}

	/**
	 * Build an index of {@code docCount} documents named "doc1", "doc2"... where each term occurs in the listed documents
	 */
	public static MemoryIndex termIndex(int docCount, Map<String, Set<Integer>> termDocs) {
		var builder = MemoryIndex.builder("test");
		for (int doc = 1; doc <= docCount; doc++) {
			var tokens = new ObjectArrayList<String>();
			for (var entry : termDocs.entrySet()) {
				if (entry.getValue().contains(doc)) {
					tokens.add(entry.getKey());
				}
			}
			tokens.sort(null);
			builder.document("doc" + doc, FIELD, tokens.toArray(String[]::new));
		}
		return builder.build();
	}

	public static SearchContext context(Searcher searcher) {
		return SearchContext.forSearcher(searcher, 0, 0);
	}

	/**
	 * Read every match of a searcher, releasing them to the pool
	 *
	 * @return the sequence numbers of the matches
	 */
	public static LongList drain(Searcher searcher, SearchContext ctx) throws IOException {
		var result = new LongArrayList();
		DocumentMatch match;
		while ((match = searcher.next(ctx)) != null) {
			result.add(sequence(match));
			ctx.documentMatchPool().put(match);
		}
		return result;
	}

	public static LongList longs(long... values) {
		return LongArrayList.wrap(values);
	}
}
