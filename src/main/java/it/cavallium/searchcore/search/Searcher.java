package it.cavallium.searchcore.search;

import java.io.Closeable;
import java.io.IOException;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

/**
 * Iterator over the documents matching a query, in strictly increasing internal id order.
 * <p>
 * Searchers compose into a tree; every parent owns its children and closes them when it's closed.
 * A match returned by {@link #next} or {@link #advance} belongs to the caller, who must release it to the
 * {@link DocumentMatchPool} of the context when done.
 */
public interface Searcher extends Closeable, Accountable {

	/**
	 * @return the next match, greater than the previously returned one, or null if there are no more matches
	 * @throws IOException if the underlying postings can't be read
	 */
	@Nullable DocumentMatch next(SearchContext ctx) throws IOException;

	/**
	 * Skip to the first match whose internal id is greater than or equal to {@code target}.
	 * If the target is not after the last returned match, that match is returned again and the searcher does not move.
	 *
	 * @return the match, or null if there are no more matches
	 * @throws IOException if the underlying postings can't be read
	 */
	@Nullable DocumentMatch advance(SearchContext ctx, BytesRef target) throws IOException;

	/**
	 * Release the resources of this searcher and of all its children.
	 * After closing, {@link #next} and {@link #advance} return null.
	 */
	@Override
	void close() throws IOException;

	/**
	 * Sum of squared weights of this subtree, used to compute the query norm
	 */
	double weight();

	void setQueryNorm(double queryNorm);

	/**
	 * Upper bound of the number of documents this subtree can match
	 */
	long count();

	/**
	 * Minimum number of children that must match
	 */
	int min();

	/**
	 * Number of matches this subtree may hold at the same time
	 */
	int documentMatchPoolSize();
}
