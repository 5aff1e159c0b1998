package it.cavallium.searchcore.search;

import static it.cavallium.searchcore.search.HeapOverhead.Shape.EXPLANATION;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.lucene.util.Accountable;

/**
 * Tree describing how a score was computed
 */
public record Explanation(double value, String message, List<Explanation> children) implements Accountable {

	private static final long BASE_RAM_BYTES_USED = HeapOverhead.of(EXPLANATION);

	public Explanation {
		Objects.requireNonNull(message, "message");
		children = children == null ? List.of() : List.copyOf(children);
	}

	public static Explanation of(double value, String message, Explanation... children) {
		return new Explanation(value, message, List.of(children));
	}

	@Override
	public long ramBytesUsed() {
		long sizeInBytes = BASE_RAM_BYTES_USED + HeapOverhead.sizeOf(message);
		for (Explanation child : children) {
			sizeInBytes += child.ramBytesUsed();
		}
		return sizeInBytes;
	}

	@Override
	public Collection<Accountable> getChildResources() {
		return Collections.unmodifiableList(children);
	}

	@Override
	public String toString() {
		var sb = new StringBuilder();
		appendTo(sb, 0);
		return sb.toString();
	}

	private void appendTo(StringBuilder sb, int depth) {
		sb.append("  ".repeat(depth)).append(value).append(" = ").append(message).append('\n');
		for (Explanation child : children) {
			child.appendTo(sb, depth + 1);
		}
	}
}
