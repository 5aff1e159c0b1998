package it.cavallium.searchcore.index.memory;

import it.cavallium.searchcore.index.InternalIds;
import it.cavallium.searchcore.index.LLTermPosition;
import it.cavallium.searchcore.index.PostingsCursor;
import it.cavallium.searchcore.index.memory.MemoryIndex.MemoryPostings;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.lucene.util.BytesRef;
import org.jetbrains.annotations.Nullable;

class MemoryPostingsCursor implements PostingsCursor {

	private final MemoryPostings postings;
	private final boolean includePositions;
	private final AtomicInteger openCursors;
	private final BytesRef current = new BytesRef(new byte[InternalIds.LENGTH]);
	private int index = -1;
	private boolean closed;

	MemoryPostingsCursor(MemoryPostings postings, boolean includePositions, AtomicInteger openCursors) {
		this.postings = postings;
		this.includePositions = includePositions;
		this.openCursors = openCursors;
		openCursors.incrementAndGet();
	}

	@Override
	public @Nullable BytesRef docId() {
		if (index < 0 || index >= postings.size()) {
			return null;
		}
		return current;
	}

	@Override
	public @Nullable BytesRef nextDoc() {
		ensureOpen();
		if (index < postings.size()) {
			index++;
		}
		return position();
	}

	@Override
	public @Nullable BytesRef advance(BytesRef target) {
		ensureOpen();
		if (index >= postings.size()) {
			return null;
		}
		long targetSequence = InternalIds.decode(target);
		if (index >= 0 && postings.docs.getLong(index) >= targetSequence) {
			return current;
		}
		// Binary search of the first document greater than or equal to the target
		int low = Math.max(index, 0);
		int high = postings.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (postings.docs.getLong(mid) < targetSequence) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		index = low;
		return position();
	}

	private @Nullable BytesRef position() {
		if (index >= postings.size()) {
			return null;
		}
		long sequence = postings.docs.getLong(index);
		for (int i = InternalIds.LENGTH - 1; i >= 0; i--) {
			current.bytes[i] = (byte) sequence;
			sequence >>>= 8;
		}
		return current;
	}

	@Override
	public int freq() {
		return postings.freqs.getInt(index);
	}

	@Override
	public double norm() {
		return postings.norms.getDouble(index);
	}

	@Override
	public List<LLTermPosition> positions() {
		if (!includePositions) {
			return List.of();
		}
		return postings.positions.get(index);
	}

	@Override
	public long cost() {
		return postings.size();
	}

	private void ensureOpen() {
		if (closed) {
			throw new IllegalStateException("Cursor is closed");
		}
	}

	@Override
	public void close() {
		if (!closed) {
			closed = true;
			openCursors.decrementAndGet();
		}
	}
}
