package it.cavallium.searchcore.index;

import com.google.common.primitives.Longs;
import org.apache.lucene.util.BytesRef;

/**
 * Internal ids made of big-endian unsigned sequence numbers, so that their byte order matches their numeric order
 */
public class InternalIds {

	public static final int LENGTH = Long.BYTES;

	public static BytesRef encode(long sequence) {
		return new BytesRef(Longs.toByteArray(sequence));
	}

	public static long decode(BytesRef internalId) {
		if (internalId.length != LENGTH) {
			throw new IllegalArgumentException("Invalid internal id length: " + internalId.length);
		}
		var b = internalId.bytes;
		int o = internalId.offset;
		return Longs.fromBytes(b[o], b[o + 1], b[o + 2], b[o + 3], b[o + 4], b[o + 5], b[o + 6], b[o + 7]);
	}
}
