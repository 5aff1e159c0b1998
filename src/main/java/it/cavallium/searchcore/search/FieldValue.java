package it.cavallium.searchcore.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;

/**
 * Value of a stored field returned with a match: a single scalar, or a sequence of scalars when the field recurs
 */
public sealed interface FieldValue extends Accountable permits FieldValue.Scalar, FieldValue.Sequence {

	/**
	 * Add another occurrence of the same field: the first occurrence is kept as a scalar, the second one turns
	 * the value into a sequence, the next ones are appended to it
	 */
	FieldValue append(Scalar next);

	sealed interface Scalar extends FieldValue permits Text, Numeric, DateTime {

		@Override
		default FieldValue append(Scalar next) {
			return new Sequence(List.of(this, next));
		}
	}

	record Text(String value) implements Scalar {

		public Text {
			Objects.requireNonNull(value, "value");
		}

		@Override
		public long ramBytesUsed() {
			return RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + HeapOverhead.sizeOf(value);
		}
	}

	record Numeric(double value) implements Scalar {

		@Override
		public long ramBytesUsed() {
			return RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + Double.BYTES;
		}
	}

	record DateTime(Instant value) implements Scalar {

		private static final long INSTANT_BYTES = RamUsageEstimator.shallowSizeOfInstance(Instant.class);

		public DateTime {
			Objects.requireNonNull(value, "value");
		}

		/**
		 * RFC 3339 representation
		 */
		public String formatted() {
			return DateTimeFormatter.ISO_INSTANT.format(value);
		}

		@Override
		public long ramBytesUsed() {
			return RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + HeapOverhead.SIZE_OF_REFERENCE + INSTANT_BYTES;
		}
	}

	record Sequence(List<Scalar> values) implements FieldValue {

		public Sequence {
			values = List.copyOf(values);
		}

		@Override
		public FieldValue append(Scalar next) {
			var newValues = new ObjectArrayList<Scalar>(values.size() + 1);
			newValues.addAll(values);
			newValues.add(next);
			return new Sequence(newValues);
		}

		@Override
		public long ramBytesUsed() {
			long sizeInBytes = RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + HeapOverhead.SIZE_OF_LIST;
			for (Scalar value : values) {
				sizeInBytes += HeapOverhead.SIZE_OF_REFERENCE + value.ramBytesUsed();
			}
			return sizeInBytes;
		}
	}
}
