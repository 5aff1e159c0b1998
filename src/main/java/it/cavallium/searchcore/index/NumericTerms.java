package it.cavallium.searchcore.index;

import org.apache.lucene.util.NumericUtils;

/**
 * Encodes numbers as terms whose lexicographic order is the numeric order
 */
public class NumericTerms {

	public static final char PREFIX = '\u0001';
	private static final int ENCODED_LENGTH = 17;

	public static String encode(double value) {
		long sortable = NumericUtils.doubleToSortableLong(value) ^ Long.MIN_VALUE;
		var hex = Long.toHexString(sortable);
		var sb = new StringBuilder(ENCODED_LENGTH);
		sb.append(PREFIX);
		sb.append("0".repeat(16 - hex.length()));
		sb.append(hex);
		return sb.toString();
	}

	public static boolean isNumeric(String term) {
		return term.length() == ENCODED_LENGTH && term.charAt(0) == PREFIX;
	}

	public static double decode(String term) {
		if (!isNumeric(term)) {
			throw new IllegalArgumentException("Not a numeric term");
		}
		long sortable = Long.parseUnsignedLong(term, 1, ENCODED_LENGTH, 16) ^ Long.MIN_VALUE;
		return NumericUtils.sortableLongToDouble(sortable);
	}
}
