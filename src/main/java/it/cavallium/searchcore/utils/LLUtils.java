package it.cavallium.searchcore.utils;

import java.io.Closeable;
import java.io.IOException;
import java.util.Arrays;
import java.util.HexFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IOUtils;
import org.jetbrains.annotations.Nullable;

public class LLUtils {

	private static final Logger logger = LogManager.getLogger(LLUtils.class);
	public static final Marker MARKER_SEARCH = MarkerManager.getMarker("SEARCH");
	public static final Marker MARKER_POOL = MarkerManager.getMarker("POOL");

	public static final HexFormat HEX_FORMAT = HexFormat.of().withUpperCase();

	public static String toStringSafe(@Nullable BytesRef id) {
		if (id == null) {
			return "(null)";
		}
		return HEX_FORMAT.formatHex(id.bytes, id.offset, id.offset + id.length);
	}

	/**
	 * Close every resource, even if some of them fail.
	 * The first failure is rethrown, the following ones are added to it as suppressed exceptions
	 */
	public static void closeAll(Iterable<? extends Closeable> resources) throws IOException {
		try {
			IOUtils.close(resources);
		} catch (IOException | RuntimeException ex) {
			logger.debug(MARKER_SEARCH, "Failed to close some resources, {} suppressed errors",
					ex.getSuppressed().length, ex);
			throw ex;
		}
	}

	public static void closeAll(Closeable... resources) throws IOException {
		closeAll(Arrays.asList(resources));
	}

	/**
	 * Close every resource after a failure, attaching close errors to the original failure
	 */
	public static void closeAfterFailure(Throwable failure, Iterable<? extends Closeable> resources) {
		for (Closeable resource : resources) {
			if (resource == null) {
				continue;
			}
			try {
				resource.close();
			} catch (IOException | RuntimeException ex) {
				failure.addSuppressed(ex);
			}
		}
	}
}
