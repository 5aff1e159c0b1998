package it.cavallium.searchcore.utils;

import java.io.Closeable;
import java.io.IOException;
import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Closeable resource that reports an error if it gets garbage collected without being closed
 */
public abstract class SimpleResource implements Closeable {

	protected static final boolean ENABLE_LEAK_DETECTION
			= Boolean.parseBoolean(System.getProperty("it.cavallium.searchcore.leakdetection.enable", "true"));
	protected static final boolean ADVANCED_LEAK_DETECTION
			= Boolean.parseBoolean(System.getProperty("it.cavallium.searchcore.leakdetection.advanced", "false"));
	private static final Logger LOG = LogManager.getLogger(SimpleResource.class);
	public static final Cleaner CLEANER = Cleaner.create();

	private final AtomicBoolean closed;

	public SimpleResource() {
		var closed = new AtomicBoolean();
		this.closed = closed;

		if (ENABLE_LEAK_DETECTION) {
			var resourceClass = this.getClass();
			Exception initializationStackTrace;
			if (ADVANCED_LEAK_DETECTION) {
				var stackTrace = Thread.currentThread().getStackTrace();
				initializationStackTrace = new Exception("Initialization point");
				initializationStackTrace.setStackTrace(stackTrace);
			} else {
				initializationStackTrace = null;
			}
			CLEANER.register(this, () -> {
				if (!closed.get()) {
					LOG.error("Resource leak of type {}", resourceClass, initializationStackTrace);
				}
			});
		}
	}

	/**
	 * Close this resource. Only the first call has effect
	 */
	@Override
	public final void close() throws IOException {
		if (closed.compareAndSet(false, true)) {
			onClose();
		}
	}

	public boolean isClosed() {
		return closed.get();
	}

	protected abstract void onClose() throws IOException;
}
