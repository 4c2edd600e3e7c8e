package org.javai.backoff.observe;

import org.apache.logging.log4j.Level;

import java.util.Locale;
import java.util.Objects;

/**
 * The observers retriers fall back to when no backoff or give-up observers are configured.
 *
 * <p>The cause shown in parentheses is the exception's class and message for
 * exception-triggered retries, and the judged value for predicate-triggered retries.
 */
public final class LoggingObservers {

	static final String BACKOFF_MESSAGE = "Backing off {}(...) for {}s ({})";
	static final String GIVEUP_MESSAGE = "Giving up {}(...) after {} tries ({})";

	private LoggingObservers() {}

	/**
	 * Logs one line per backoff at {@code level}.
	 */
	public static RetryObserver backoff(LogSink sink, Level level) {
		Objects.requireNonNull(sink, "sink must not be null");
		Objects.requireNonNull(level, "level must not be null");
		return details -> sink.log(level, BACKOFF_MESSAGE,
				details.target(),
				String.format(Locale.ROOT, "%.1f", details.waitSeconds() == null ? 0d : details.waitSeconds()),
				cause(details));
	}

	/**
	 * Logs one line per give-up at {@code level}.
	 */
	public static RetryObserver giveup(LogSink sink, Level level) {
		Objects.requireNonNull(sink, "sink must not be null");
		Objects.requireNonNull(level, "level must not be null");
		return details -> sink.log(level, GIVEUP_MESSAGE,
				details.target(),
				details.tries(),
				cause(details));
	}

	static String cause(Details details) {
		Throwable exception = details.exception();
		if (exception != null) {
			String name = exception.getClass().getSimpleName();
			return exception.getMessage() == null ? name : name + ": " + exception.getMessage();
		}
		return String.valueOf(details.value());
	}
}
