package org.javai.backoff.observe;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Destination of the default backoff and give-up log lines.
 * Messages use Log4j2 {@code {}} placeholders.
 */
@FunctionalInterface
public interface LogSink {

	void log(Level level, String message, Object... params);

	/**
	 * A sink writing to a Log4j2 logger.
	 */
	static LogSink of(Logger logger) {
		Objects.requireNonNull(logger, "logger must not be null");
		return (level, message, params) -> logger.log(level, message, params);
	}
}
