package org.javai.backoff.observe;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Where and at which levels a retrier logs when it falls back to its default observers.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Backoff.onException(WaitGenerators.expo(), IOException.class)
 *     .logging(RetryLogging.named("payments.client")
 *         .withBackoffLevel(Level.DEBUG)
 *         .withGiveupLevel(Level.WARN))
 *     .build();
 * }</pre>
 *
 * <p>{@link #disabled()} silences the defaults only. Observers registered explicitly still run.
 */
public final class RetryLogging {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.backoff";

	private static final RetryLogging DISABLED = new RetryLogging(null, Level.INFO, Level.ERROR);

	private final LogSink sink;
	private final Level backoffLevel;
	private final Level giveupLevel;

	private RetryLogging(LogSink sink, Level backoffLevel, Level giveupLevel) {
		this.sink = sink;  // null means disabled
		this.backoffLevel = backoffLevel;
		this.giveupLevel = giveupLevel;
	}

	/**
	 * Logs to {@value #DEFAULT_LOGGER_NAME}: backoffs at INFO, give-ups at ERROR.
	 */
	public static RetryLogging defaults() {
		return named(DEFAULT_LOGGER_NAME);
	}

	public static RetryLogging named(String loggerName) {
		Objects.requireNonNull(loggerName, "loggerName must not be null");
		return to(LogManager.getLogger(loggerName));
	}

	public static RetryLogging to(Logger logger) {
		return to(LogSink.of(logger));
	}

	public static RetryLogging to(LogSink sink) {
		Objects.requireNonNull(sink, "sink must not be null");
		return new RetryLogging(sink, Level.INFO, Level.ERROR);
	}

	public static RetryLogging disabled() {
		return DISABLED;
	}

	public RetryLogging withBackoffLevel(Level level) {
		Objects.requireNonNull(level, "level must not be null");
		return new RetryLogging(sink, level, giveupLevel);
	}

	public RetryLogging withGiveupLevel(Level level) {
		Objects.requireNonNull(level, "level must not be null");
		return new RetryLogging(sink, backoffLevel, level);
	}

	public boolean isEnabled() {
		return sink != null;
	}

	public Level backoffLevel() {
		return backoffLevel;
	}

	public Level giveupLevel() {
		return giveupLevel;
	}

	/**
	 * The default backoff observers: one logging observer, or none when disabled.
	 */
	public List<RetryObserver> defaultBackoffObservers() {
		return isEnabled() ? List.of(LoggingObservers.backoff(sink, backoffLevel)) : List.of();
	}

	/**
	 * The default give-up observers: one logging observer, or none when disabled.
	 */
	public List<RetryObserver> defaultGiveupObservers() {
		return isEnabled() ? List.of(LoggingObservers.giveup(sink, giveupLevel)) : List.of();
	}
}
