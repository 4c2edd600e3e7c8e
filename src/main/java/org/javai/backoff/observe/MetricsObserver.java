package org.javai.backoff.observe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emits retry lifecycle events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event becomes one JSON object, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the target name, prefixed by an optional namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"backoff","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.fetchUser","tries":2,"elapsedMs":310,"waitMs":400,"exception":"java.net.ConnectException"}
 * }</pre>
 *
 * <p>Register the observers for the events to be tracked:</p>
 * <pre>{@code
 * MetricsObserver metrics = new MetricsObserver("myapp");
 * Backoff.onException(WaitGenerators.expo(), IOException.class)
 *     .onBackoff(metrics.observer(RetryEvent.BACKOFF))
 *     .onGiveup(metrics.observer(RetryEvent.GIVEUP))
 *     .build();
 * }</pre>
 */
public class MetricsObserver {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.backoff.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	/**
	 * Creates a MetricsObserver with no namespace and the default logger.
	 */
	public MetricsObserver() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsObserver with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsObserver(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsObserver with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsObserver(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsObserver(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.objectMapper = new ObjectMapper();
	}

	/**
	 * Returns an observer that records {@code event}.
	 *
	 * @param event the lifecycle event the observer will be registered for
	 * @return an observer writing one JSON line per notification
	 */
	public RetryObserver observer(RetryEvent event) {
		Objects.requireNonNull(event, "event must not be null");
		return details -> record(event, details);
	}

	void record(RetryEvent event, Details details) {
		try {
			logger.info(objectMapper.writeValueAsString(fields(event, details)));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize {} event for [{}]: {}",
					event.eventType(), details.target(), e.getOriginalMessage());
		}
	}

	private Map<String, Object> fields(RetryEvent event, Details details) {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("eventType", event.eventType());
		fields.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		fields.put("trackingKey", buildTrackingKey(details.target()));
		fields.put("tries", details.tries());
		fields.put("elapsedMs", details.elapsedDuration().toMillis());
		if (details.hasWait()) {
			fields.put("waitMs", details.waitDuration().toMillis());
		}
		if (details.exception() != null) {
			fields.put("exception", details.exception().getClass().getName());
		}
		return fields;
	}

	String buildTrackingKey(String target) {
		if (namespace == null) {
			return target;
		}
		return namespace + "." + target;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
