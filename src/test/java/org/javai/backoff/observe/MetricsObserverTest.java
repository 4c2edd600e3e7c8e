package org.javai.backoff.observe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.backoff.Arguments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsObserverTest {

	private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private final ObjectMapper objectMapper = new ObjectMapper();
	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsObserver metrics;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		metrics = new MetricsObserver(null, capturingLogger, FIXED_CLOCK);
	}

	@Test
	void backoff_emitsEventAsJsonLine() throws IOException {
		Details details = new Details("fetchUser", Arguments.empty(), 2, 0.31, 0.4, null,
				new ConnectException("refused"));

		metrics.observer(RetryEvent.BACKOFF).onEvent(details);

		assertThat(capturedMessages).hasSize(1);
		JsonNode json = objectMapper.readTree(capturedMessages.get(0));
		assertThat(json.get("eventType").asText()).isEqualTo("backoff");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("fetchUser");
		assertThat(json.get("tries").asInt()).isEqualTo(2);
		assertThat(json.get("elapsedMs").asLong()).isEqualTo(310);
		assertThat(json.get("waitMs").asLong()).isEqualTo(400);
		assertThat(json.get("exception").asText()).isEqualTo("java.net.ConnectException");
	}

	@Test
	void fieldsAreWrittenInStableOrder() throws IOException {
		Details details = new Details("poll", Arguments.empty(), 3, 1.0, null, "", null);

		metrics.observer(RetryEvent.GIVEUP).onEvent(details);

		JsonNode json = objectMapper.readTree(capturedMessages.get(0));
		List<String> names = new ArrayList<>();
		json.fieldNames().forEachRemaining(names::add);
		assertThat(names).containsExactly("eventType", "timestamp", "trackingKey", "tries", "elapsedMs");
	}

	@Test
	void success_omitsWaitAndException() throws IOException {
		Details details = new Details("fetchUser", Arguments.empty(), 1, 0.0, null, "user", null);

		metrics.observer(RetryEvent.SUCCESS).onEvent(details);

		JsonNode json = objectMapper.readTree(capturedMessages.get(0));
		assertThat(json.get("eventType").asText()).isEqualTo("success");
		assertThat(json.has("waitMs")).isFalse();
		assertThat(json.has("exception")).isFalse();
	}

	@Test
	void withNamespace_prependsToTrackingKey() throws IOException {
		MetricsObserver namespaced = new MetricsObserver("myapp", capturingLogger, FIXED_CLOCK);

		namespaced.observer(RetryEvent.TRY).onEvent(new Details("order.fetch", Arguments.empty(), 0, 0.0, null, null, null));

		JsonNode json = objectMapper.readTree(capturedMessages.get(0));
		assertThat(json.get("trackingKey").asText()).isEqualTo("myapp.order.fetch");
	}

	@Test
	void withBlankNamespace_usesTargetOnly() {
		MetricsObserver blank = new MetricsObserver("  ", capturingLogger, FIXED_CLOCK);

		assertThat(blank.buildTrackingKey("order.fetch")).isEqualTo("order.fetch");
	}

	@Test
	void targetIsEscaped() throws IOException {
		Details details = new Details("parser\\\"quoted\"", Arguments.empty(), 0, 0.0, null, null, null);

		metrics.observer(RetryEvent.TRY).onEvent(details);

		JsonNode json = objectMapper.readTree(capturedMessages.get(0));
		assertThat(json.get("trackingKey").asText()).isEqualTo("parser\\\"quoted\"");
	}

	@Test
	void observer_requiresEvent() {
		assertThatThrownBy(() -> metrics.observer(null))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	void logsAtInfo() {
		metrics.observer(RetryEvent.TRY).onEvent(new Details("op", Arguments.empty(), 0, 0.0, null, null, null));

		assertThat(capturingLogger.levels).containsExactly(Level.INFO);
	}

	private static class CapturingLogger extends LegacyAbstractLogger {
		private final List<String> messages;
		private final List<Level> levels = new ArrayList<>();

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "test";
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		protected String getFullyQualifiedCallerName() { return null; }

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
												   Object[] arguments, Throwable throwable) {
			levels.add(level);
			messages.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
		}
	}
}
