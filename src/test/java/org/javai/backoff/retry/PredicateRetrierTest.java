package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.observe.Details;
import org.javai.backoff.wait.WaitGenerator;
import org.javai.backoff.wait.WaitGenerators;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class PredicateRetrierTest {

    private List<Details> tryEvents;
    private List<Details> backoffEvents;
    private List<Details> giveupEvents;
    private List<Details> successEvents;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        tryEvents = new ArrayList<>();
        backoffEvents = new ArrayList<>();
        giveupEvents = new ArrayList<>();
        successEvents = new ArrayList<>();
        sleeps = new ArrayList<>();
    }

    @Test
    void call_retriesWhileFalsy() throws Exception {
        PredicateRetrier<String> retrier = this.<String>recording(WaitGenerators.constant(1)).build();
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.call("poll", () -> attempts.incrementAndGet() < 3 ? "" : "ready");

        assertThat(result).isEqualTo("ready");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(tryEvents).hasSize(3);
        assertThat(backoffEvents).hasSize(2);
        assertThat(giveupEvents).isEmpty();
        assertThat(successEvents).singleElement().satisfies(details -> {
            assertThat(details.tries()).isEqualTo(3);
            assertThat(details.value()).isEqualTo("ready");
            assertThat(details.waitSeconds()).isNull();
        });
    }

    @Test
    void call_tryObserversSeeCountBeforeAttempt() throws Exception {
        PredicateRetrier<Integer> retrier = this.<Integer>recording(WaitGenerators.constant(1)).build();
        AtomicInteger attempts = new AtomicInteger();

        retrier.call("count", () -> attempts.incrementAndGet() < 3 ? 0 : 1);

        assertThat(tryEvents).extracting(Details::tries).containsExactly(0, 1, 2);
        assertThat(backoffEvents).extracting(Details::tries).containsExactly(1, 2);
        assertThat(backoffEvents).extracting(Details::value).containsExactly(0, 0);
    }

    @Test
    void call_maxTriesReached_returnsLastResult() throws Exception {
        PredicateRetrier<Integer> retrier = this.<Integer>recording(WaitGenerators.constant(1))
                .predicate(value -> true)
                .maxTries(3)
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Integer result = retrier.call("poll", attempts::incrementAndGet);

        assertThat(result).isEqualTo(3);
        assertThat(backoffEvents).hasSize(2);
        assertThat(giveupEvents).singleElement().satisfies(details -> {
            assertThat(details.tries()).isEqualTo(3);
            assertThat(details.value()).isEqualTo(3);
            assertThat(details.exception()).isNull();
        });
        assertThat(successEvents).isEmpty();
    }

    @Test
    void call_sleepsTheRawWaitsWithoutJitter() throws Exception {
        PredicateRetrier<Boolean> retrier = this.<Boolean>recording(WaitGenerators.expo())
                .maxTries(4)
                .build();

        retrier.call("check", () -> false);

        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(backoffEvents).extracting(Details::waitSeconds).containsExactly(1.0, 2.0, 4.0);
    }

    @Test
    void call_finiteSequenceExhausted_givesUpWithLastValue() throws Exception {
        PredicateRetrier<String> retrier = this.<String>recording(WaitGenerators.constant(1, 2, 3, 6, 9)).build();

        String result = retrier.call("poll", () -> "");

        assertThat(result).isEmpty();
        assertThat(sleeps).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3),
                Duration.ofSeconds(6), Duration.ofSeconds(9));
        assertThat(backoffEvents).hasSize(5);
        assertThat(giveupEvents).singleElement()
                .satisfies(details -> assertThat(details.tries()).isEqualTo(6));
    }

    @Test
    void call_operationException_propagatesWithoutRetry() {
        PredicateRetrier<String> retrier = this.<String>recording(WaitGenerators.constant(1)).build();
        IllegalStateException failure = new IllegalStateException("broken");

        assertThatThrownBy(() -> retrier.call("poll", () -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(tryEvents).hasSize(1);
        assertThat(backoffEvents).isEmpty();
        assertThat(giveupEvents).isEmpty();
        assertThat(successEvents).isEmpty();
    }

    @Test
    void call_runtimeWaitReceivesEachResult() throws Exception {
        List<Integer> results = List.of(3, 2, 0);
        AtomicInteger attempts = new AtomicInteger();
        PredicateRetrier<Integer> retrier = this.<Integer>recording(
                        WaitGenerators.runtime(outcome -> (Integer) outcome))
                .predicate(value -> value != 0)
                .build();

        Integer result = retrier.call("countdown", () -> results.get(attempts.getAndIncrement()));

        assertThat(result).isZero();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(3), Duration.ofSeconds(2));
    }

    @Test
    void call_maxTriesSupplier_isResolvedPerCall() throws Exception {
        AtomicInteger limit = new AtomicInteger(2);
        PredicateRetrier<Boolean> retrier = this.<Boolean>recording(WaitGenerators.constant(1))
                .maxTries(limit::get)
                .build();

        retrier.call("first", () -> false);
        limit.set(4);
        retrier.call("second", () -> false);

        assertThat(giveupEvents).extracting(Details::target, Details::tries)
                .containsExactly(tuple("first", 2), tuple("second", 4));
    }

    @Test
    void call_invalidMaxTriesSupplier_failsAtCallTime() {
        PredicateRetrier<Boolean> retrier = this.<Boolean>recording(WaitGenerators.constant(1))
                .maxTries(() -> 0)
                .build();

        assertThatThrownBy(() -> retrier.call("poll", () -> true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTries");
        assertThat(tryEvents).isEmpty();
    }

    @Test
    void call_maxTriesBeyondIntRange_isNotNarrowed() throws Exception {
        PredicateRetrier<Integer> retrier = this.<Integer>recording(WaitGenerators.constant(1))
                .maxTries(() -> 3_000_000_000L)
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Integer result = retrier.call("poll", () -> attempts.incrementAndGet() < 3 ? 0 : 1);

        assertThat(result).isEqualTo(1);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(giveupEvents).isEmpty();
        assertThat(successEvents).hasSize(1);
    }

    @Test
    void call_fractionalMaxTries_isRejected() {
        PredicateRetrier<Boolean> retrier = this.<Boolean>recording(WaitGenerators.constant(1))
                .maxTries(() -> 2.5)
                .build();

        assertThatThrownBy(() -> retrier.call("poll", () -> false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("whole number");
        assertThat(tryEvents).isEmpty();
    }

    @Test
    void bind_passesArgumentsUnchangedToEveryAttempt() throws Exception {
        List<Arguments> received = new ArrayList<>();
        PredicateRetrier<String> retrier = this.<String>recording(WaitGenerators.constant(1)).build();
        RetryingOperation<String> lookup = retrier.bind("lookup", args -> {
            received.add(args);
            return received.size() < 3 ? null : args.get(0) + ":" + args.get("region");
        });
        Arguments arguments = Arguments.of("user-42").withKeyword("region", "eu");

        String result = lookup.invoke(arguments);

        assertThat(result).isEqualTo("user-42:eu");
        assertThat(lookup.target()).isEqualTo("lookup");
        assertThat(received).hasSize(3).allSatisfy(args -> assertThat(args).isSameAs(arguments));
        assertThat(tryEvents).allSatisfy(details -> {
            assertThat(details.args()).containsExactly("user-42");
            assertThat(details.kwargs()).containsEntry("region", "eu");
        });
    }

    @Test
    void bind_callWithPositionalArguments() throws Exception {
        PredicateRetrier<Integer> retrier = this.<Integer>recording(WaitGenerators.constant(1)).build();
        RetryingOperation<Integer> add = retrier.bind("add",
                args -> (Integer) args.get(0) + (Integer) args.get(1));

        assertThat(add.call(2, 3)).isEqualTo(5);
        assertThat(successEvents).singleElement()
                .satisfies(details -> assertThat(details.args()).containsExactly(2, 3));
    }

    @Test
    void call_defaultFullJitter_staysWithinRawWait() throws Exception {
        PredicateRetrier<Boolean> retrier = PredicateRetrier.<Boolean>builder(WaitGenerators.constant(2))
                .onBackoff(backoffEvents::add)
                .onGiveup(giveupEvents::add)
                .maxTries(20)
                .sleeper(sleeps::add)
                .build();

        retrier.call("poll", () -> false);

        assertThat(sleeps).hasSize(19)
                .allSatisfy(sleep -> assertThat(sleep).isBetween(Duration.ZERO, Duration.ofSeconds(2)));
    }

    @Test
    void call_observerException_abortsTheLoop() {
        IllegalStateException boom = new IllegalStateException("observer failed");
        AtomicInteger attempts = new AtomicInteger();
        PredicateRetrier<Boolean> retrier = this.<Boolean>recording(WaitGenerators.constant(1))
                .onBackoff(details -> {
                    throw boom;
                })
                .build();

        assertThatThrownBy(() -> retrier.call("poll", () -> {
            attempts.incrementAndGet();
            return false;
        })).isSameAs(boom);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void call_customPredicate() throws Exception {
        PredicateRetrier<String> retrier = this.<String>recording(WaitGenerators.constant(1))
                .predicate("RUNNING"::equals)
                .build();
        List<String> states = List.of("RUNNING", "RUNNING", "FAILED");
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.call("job", () -> states.get(attempts.getAndIncrement()));

        assertThat(result).isEqualTo("FAILED");
        assertThat(sleeps).hasSize(2);
    }

    private <T> PredicateRetrier.Builder<T> recording(WaitGenerator waits) {
        return PredicateRetrier.<T>builder(waits)
                .onTry(tryEvents::add)
                .onBackoff(backoffEvents::add)
                .onGiveup(giveupEvents::add)
                .onSuccess(successEvents::add)
                .jitter(null)
                .sleeper(sleeps::add);
    }
}
