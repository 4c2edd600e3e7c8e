package org.javai.backoff.retry;

import org.javai.backoff.jitter.JitterFunction;
import org.javai.backoff.jitter.Jitters;
import org.javai.backoff.wait.WaitGenerators;
import org.javai.backoff.wait.WaitSequence;
import org.javai.backoff.wait.WaitSequenceExhaustedException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class WaitAccountingTest {

    @Test
    void withoutJitterOrBudget_returnsRawValue() {
        WaitSequence waits = WaitGenerators.expo().start();

        assertThat(WaitAccounting.nextWait(waits, null, null, 0, null)).isEqualTo(1.0);
        assertThat(WaitAccounting.nextWait(waits, null, null, 0, null)).isEqualTo(2.0);
    }

    @Test
    void appliesJitterToRawValue() {
        WaitSequence waits = WaitGenerators.constant(4).start();
        JitterFunction halve = JitterFunction.of(value -> value / 2);

        assertThat(WaitAccounting.nextWait(waits, null, halve, 0, null)).isEqualTo(2.0);
    }

    @Test
    void truncatesToRemainingBudget() {
        WaitSequence waits = WaitGenerators.constant(5).start();

        assertThat(WaitAccounting.nextWait(waits, null, Jitters.none(), 8, 10.0)).isEqualTo(2.0);
    }

    @Test
    void spentBudget_returnsZeroWithoutJittering() {
        WaitSequence waits = WaitGenerators.constant(5).start();
        AtomicInteger jitterCalls = new AtomicInteger();
        JitterFunction counting = JitterFunction.of(value -> {
            jitterCalls.incrementAndGet();
            return value;
        });

        double wait = WaitAccounting.nextWait(waits, null, counting, 12, 10.0);

        assertThat(wait).isZero();
        assertThat(jitterCalls.get()).isZero();
    }

    @Test
    void spentBudget_stillAdvancesTheSequence() {
        WaitSequence waits = WaitGenerators.constant(1, 2).start();

        WaitAccounting.nextWait(waits, null, null, 10, 10.0);

        assertThat(WaitAccounting.nextWait(waits, null, null, 0, null)).isEqualTo(2.0);
    }

    @Test
    void exhaustion_propagates() {
        WaitSequence waits = WaitGenerators.constant(1, 1).start();
        WaitAccounting.nextWait(waits, null, null, 0, null);
        WaitAccounting.nextWait(waits, null, null, 0, null);

        assertThatThrownBy(() -> WaitAccounting.nextWait(waits, null, null, 0, null))
                .isInstanceOf(WaitSequenceExhaustedException.class);
    }

    @Test
    void passesOutcomeToSequence() {
        WaitSequence waits = WaitGenerators.runtime(outcome -> ((Number) outcome).doubleValue()).start();

        assertThat(WaitAccounting.nextWait(waits, 3, null, 0, null)).isEqualTo(3.0);
    }

    @Test
    @SuppressWarnings("deprecation")
    void offsetJitter_isAddedToRawValue() {
        WaitSequence waits = WaitGenerators.constant(2).start();

        double wait = WaitAccounting.nextWait(waits, null, JitterFunction.delta(() -> 0.5), 0, null);

        assertThat(wait).isEqualTo(2.5);
    }

    @Test
    void neverNegative() {
        WaitSequence waits = WaitGenerators.constant(1).start();
        JitterFunction negative = JitterFunction.of(value -> -value);

        assertThat(WaitAccounting.nextWait(waits, null, negative, 0, null)).isZero();
    }
}
