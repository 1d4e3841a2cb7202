package com.fundradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 30_000L, 0.2, 4);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_exponentialIncreasesUpToCap() {
        RetryPolicy policy = new RetryPolicy(100L, 350L, 0, 5);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(350L);
        assertThat(policy.delayMs(10)).isEqualTo(350L);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(4);
    }

    @Test
    @DisplayName("retryable failures are retried with backoff until success")
    void execute_retriesUntilSuccess() {
        RetryPolicy policy = new RetryPolicy(100L, 1000L, 0, 4);
        AtomicInteger calls = new AtomicInteger();
        List<Long> sleeps = new ArrayList<>();

        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return "ok";
        }, e -> true, sleeps::add);

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    @Test
    @DisplayName("non-retryable failure is rethrown immediately")
    void execute_nonRetryable_throwsWithoutSleeping() {
        RetryPolicy policy = new RetryPolicy(100L, 1000L, 0, 4);
        AtomicInteger calls = new AtomicInteger();
        List<Long> sleeps = new ArrayList<>();

        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad request");
        }, e -> !(e instanceof IllegalArgumentException), sleeps::add))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad request");
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("last failure is rethrown after max attempts")
    void execute_exhausted_rethrowsLast() {
        RetryPolicy policy = new RetryPolicy(10L, 100L, 0, 3);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            throw new IllegalStateException("attempt " + calls.incrementAndGet());
        }, e -> true, Sleeper.NONE))
                .hasMessage("attempt 3");
    }
}
