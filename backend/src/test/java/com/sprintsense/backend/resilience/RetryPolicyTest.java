package com.sprintsense.backend.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.exponential(5, Duration.ofSeconds(1), Duration.ofSeconds(10), 0.1);

    @Test
    void shouldDoubleDelayUntilMaxDelay() {
        assertThat(policy.baseDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.baseDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.baseDelay(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.baseDelay(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.baseDelay(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.baseDelay(40)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldApplyJitterWithinFraction() {
        assertThat(policy.delay(2, 1.0)).isEqualTo(Duration.ofMillis(2200));
        assertThat(policy.delay(2, -1.0)).isEqualTo(Duration.ofMillis(1800));
        assertThat(policy.delay(2, 0.0)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void shouldMakeSingleAttemptWhenRetriesDisabled() {
        int[] calls = {0};

        assertThatThrownBy(() -> RetryPolicy.none().execute(() -> {
            calls[0]++;
            throw new IllegalStateException("once");
        })).hasMessage("once");

        assertThat(calls[0]).isEqualTo(1);
        assertThat(RetryPolicy.none().getMaxAttempts()).isEqualTo(1);
    }

    @Test
    void shouldStopRetryingWhenInterrupted() {
        RetryPolicy interrupted = policy.withSleeper(duration -> {
            throw new InterruptedException();
        });

        assertThatThrownBy(() -> interrupted.execute(() -> {
            throw new IllegalStateException("first failure");
        })).hasMessage("first failure");

        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> RetryPolicy.exponential(0, Duration.ZERO, Duration.ZERO, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.exponential(3, Duration.ZERO, Duration.ZERO, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
