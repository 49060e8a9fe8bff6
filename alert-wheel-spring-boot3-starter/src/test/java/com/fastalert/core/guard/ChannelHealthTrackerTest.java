package com.fastalert.core.guard;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.exception.guard.ChannelUnavailableException;
import com.fastalert.model.ChannelHealth;
import com.fastalert.model.enums.CircuitState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ChannelHealthTrackerTest {

    private AlertGuardProperties props;

    private SimpleMeterRegistry registry;

    private ChannelHealthTracker tracker;

    @BeforeEach
    void setUp() {
        props = new AlertGuardProperties();
        props.getCircuitBreaker().setFailureThreshold(3);
        props.getCircuitBreaker().setCoolDown(Duration.ofMillis(200));
        props.getCircuitBreaker().setCoolDownMultiplier(1.0);
        registry = new SimpleMeterRegistry();
        tracker = new ChannelHealthTracker(props, AlertMetrics.create(registry));
    }

    private void fail(String channel, int times) {
        for (int i = 0; i < times; i++) {
            tracker.acquire(channel);
            tracker.onFailure(channel, 1_000, new IOException("down"));
        }
    }

    @Test
    void opensAfterConsecutiveFailures() {
        fail("sms", 2);
        assertThat(tracker.health("sms").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(tracker.health("sms").getFailureCount()).isEqualTo(2);

        fail("sms", 1);

        ChannelHealth h = tracker.health("sms");
        assertThat(h.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(h.getOpenedAt()).isNotNull();
        assertThatThrownBy(() -> tracker.acquire("sms"))
                .isInstanceOf(ChannelUnavailableException.class)
                .hasMessageContaining("sms");
        assertThat(registry.get("alert.guard.transition").tags("channel", "sms", "to", "OPEN").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void successBetweenFailuresKeepsCircuitClosed() {
        fail("sms", 2);
        tracker.acquire("sms");
        tracker.onSuccess("sms", 1_000);
        fail("sms", 2);

        assertThat(tracker.health("sms").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(tracker.health("sms").getFailureCount()).isEqualTo(2);
    }

    @Test
    void failureCountIsConsecutiveAndResetBySuccess() {
        fail("sms", 1);
        tracker.acquire("sms");
        tracker.onSuccess("sms", 1_000);
        assertThat(tracker.health("sms").getFailureCount()).isZero();

        fail("sms", 1);

        assertThat(tracker.health("sms").getFailureCount()).isEqualTo(1);
    }

    @Test
    void releasedPermitLetsNextProbeThrough() {
        fail("chat", 3);
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThatCode(() -> tracker.acquire("chat")).doesNotThrowAnyException());

        tracker.release("chat");

        assertThatCode(() -> tracker.acquire("chat")).doesNotThrowAnyException();
        assertThat(tracker.health("chat").getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void halfOpenAdmitsSingleProbeAndClosesOnSuccess() {
        fail("chat", 3);

        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThatCode(() -> tracker.acquire("chat")).doesNotThrowAnyException());
        assertThat(tracker.health("chat").getState()).isEqualTo(CircuitState.HALF_OPEN);
        // 探测在途时其余调用被拒
        assertThatThrownBy(() -> tracker.acquire("chat")).isInstanceOf(ChannelUnavailableException.class);

        tracker.onSuccess("chat", 1_000);

        assertThat(tracker.health("chat").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(tracker.health("chat").getOpenedAt()).isNull();
        assertThat(tracker.health("chat").getFailureCount()).isZero();
    }

    @Test
    void failedProbeReopens() {
        fail("chat", 3);
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThatCode(() -> tracker.acquire("chat")).doesNotThrowAnyException());

        tracker.onFailure("chat", 1_000, new IOException("still down"));

        assertThat(tracker.health("chat").getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void channelsAreIsolated() {
        fail("sms", 3);

        assertThatCode(() -> tracker.acquire("email")).doesNotThrowAnyException();
        assertThat(tracker.snapshot()).extracting(ChannelHealth::getChannel).containsExactly("email", "sms");
    }

    @Test
    void disabledBreakerAlwaysAdmits() {
        AlertGuardProperties.CbConfig off = new AlertGuardProperties.CbConfig();
        off.setEnabled(false);
        props.setPerChannel(Map.of("log", off));

        for (int i = 0; i < 10; i++) {
            tracker.acquire("log");
            tracker.onFailure("log", 1_000, new IOException("x"));
        }

        assertThat(tracker.health("log").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(tracker.getCircuitBreakerIfEnabled("log")).isNull();
    }
}
