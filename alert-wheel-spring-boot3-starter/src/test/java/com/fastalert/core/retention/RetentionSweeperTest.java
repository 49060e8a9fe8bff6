package com.fastalert.core.retention;

import com.fastalert.model.Alert;
import com.fastalert.model.AlertFact;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.enums.Severity;
import com.fastalert.support.AlertWheelFixture;
import com.fastalert.support.RecordingChannelAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RetentionSweeperTest {

    private AlertWheelFixture f;

    @BeforeEach
    void setUp() {
        f = AlertWheelFixture.create(x -> {
            x.props.getRetention().setResolvedRetention(Duration.ofDays(7));
            x.props.getRetention().setArchiveAfter(Duration.ofDays(30));
        }, new RecordingChannelAdapter("rec"));
    }

    @AfterEach
    void tearDown() {
        f.close();
    }

    private String resolvedAlert(String subject) {
        String id = f.lifecycle.admit(AlertFact.builder().kind("k").severity(Severity.LOW)
                .title("t").subjectId(subject).build()).getAlert().getId();
        f.lifecycle.resolve(id, "alice", null);
        await().atMost(Duration.ofSeconds(5)).until(() -> f.auditStore.findByAlert(id).size() == 2);
        return id;
    }

    @Test
    void closesOnlyAfterRetention() {
        String id = resolvedAlert("s-1");
        Instant now = Instant.now();

        assertThat(f.sweeper.closeExpired(now.plus(Duration.ofDays(6)))).isZero();
        assertThat(f.sweeper.closeExpired(now.plus(Duration.ofDays(8)))).isEqualTo(1);

        Alert a = f.lifecycle.get(id);
        assertThat(a.getStatus()).isEqualTo(AlertStatus.CLOSED);
        assertThat(a.getClosedAt()).isNotNull();
    }

    @Test
    void purgesClosedAfterArchiveWindow() {
        String id = resolvedAlert("s-1");
        f.sweeper.closeExpired(Instant.now().plus(Duration.ofDays(8)));

        assertThat(f.sweeper.purgeArchived(Instant.now().plus(Duration.ofDays(29)))).isZero();
        assertThat(f.sweeper.purgeArchived(Instant.now().plus(Duration.ofDays(31)))).isEqualTo(1);

        assertThat(f.alertStore.findById(id)).isEmpty();
        assertThat(f.historyStore.findByAlert(id)).isEmpty();
        assertThat(f.auditStore.findByAlert(id)).isEmpty();
        assertThat(f.meterRegistry.get("alert.retention.purged").counter().count()).isEqualTo(1.0);
    }

    @Test
    void openAlertsAreUntouched() {
        String open = f.lifecycle.admit(AlertFact.builder().kind("k").severity(Severity.LOW)
                .title("t").subjectId("open").build()).getAlert().getId();

        f.sweeper.closeExpired(Instant.now().plus(Duration.ofDays(365)));
        f.sweeper.purgeArchived(Instant.now().plus(Duration.ofDays(365)));

        assertThat(f.lifecycle.get(open).getStatus()).isEqualTo(AlertStatus.OPEN);
    }
}
