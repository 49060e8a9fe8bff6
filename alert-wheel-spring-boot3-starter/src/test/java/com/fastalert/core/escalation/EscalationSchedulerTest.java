package com.fastalert.core.escalation;

import com.fastalert.model.Alert;
import com.fastalert.model.AlertFact;
import com.fastalert.model.AlertHistoryRecord;
import com.fastalert.model.EscalationSchedule;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.enums.HistoryAction;
import com.fastalert.model.enums.ScheduleStatus;
import com.fastalert.model.enums.Severity;
import com.fastalert.support.AlertWheelFixture;
import com.fastalert.support.RecordingChannelAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class EscalationSchedulerTest {

    private AlertWheelFixture f;

    @AfterEach
    void tearDown() {
        if (f != null) {
            f.close();
        }
    }

    private static AlertFact fact(Severity severity) {
        return AlertFact.builder()
                .kind("payment_failure")
                .severity(severity)
                .title("settlement batch stuck")
                .subjectType("batch")
                .subjectId("b-42")
                .build();
    }

    @Test
    void openAlertEscalatesWhenScheduleFires() {
        f = AlertWheelFixture.create(x -> x.setEscalationDelay(Severity.MEDIUM, Duration.ofMillis(100)),
                new RecordingChannelAdapter("rec"));

        String id = f.lifecycle.admit(fact(Severity.MEDIUM)).getAlert().getId();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> f.lifecycle.get(id).getSeverity() == Severity.HIGH);
        Alert a = f.lifecycle.get(id);
        assertThat(a.getEscalationLevel()).isEqualTo(1);
        assertThat(a.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(f.scheduleStore.findByAlert(id))
                .filteredOn(s -> s.getLevel() == 1)
                .extracting(EscalationSchedule::getStatus)
                .containsExactly(ScheduleStatus.FIRED);
        assertThat(f.historyStore.findByAlert(id))
                .extracting(AlertHistoryRecord::getAction)
                .containsExactly(HistoryAction.CREATED, HistoryAction.ESCALATED);
    }

    @Test
    void acknowledgedAlertIsNeverEscalated() throws Exception {
        f = AlertWheelFixture.create(x -> x.setEscalationDelay(Severity.HIGH, Duration.ofMillis(150)),
                new RecordingChannelAdapter("rec"));

        String id = f.lifecycle.admit(fact(Severity.HIGH)).getAlert().getId();
        f.lifecycle.acknowledge(id, "alice", null);

        Thread.sleep(400);

        Alert a = f.lifecycle.get(id);
        assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(a.getEscalationLevel()).isZero();
        assertThat(f.scheduleStore.findByAlert(id))
                .extracting(EscalationSchedule::getStatus)
                .containsExactly(ScheduleStatus.CANCELLED);
    }

    @Test
    void escalationChainsUntilCritical() {
        f = AlertWheelFixture.create(x -> {
            x.setEscalationDelay(Severity.LOW, Duration.ofMillis(50));
            x.setEscalationDelay(Severity.MEDIUM, Duration.ofMillis(50));
            x.setEscalationDelay(Severity.HIGH, Duration.ofMillis(50));
            x.setEscalationDelay(Severity.CRITICAL, Duration.ofMillis(50));
        }, new RecordingChannelAdapter("rec"));

        String id = f.lifecycle.admit(fact(Severity.LOW)).getAlert().getId();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> f.lifecycle.get(id).getSeverity() == Severity.CRITICAL);
        // CRITICAL 上挂的计划触发后不再变化
        await().atMost(Duration.ofSeconds(5))
                .until(() -> f.scheduleStore.findPendingByAlert(id).isEmpty());
        Alert a = f.lifecycle.get(id);
        assertThat(a.getEscalationLevel()).isEqualTo(3);
        assertThat(a.getChannels()).containsExactly("rec", "page");
    }

    @Test
    void disabledEscalationArmsNothing() {
        f = AlertWheelFixture.create(x -> x.props.getEscalation().setEnabled(false),
                new RecordingChannelAdapter("rec"));

        String id = f.lifecycle.admit(fact(Severity.HIGH)).getAlert().getId();

        assertThat(f.scheduleStore.findByAlert(id)).isEmpty();
        assertThat(f.scheduler.armedCount()).isZero();
    }

    @Test
    void rearmSameLevelReplacesPreviousTimeout() {
        f = AlertWheelFixture.create();
        List<Integer> fired = new CopyOnWriteArrayList<>();
        f.scheduler.bind((alertId, level) -> fired.add(level));

        f.scheduler.arm("a-1", Severity.HIGH, 1);
        String second = f.scheduler.arm("a-1", Severity.HIGH, 1);

        assertThat(f.scheduler.armedCount()).isEqualTo(1);
        assertThat(f.scheduleStore.findByAlert("a-1")).hasSize(1);
        assertThat(f.scheduleStore.findPending("a-1", 1)).get()
                .extracting(EscalationSchedule::getId).isEqualTo(second);
        assertThat(fired).isEmpty();
    }

    @Test
    void recoverFiresOverdueSchedules() {
        f = AlertWheelFixture.create();
        List<String> fired = new CopyOnWriteArrayList<>();
        f.scheduler.bind((alertId, level) -> fired.add(alertId + "#" + level));
        Instant past = Instant.now().minusSeconds(60);
        f.scheduleStore.save(EscalationSchedule.builder()
                .alertId("a-9").level(2).fireAt(past)
                .status(ScheduleStatus.PENDING).createdAt(past).updatedAt(past)
                .build());
        f.scheduleStore.save(EscalationSchedule.builder()
                .alertId("a-8").level(1).fireAt(past.plusSeconds(3600))
                .status(ScheduleStatus.CANCELLED).createdAt(past).updatedAt(past)
                .build());

        int recovered = f.scheduler.recover();

        assertThat(recovered).isEqualTo(1);
        await().atMost(Duration.ofSeconds(5)).until(() -> fired.contains("a-9#2"));
        assertThat(fired).containsExactly("a-9#2");
    }

    @Test
    void cancelTransitionsOnlyPendingSchedules() {
        f = AlertWheelFixture.create();
        f.scheduler.arm("a-1", Severity.LOW, 1);
        f.scheduler.arm("a-1", Severity.MEDIUM, 2);

        assertThat(f.scheduler.cancel("a-1")).isEqualTo(2);
        assertThat(f.scheduler.cancel("a-1")).isZero();
        assertThat(f.scheduleStore.findByAlert("a-1"))
                .extracting(EscalationSchedule::getStatus)
                .containsOnly(ScheduleStatus.CANCELLED);
    }
}
