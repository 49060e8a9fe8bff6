package com.fastalert.store.memory;

import com.fastalert.exception.DuplicateScheduleException;
import com.fastalert.model.EscalationSchedule;
import com.fastalert.model.enums.ScheduleStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEscalationScheduleStoreTest {

    private final InMemoryEscalationScheduleStore store = new InMemoryEscalationScheduleStore();

    private final Instant now = Instant.parse("2024-01-01T00:00:00Z");

    private EscalationSchedule pending(String alertId, int level, Instant fireAt) {
        return EscalationSchedule.builder().alertId(alertId).level(level).fireAt(fireAt)
                .status(ScheduleStatus.PENDING).createdAt(now).updatedAt(now).build();
    }

    @Test
    void atMostOnePendingPerAlertAndLevel() {
        EscalationSchedule first = store.save(pending("a", 1, now));

        assertThatThrownBy(() -> store.save(pending("a", 1, now.plusSeconds(5))))
                .isInstanceOf(DuplicateScheduleException.class);

        EscalationSchedule replaced = store.upsert(pending("a", 1, now.plusSeconds(5)));
        assertThat(replaced.getId()).isEqualTo(first.getId());
        assertThat(replaced.getFireAt()).isEqualTo(now.plusSeconds(5));
        assertThat(store.findPendingByAlert("a")).hasSize(1);
    }

    @Test
    void transitionOnlyFromPending() {
        store.save(pending("a", 1, now));

        assertThat(store.transition("a", 1, ScheduleStatus.FIRED, now)).isTrue();
        assertThat(store.transition("a", 1, ScheduleStatus.CANCELLED, now)).isFalse();
        assertThat(store.transition("a", 9, ScheduleStatus.CANCELLED, now)).isFalse();
        assertThat(store.findByAlert("a")).extracting(EscalationSchedule::getStatus)
                .containsExactly(ScheduleStatus.FIRED);
        assertThat(store.findPending("a", 1)).isEmpty();
    }

    @Test
    void newPendingAllowedAfterTerminal() {
        EscalationSchedule first = store.save(pending("a", 1, now));
        store.transition("a", 1, ScheduleStatus.CANCELLED, now);

        EscalationSchedule again = store.upsert(pending("a", 1, now.plusSeconds(60)));

        assertThat(again.getId()).isNotEqualTo(first.getId());
        assertThat(store.findPending("a", 1)).isPresent();
    }

    @Test
    void findAllPendingSortedByFireTime() {
        store.save(pending("a", 1, now.plusSeconds(30)));
        store.save(pending("b", 1, now.plusSeconds(10)));
        store.save(pending("a", 2, now.plusSeconds(20)));
        store.transition("a", 2, ScheduleStatus.SUPPRESSED, now);

        assertThat(store.findAllPending()).extracting(EscalationSchedule::key)
                .containsExactly("b#1", "a#1");
        assertThat(store.deleteByAlert("a")).isEqualTo(2);
        assertThat(store.findByAlert("a")).isEmpty();
    }
}
