package com.fastalert.store.memory;

import com.fastalert.model.Alert;
import com.fastalert.model.AlertFilter;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.enums.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAlertStoreTest {

    private final InMemoryAlertStore store = new InMemoryAlertStore();

    private static Alert alert(String id, String fp, Severity severity, String team, Instant createdAt) {
        return Alert.builder().id(id).fingerprint(fp).kind("k").severity(severity)
                .status(AlertStatus.OPEN).assignedTeam(team).createdAt(createdAt).build();
    }

    @Test
    void readsAreCopies() {
        store.insert(alert("a", "fp", Severity.LOW, "t", Instant.now()));

        store.findById("a").orElseThrow().setStatus(AlertStatus.CLOSED);

        assertThat(store.findById("a").orElseThrow().getStatus()).isEqualTo(AlertStatus.OPEN);
    }

    @Test
    void terminalUpdateLeavesActiveIndex() {
        Alert a = store.insert(alert("a", "fp", Severity.LOW, "t", Instant.now()));
        assertThat(store.findActiveByFingerprint("fp")).isPresent();

        a.setStatus(AlertStatus.ACKNOWLEDGED);
        store.update(a);
        assertThat(store.findActiveByFingerprint("fp")).isPresent();

        a.setStatus(AlertStatus.RESOLVED);
        store.update(a);
        assertThat(store.findActiveByFingerprint("fp")).isEmpty();
        assertThat(store.findById("a")).isPresent();
    }

    @Test
    void duplicateIdIsRejected() {
        store.insert(alert("a", "fp", Severity.LOW, "t", Instant.now()));

        assertThatThrownBy(() -> store.insert(alert("a", "fp2", Severity.LOW, "t", Instant.now())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void listFiltersAndOrdersByCreation() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        store.insert(alert("b", "fp-b", Severity.HIGH, "sre", t0.plusSeconds(10)));
        store.insert(alert("a", "fp-a", Severity.HIGH, "ops", t0));
        store.insert(alert("c", "fp-c", Severity.LOW, "sre", t0.plusSeconds(5)));

        assertThat(store.list(AlertFilter.all())).extracting(Alert::getId).containsExactly("a", "c", "b");
        assertThat(store.list(AlertFilter.builder().severity(Severity.HIGH).build()))
                .extracting(Alert::getId).containsExactly("a", "b");
        assertThat(store.list(AlertFilter.builder().team("sre").severity(Severity.LOW).build()))
                .extracting(Alert::getId).containsExactly("c");
    }

    @Test
    void retentionQueries() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        Alert resolved = alert("r", "fp-r", Severity.LOW, "t", t0);
        resolved.setStatus(AlertStatus.RESOLVED);
        resolved.setResolvedAt(t0);
        Alert closed = alert("c", "fp-c", Severity.LOW, "t", t0);
        closed.setStatus(AlertStatus.CLOSED);
        closed.setClosedAt(t0.plusSeconds(100));
        store.insert(resolved);
        store.insert(closed);

        assertThat(store.findResolvedBefore(t0.plusSeconds(1))).extracting(Alert::getId).containsExactly("r");
        assertThat(store.findResolvedBefore(t0)).isEmpty();
        assertThat(store.findClosedBefore(t0.plusSeconds(50))).isEmpty();
        assertThat(store.findClosedBefore(t0.plusSeconds(101))).extracting(Alert::getId).containsExactly("c");
        assertThat(store.delete("c")).isTrue();
        assertThat(store.delete("c")).isFalse();
    }
}
