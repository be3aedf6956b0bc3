package io.github.drompincen.carebridge.runtime.conflict;

import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.runtime.transform.DocumentHeader;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictResolverTest {

    private static final Instant T1 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T11:00:00Z");

    private final ConflictResolver resolver = new ConflictResolver();

    @Test
    void appliesWhenNothingStored() {
        assertThat(resolver.shouldApply(null, header(T1))).isTrue();
    }

    @Test
    void rejectsOlderIncoming() {
        assertThat(resolver.shouldApply(stored(T2), header(T1))).isFalse();
    }

    @Test
    void tiesFavorIncoming() {
        assertThat(resolver.shouldApply(stored(T1), header(T1))).isTrue();
        assertThat(resolver.shouldApply(stored(T1), header(T2))).isTrue();
    }

    @Test
    void missingBusinessTimeApplies() {
        assertThat(resolver.shouldApply(stored(null), header(T1))).isTrue();
        assertThat(resolver.shouldApply(stored(T2), header(null))).isTrue();
    }

    @Test
    void orderingSignalNeverRegressesOrClears() {
        assertThat(resolver.orderingSignal(stored(T2), header(null))).isEqualTo(T2);
        assertThat(resolver.orderingSignal(stored(T1), header(T2))).isEqualTo(T2);
        assertThat(resolver.orderingSignal(stored(T2), header(T1))).isEqualTo(T2);
        assertThat(resolver.orderingSignal(null, header(T1))).isEqualTo(T1);
    }

    private static ClinicalSessionEntity stored(Instant updatedAt) {
        ClinicalSessionEntity entity = new ClinicalSessionEntity();
        entity.setCouchId("session:s1");
        entity.setCouchRev("1-a");
        entity.setCouchUpdatedAt(updatedAt);
        return entity;
    }

    private static DocumentHeader header(Instant businessTime) {
        return new DocumentHeader("session:s1", "2-b", businessTime, null, null, "{}");
    }
}
