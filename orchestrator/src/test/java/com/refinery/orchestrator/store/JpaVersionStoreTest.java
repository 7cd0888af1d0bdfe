package com.refinery.orchestrator.store;

import com.refinery.orchestrator.error.ConflictException;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.error.ValidationException;
import com.refinery.orchestrator.model.FileVersion;
import com.refinery.orchestrator.model.VersionAudit;
import com.refinery.orchestrator.repository.VersionAuditRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({JpaVersionStore.class, JpaVersionStoreTest.ClockConfig.class})
class JpaVersionStoreTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        }
    }

    @Autowired JpaVersionStore        store;
    @Autowired VersionAuditRepository auditRepo;

    private final UUID jobA = UUID.randomUUID();
    private final UUID jobB = UUID.randomUUID();

    @Test
    void putVersion_thenRead() {
        store.putVersion("doc-1", 0, "original", jobA);
        store.putVersion("doc-1", 1, "refined", jobA);

        FileVersion v = store.getVersion("doc-1", 1);
        assertThat(v.getContent()).isEqualTo("refined");
        assertThat(v.getJobId()).isEqualTo(jobA);
        assertThat(store.findVersion("doc-1", 2)).isEmpty();
    }

    @Test
    void putVersion_duplicatePass_isRejectedAndKeepsFirst() {
        store.putVersion("doc-1", 1, "first", jobA);

        assertThatThrownBy(() -> store.putVersion("doc-1", 1, "second", jobB))
                .isInstanceOf(ConflictException.class);
        assertThat(store.getVersion("doc-1", 1).getContent()).isEqualTo("first");
    }

    @Test
    void putVersion_negativePass_isRejected() {
        assertThatThrownBy(() -> store.putVersion("doc-1", -1, "x", jobA))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void getVersion_missing_throwsNotFound() {
        assertThatThrownBy(() -> store.getVersion("doc-1", 3))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void listPasses_isAscendingAndPerFile() {
        store.putVersion("doc-1", 2, "c", jobA);
        store.putVersion("doc-1", 0, "a", jobA);
        store.putVersion("doc-1", 1, "b", jobA);
        store.putVersion("doc-2", 0, "other", jobB);

        assertThat(store.listPasses("doc-1")).containsExactly(0, 1, 2);
        assertThat(store.listPasses("missing")).isEmpty();
    }

    @Test
    void replaceVersion_keepsOldContentInAudit() {
        store.putVersion("doc-1", 1, "stale", jobA);

        FileVersion replaced = store.replaceVersion("doc-1", 1, "fresh", jobB, "Superseded by job " + jobB);

        assertThat(replaced.getContent()).isEqualTo("fresh");
        assertThat(replaced.getJobId()).isEqualTo(jobB);
        assertThat(store.listPasses("doc-1")).containsExactly(1);

        List<VersionAudit> audit = auditRepo.findByFileIdAndPassNumberOrderByReplacedAtAsc("doc-1", 1);
        assertThat(audit).hasSize(1);
        assertThat(audit.get(0).getPreviousContent()).isEqualTo("stale");
        assertThat(audit.get(0).getPreviousJobId()).isEqualTo(jobA);
        assertThat(audit.get(0).getReplacedByJobId()).isEqualTo(jobB);
    }

    @Test
    void replaceVersion_missing_throwsNotFound() {
        assertThatThrownBy(() -> store.replaceVersion("doc-1", 1, "x", jobA, "reason"))
                .isInstanceOf(NotFoundException.class);
    }
}
