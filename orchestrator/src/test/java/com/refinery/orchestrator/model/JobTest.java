package com.refinery.orchestrator.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.refinery.orchestrator.error.InvalidTransitionException;
import com.refinery.orchestrator.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    static final Instant T1 = T0.plusSeconds(30);

    @Test
    void walksThroughEveryPassToCompletion() {
        Job job = job(3);

        job.apply(JobTransition.start(), T0);
        job.apply(JobTransition.passSucceeded(), T0);
        job.apply(JobTransition.passSucceeded(), T0);
        assertThat(job.getCurrentPass()).isEqualTo(2);

        job.apply(JobTransition.complete(JsonNodeFactory.instance.objectNode().put("passes", 3)), T1);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getCurrentPass()).isEqualTo(3);
        assertThat(job.getCompletedAt()).isEqualTo(T1);
        assertThat(job.getResult().get("passes").asInt()).isEqualTo(3);
    }

    @Test
    void completeBeforeLastPass_isRejectedWithoutChanges() {
        Job job = job(2);
        job.apply(JobTransition.start(), T0);

        assertThatThrownBy(() -> job.apply(JobTransition.complete(null), T1))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getCurrentPass()).isZero();
        assertThat(job.getUpdatedAt()).isEqualTo(T0);
    }

    @Test
    void passSucceededOnLastPass_isRejected() {
        Job job = job(1);
        job.apply(JobTransition.start(), T0);

        assertThatThrownBy(() -> job.apply(JobTransition.passSucceeded(), T1))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void failNeedsMessage() {
        Job job = job(1);
        job.apply(JobTransition.start(), T0);

        assertThatThrownBy(() -> job.apply(JobTransition.fail(" "), T1))
                .isInstanceOf(ValidationException.class);

        job.apply(JobTransition.fail("Pass 1 failed: boom"), T1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Pass 1 failed: boom");
        assertThat(job.getCompletedAt()).isEqualTo(T1);
    }

    @Test
    void cancelFromPending() {
        Job job = job(2);

        job.apply(JobTransition.cancel(), T1);

        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getCompletedAt()).isEqualTo(T1);
    }

    @ParameterizedTest
    @EnumSource(value = JobTransition.Kind.class)
    void terminalJobsAcceptNoTransition(JobTransition.Kind kind) {
        Job job = job(1);
        job.apply(JobTransition.cancel(), T0);

        JobTransition transition = new JobTransition(kind, null, "reason");
        assertThatThrownBy(() -> job.apply(transition, T1))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void nextSequence_countsUpFromOne() {
        Job job = job(1);

        assertThat(job.nextSequence(T0)).isEqualTo(1);
        assertThat(job.nextSequence(T1)).isEqualTo(2);
        assertThat(job.getUpdatedAt()).isEqualTo(T1);
    }

    @Test
    void wireNamesRoundTrip() {
        assertThat(JobStatus.fromWire("processing")).isEqualTo(JobStatus.PROCESSING);
        assertThat(JobStatus.CANCELLED.wireName()).isEqualTo("cancelled");
        assertThatThrownBy(() -> JobStatus.fromWire("sleeping"))
                .isInstanceOf(ValidationException.class);
    }

    private static Job job(int passes) {
        return new Job("doc-1", "doc-1.md", "user-1", passes, "gpt-4", null, T0);
    }
}
