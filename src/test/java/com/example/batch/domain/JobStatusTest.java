package com.example.batch.domain;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void finalStatesAcceptNothing() {
        for (JobStatus to : JobStatus.values()) {
            assertThat(JobStatus.COMPLETED.canTransitionTo(to)).isFalse();
            assertThat(JobStatus.CANCELLED.canTransitionTo(to)).isFalse();
        }
    }

    @Test
    void failedCanOnlyBeRetriedOrCancelled() {
        assertThat(JobStatus.FAILED.allowedTransitions())
                .containsExactlyInAnyOrder(JobStatus.PENDING, JobStatus.CANCELLED);
        assertThat(JobStatus.FAILED.isTerminal()).isTrue();
        assertThat(JobStatus.FAILED.isFinal()).isFalse();
    }

    @Test
    void completionOnlyFromRunning() {
        for (JobStatus from : JobStatus.values()) {
            assertThat(from.canTransitionTo(JobStatus.COMPLETED)).isEqualTo(from == JobStatus.RUNNING);
        }
    }

    @Test
    void noSelfTransitions() {
        for (JobStatus s : JobStatus.values()) {
            assertThat(s.canTransitionTo(s)).as(s.name()).isFalse();
        }
        assertThat(JobStatus.PENDING.canTransitionTo(null)).isFalse();
    }

    @Test
    void onlyQueuedAndRunningAcceptAssignments() {
        EnumSet<JobStatus> accepting = EnumSet.noneOf(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            if (s.acceptsAssignments()) accepting.add(s);
        }
        assertThat(accepting).containsExactlyInAnyOrder(JobStatus.QUEUED, JobStatus.RUNNING);
    }
}
