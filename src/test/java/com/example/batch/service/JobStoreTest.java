package com.example.batch.service;

import com.example.batch.domain.*;
import com.example.batch.error.InvalidSpecException;
import com.example.batch.error.InvalidTransitionException;
import com.example.batch.error.NotFoundException;
import com.example.batch.error.TerminalStateException;
import com.example.batch.support.SchedulerTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Job 创建校验与状态机（取消、暂停 / 恢复、显式失败）
 */
class JobStoreTest extends SchedulerTestSupport {

    @Test
    void submitWritesCreationHistoryAndQueues() {
        Long jobId = scheduler.submitJob(TENANT, jobSpec("nightly", 2), USER);

        BatchJob job = jobStore.get(TENANT, jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getPriority()).isEqualTo(JobPriority.NORMAL);
        assertThat(job.getMaxRetries()).isEqualTo(3);
        assertThat(job.getCreatedBy()).isEqualTo(USER);

        List<JobHistory> rows = history.jobHistory(TENANT, jobId);
        assertThat(rows).extracting(JobHistory::getNewStatus).containsExactly(JobStatus.PENDING, JobStatus.QUEUED);
        assertThat(rows.get(0).getPreviousStatus()).isNull();
        assertThat(rows.get(0).getReason()).isEqualTo("Job created");

        assertThat(tasksOf(jobId)).extracting(BatchTask::getStatus).containsOnly(TaskStatus.PENDING);
        assertThat(tasksOf(jobId)).extracting(BatchTask::getTenantId).containsOnly(TENANT);
    }

    @Test
    void pastScheduledStartIsRejectedWithoutSideEffects() {
        JobSpec spec = jobSpec("late", 1);
        spec.setScheduledStart(Timestamp.from(Instant.now().minusSeconds(60)));

        assertThatThrownBy(() -> scheduler.submitJob(TENANT, spec, USER)).isInstanceOf(InvalidSpecException.class);
        assertThat(jobRepo.count()).isZero();
        assertThat(taskRepo.count()).isZero();
    }

    @Test
    void duplicateSequenceNumbersRollBackTheWholeSubmission() {
        JobSpec spec = jobSpec("dup", 2);
        spec.getTasks().get(0).setSequenceNumber(1);
        spec.getTasks().get(1).setSequenceNumber(1);

        assertThatThrownBy(() -> scheduler.submitJob(TENANT, spec, USER)).isInstanceOf(InvalidSpecException.class);
        assertThat(jobRepo.count()).isZero();
        assertThat(jobHistoryRepo.count()).isZero();
    }

    @Test
    void submissionWithoutTasksGetsOneTaskCarryingJobParameters() {
        JobSpec spec = jobSpec("single", 0);
        spec.setTasks(null);

        Long jobId = scheduler.submitJob(TENANT, spec, USER);

        List<BatchTask> tasks = tasksOf(jobId);
        assertThat(tasks).hasSize(1);
        assertThat(tasks.get(0).getSequenceNumber()).isEqualTo(1);
        assertThat(tasks.get(0).getParameters()).contains("\"report\"");
    }

    @Test
    void futureScheduledStartStaysPendingAndIsDeferred() {
        JobSpec spec = jobSpec("later", 1);
        spec.setScheduledStart(Timestamp.from(Instant.now().plusSeconds(3600)));

        Long jobId = scheduler.submitJob(TENANT, spec, USER);

        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(scheduler.isDeferred(jobId)).isTrue();
        assertThat(jobStore.findDueJobIds(Timestamp.from(Instant.now()))).doesNotContain(jobId);
    }

    @Test
    void parentMustBelongToSameTenant() {
        Long parent = scheduler.submitJob(TENANT, jobSpec("parent", 1), USER);

        JobSpec child = jobSpec("child", 1);
        child.setParentJobId(parent);
        Long childId = scheduler.submitJob(TENANT, child, USER);
        assertThat(jobStore.get(TENANT, childId).getParentJobId()).isEqualTo(parent);

        JobSpec foreign = jobSpec("foreign", 1);
        foreign.setParentJobId(parent);
        assertThatThrownBy(() -> scheduler.submitJob(2L, foreign, USER)).isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void otherTenantCannotSeeOrCancelJob() {
        Long jobId = scheduler.submitJob(TENANT, jobSpec("private", 1), USER);

        assertThatThrownBy(() -> jobStore.get(2L, jobId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> scheduler.cancelJob(2L, jobId, null, USER)).isInstanceOf(NotFoundException.class);
        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void cancellingTwiceYieldsTerminalStateAndChangesNothing() {
        Long w = newWorker("w", 1);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("cancel-me", 2), USER);
        assertThat(worker(w).getCurrentTaskCount()).isEqualTo(1);

        scheduler.cancelJob(TENANT, jobId, null, USER);

        BatchJob cancelled = jobStore.get(TENANT, jobId);
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(tasksOf(jobId)).extracting(BatchTask::getStatus).containsOnly(TaskStatus.CANCELLED);
        assertThat(worker(w).getCurrentTaskCount()).isZero();
        assertThat(worker(w).getStatus()).isEqualTo(WorkerStatus.IDLE);
        long jobRows = jobHistoryRepo.count();
        long taskRows = taskHistoryRepo.count();

        assertThatThrownBy(() -> scheduler.cancelJob(TENANT, jobId, null, USER)).isInstanceOf(TerminalStateException.class);

        BatchJob again = jobStore.get(TENANT, jobId);
        assertThat(again.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(again.getUpdatedAt()).isEqualTo(cancelled.getUpdatedAt());
        assertThat(jobHistoryRepo.count()).isEqualTo(jobRows);
        assertThat(taskHistoryRepo.count()).isEqualTo(taskRows);
    }

    @Test
    void cancelCascadeUsesCascadeReason() {
        Long jobId = scheduler.submitJob(TENANT, jobSpec("cascade", 1), USER);
        Long taskId = tasksOf(jobId).get(0).getId();

        scheduler.cancelJob(TENANT, jobId, "operator request", USER);

        List<JobHistory> jobRows = history.jobHistory(TENANT, jobId);
        assertThat(jobRows.get(jobRows.size() - 1).getReason()).isEqualTo("operator request");
        List<TaskHistory> taskRows = history.taskHistory(TENANT, taskId);
        assertThat(taskRows.get(taskRows.size() - 1).getReason()).isEqualTo("Task cancelled due to job cancellation");
        assertThat(taskRows.get(taskRows.size() - 1).getActor()).isEqualTo(USER);
    }

    @Test
    void pausedJobReceivesNoAssignmentsUntilResumed() {
        Long jobId = scheduler.submitJob(TENANT, jobSpec("pausable", 1), USER);
        scheduler.pauseJob(TENANT, jobId, USER);

        newWorker("late-worker", 1);
        scheduler.assignAllPending();
        assertThat(dispatcher.dispatched()).isEmpty();

        BatchJob resumed = scheduler.resumeJob(TENANT, jobId, USER);

        assertThat(resumed.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(dispatcher.taskIds()).containsExactly(tasksOf(jobId).get(0).getId());
        assertThatThrownBy(() -> scheduler.resumeJob(TENANT, jobId, USER)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void completionWhilePausedIsDeferredToResume() {
        newWorker("w", 1);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("pause-running", 1), USER);
        Long taskId = tasksOf(jobId).get(0).getId();
        scheduler.onTaskStarted(taskId);
        scheduler.pauseJob(TENANT, jobId, USER);

        scheduler.onTaskCompleted(taskId, null);

        BatchJob paused = jobStore.get(TENANT, jobId);
        assertThat(paused.getStatus()).isEqualTo(JobStatus.PAUSED);
        assertThat(paused.getProgressPercent()).isLessThan(100);

        BatchJob resumed = scheduler.resumeJob(TENANT, jobId, USER);
        assertThat(resumed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(resumed.getProgressPercent()).isEqualTo(100);
    }

    @Test
    void failJobOnlyFromRunning() {
        newWorker("w", 1);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("explicit-fail", 2), USER);

        assertThatThrownBy(() -> scheduler.failJob(TENANT, jobId, null, USER))
                .isInstanceOf(InvalidTransitionException.class);

        scheduler.onTaskStarted(tasksOf(jobId).get(0).getId());
        BatchJob failed = scheduler.failJob(TENANT, jobId, mapper.createObjectNode().put("message", "upstream down"), USER);

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(jobStore.get(TENANT, jobId).getErrorDetails()).contains("upstream down");
    }

    @Test
    void listFiltersByTenantAndStatusNewestFirst() {
        Long first = scheduler.submitJob(TENANT, jobSpec("first", 1), USER);
        Long second = scheduler.submitJob(TENANT, jobSpec("second", 1), USER);
        scheduler.submitJob(2L, jobSpec("elsewhere", 1), USER);
        scheduler.cancelJob(TENANT, first, null, USER);

        Page<BatchJob> all = jobStore.list(TENANT, null, null, null, PageRequest.of(0, 10));
        assertThat(all.getContent()).extracting(BatchJob::getId).containsExactly(second, first);

        Page<BatchJob> cancelled = jobStore.list(TENANT, JobStatus.CANCELLED, null, null, PageRequest.of(0, 10));
        assertThat(cancelled.getContent().stream().map(BatchJob::getId).collect(Collectors.toList())).containsExactly(first);
    }
}
