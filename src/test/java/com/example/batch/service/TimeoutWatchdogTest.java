package com.example.batch.service;

import com.example.batch.domain.*;
import com.example.batch.support.SchedulerTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimeoutWatchdogTest extends SchedulerTestSupport {

    @Autowired
    private TimeoutWatchdog watchdog;

    @Test
    void expiredRunningTaskIsFailed() {
        Long w = newWorker("slow", 1);
        JobSpec spec = jobSpec("slow-job", 1);
        spec.getTasks().get(0).setTimeoutMinutes(1);
        Long jobId = scheduler.submitJob(TENANT, spec, USER);
        Long taskId = tasksOf(jobId).get(0).getId();
        scheduler.onTaskStarted(taskId);
        backdateTaskStart(taskId, 300);

        assertThat(watchdog.sweepOnce()).isEqualTo(1);

        BatchTask t = task(taskId);
        assertThat(t.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(t.getErrorDetails()).contains("timed out");
        assertThat(worker(w).getCurrentTaskCount()).isZero();
        List<TaskHistory> rows = history.taskHistory(TENANT, taskId);
        assertThat(rows.get(rows.size() - 1).getActor()).isEqualTo(HistoryRecorder.WATCHDOG);
        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void taskWithinItsTimeoutIsLeftAlone() {
        newWorker("fast", 1);
        JobSpec spec = jobSpec("fast-job", 1);
        spec.getTasks().get(0).setTimeoutMinutes(10);
        Long jobId = scheduler.submitJob(TENANT, spec, USER);
        Long taskId = tasksOf(jobId).get(0).getId();
        scheduler.onTaskStarted(taskId);

        assertThat(watchdog.sweepOnce()).isZero();
        assertThat(task(taskId).getStatus()).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    void expiredJobIsCancelledWithItsTasks() {
        Long w = newWorker("w", 1);
        JobSpec spec = jobSpec("bounded", 2);
        spec.setTimeoutMinutes(1);
        Long jobId = scheduler.submitJob(TENANT, spec, USER);
        scheduler.onTaskStarted(tasksOf(jobId).get(0).getId());
        BatchJob job = jobRepo.findById(jobId).orElseThrow(IllegalStateException::new);
        job.setActualStart(Timestamp.from(Instant.now().minusSeconds(600)));
        jobRepo.save(job);

        assertThat(watchdog.sweepOnce()).isEqualTo(1);

        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(tasksOf(jobId)).extracting(BatchTask::getStatus).containsOnly(TaskStatus.CANCELLED);
        assertThat(worker(w).getCurrentTaskCount()).isZero();
        List<JobHistory> rows = history.jobHistory(TENANT, jobId);
        JobHistory last = rows.get(rows.size() - 1);
        assertThat(last.getActor()).isEqualTo(HistoryRecorder.WATCHDOG);
        assertThat(last.getReason()).isEqualTo("Job timed out after 1 minutes");
    }

    private void backdateTaskStart(Long taskId, long seconds) {
        BatchTask t = task(taskId);
        t.setStartedAt(Timestamp.from(Instant.now().minusSeconds(seconds)));
        taskRepo.save(t);
    }
}
