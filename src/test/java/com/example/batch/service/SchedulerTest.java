package com.example.batch.service;

import com.example.batch.domain.*;
import com.example.batch.error.RetryExhaustedException;
import com.example.batch.support.SchedulerTestSupport;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * 端到端调度：分配顺序、重试、Worker 下线、并发完成与并发分配
 */
class SchedulerTest extends SchedulerTestSupport {

    @Test
    void singleWorkerRunsTasksStrictlyInSequenceOrder() {
        newWorker("solo", 1);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("sequential", 3), USER);
        List<Long> expected = tasksOf(jobId).stream().map(BatchTask::getId).collect(Collectors.toList());

        for (int i = 0; i < expected.size(); i++) {
            List<Long> sent = dispatcher.taskIds();
            assertThat(sent).hasSize(i + 1);
            Long current = sent.get(i);
            assertThat(current).isEqualTo(expected.get(i));
            runToCompletion(current);
        }

        BatchJob job = jobStore.get(TENANT, jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgressPercent()).isEqualTo(100);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(dispatcher.taskIds()).containsExactlyElementsOf(expected);
        assertThat(jobHistoryRepo.countByJobIdAndNewStatus(jobId, JobStatus.COMPLETED)).isEqualTo(1);
    }

    @Test
    void progressTracksCompletedShare() {
        newWorker("w", 3);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("thirds", 3), USER);
        Long first = tasksOf(jobId).get(0).getId();

        runToCompletion(first);

        assertThat(jobStore.get(TENANT, jobId).getProgressPercent()).isEqualTo(33);
        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void retryResetsTasksOnceThenIsExhausted() {
        Long w = newWorker("w", 1);
        JobSpec spec = jobSpec("retry-once", 2);
        spec.setMaxRetries(1);
        Long jobId = scheduler.submitJob(TENANT, spec, USER);
        Long first = tasksOf(jobId).get(0).getId();

        scheduler.onTaskStarted(first);
        scheduler.onTaskFailed(first, mapper.createObjectNode().put("message", "boom"));
        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.RUNNING);

        // 不让 retry 之后立即重新分配，便于检查重置结果
        workerRegistry.updateStatus(w, WorkerStatus.MAINTENANCE);
        BatchJob retried = scheduler.retryJob(TENANT, jobId, USER);

        assertThat(retried.getRetryCount()).isEqualTo(1);
        assertThat(retried.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(retried.getProgressPercent()).isZero();
        List<BatchTask> tasks = tasksOf(jobId);
        assertThat(tasks).extracting(BatchTask::getStatus).containsOnly(TaskStatus.PENDING);
        assertThat(tasks).extracting(BatchTask::getWorkerId).containsOnlyNulls();
        assertThat(tasks.get(0).getErrorDetails()).isNull();
        assertThat(worker(w).getCurrentTaskCount()).isZero();
        assertThat(history.jobHistory(TENANT, jobId)).extracting(JobHistory::getNewStatus)
                .containsSubsequence(JobStatus.RUNNING, JobStatus.FAILED, JobStatus.PENDING, JobStatus.QUEUED);

        long jobRows = jobHistoryRepo.count();
        assertThatThrownBy(() -> scheduler.retryJob(TENANT, jobId, USER)).isInstanceOf(RetryExhaustedException.class);

        BatchJob after = jobStore.get(TENANT, jobId);
        assertThat(after.getRetryCount()).isEqualTo(1);
        assertThat(after.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(jobHistoryRepo.count()).isEqualTo(jobRows);
    }

    @Test
    void offlineWorkerIsNotChosenButKeepsItsAssignedTasks() {
        Long w = newWorker("fading", 2);
        Long firstJob = scheduler.submitJob(TENANT, jobSpec("before-outage", 1), USER);
        Long assigned = tasksOf(firstJob).get(0).getId();
        assertThat(task(assigned).getStatus()).isEqualTo(TaskStatus.ASSIGNED);

        workerRegistry.heartbeat(w, Timestamp.from(Instant.now().minusSeconds(600)));
        workerRegistry.markStaleOffline(Timestamp.from(Instant.now().minusSeconds(60)));

        Long secondJob = scheduler.submitJob(TENANT, jobSpec("during-outage", 1), USER);
        assertThat(workerRegistry.selectCandidate()).isEmpty();
        assertThat(tasksOf(secondJob).get(0).getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task(assigned).getStatus()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(task(assigned).getWorkerId()).isEqualTo(w);
        assertThat(worker(w).getCurrentTaskCount()).isEqualTo(1);

        scheduler.heartbeat(w);

        assertThat(worker(w).getStatus()).isEqualTo(WorkerStatus.BUSY);
        assertThat(tasksOf(secondJob).get(0).getStatus()).isEqualTo(TaskStatus.ASSIGNED);
    }

    @Test
    void concurrentCompletionsCompleteTheJobExactlyOnce() throws Exception {
        int n = 8;
        newWorker("wide", n);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("fan-out", n), USER);
        List<Long> ids = tasksOf(jobId).stream().map(BatchTask::getId).collect(Collectors.toList());
        for (Long id : ids) scheduler.onTaskStarted(id);

        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (Long id : ids) {
                futures.add(pool.submit(() -> {
                    go.await();
                    scheduler.onTaskCompleted(id, mapper.createObjectNode().put("task", id));
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        BatchJob job = jobStore.get(TENANT, jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgressPercent()).isEqualTo(100);
        assertThat(jobHistoryRepo.countByJobIdAndNewStatus(jobId, JobStatus.COMPLETED)).isEqualTo(1);
        assertThat(taskHistoryRepo.countByJobIdAndNewStatus(jobId, TaskStatus.COMPLETED)).isEqualTo(n);
    }

    @Test
    void concurrentAssignmentNeverDoubleAssigns() throws Exception {
        Long jobId = scheduler.submitJob(TENANT, jobSpec("contended", 10), USER);
        List<Long> workers = Arrays.asList(newWorker("c1", 2), newWorker("c2", 2), newWorker("c3", 2));

        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return scheduler.assignPendingTasks(jobId);
                }));
            }
            go.countDown();
            int total = 0;
            for (Future<Integer> f : futures) total += f.get(60, TimeUnit.SECONDS);
            assertThat(total).isEqualTo(6);
        } finally {
            pool.shutdownNow();
        }

        List<Long> sent = dispatcher.taskIds();
        assertThat(sent).hasSize(6).doesNotHaveDuplicates();
        for (Long taskId : sent) {
            assertThat(taskHistoryRepo.countByTaskIdAndNewStatus(taskId, TaskStatus.ASSIGNED)).isEqualTo(1);
        }
        for (Long w : workers) {
            long live = taskRepo.countByWorkerIdAndStatusIn(w, TaskStatus.HOLDING_CAPACITY);
            assertThat(worker(w).getCurrentTaskCount()).isEqualTo(2).isEqualTo((int) live);
        }
        assertThat(tasksOf(jobId)).filteredOn(t -> t.getStatus() == TaskStatus.PENDING).hasSize(4);
    }

    @Test
    void dispatchFailureLeavesTaskPendingWithNoReservation() {
        dispatcher.setFailing(true);
        Long w = newWorker("unreachable", 1);
        Long jobId = scheduler.submitJob(TENANT, jobSpec("undeliverable", 1), USER);
        Long taskId = tasksOf(jobId).get(0).getId();

        assertThat(task(taskId).getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task(taskId).getWorkerId()).isNull();
        assertThat(worker(w).getCurrentTaskCount()).isZero();
        assertThat(worker(w).getStatus()).isEqualTo(WorkerStatus.IDLE);
        assertThat(taskHistoryRepo.countByTaskIdAndNewStatus(taskId, TaskStatus.ASSIGNED)).isZero();

        dispatcher.setFailing(false);
        scheduler.heartbeat(w);

        assertThat(task(taskId).getStatus()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(dispatcher.taskIds()).containsExactly(taskId);
    }

    @Test
    void deferredJobIsDispatchedWhenDue() {
        newWorker("patient", 1);
        JobSpec spec = jobSpec("deferred", 1);
        spec.setScheduledStart(Timestamp.from(Instant.now().plusMillis(1500)));
        Long jobId = scheduler.submitJob(TENANT, spec, USER);
        assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(dispatcher.dispatched()).isEmpty();

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertThat(jobStore.get(TENANT, jobId).getStatus()).isEqualTo(JobStatus.QUEUED);
            assertThat(dispatcher.taskIds()).containsExactly(tasksOf(jobId).get(0).getId());
        });
        assertThat(scheduler.isDeferred(jobId)).isFalse();
    }

    @Test
    void higherPriorityJobGetsFreedCapacityFirst() {
        JobSpec low = jobSpec("low", 1);
        low.setPriority(JobPriority.LOW);
        JobSpec urgent = jobSpec("urgent", 1);
        urgent.setPriority(JobPriority.URGENT);
        scheduler.submitJob(TENANT, low, USER);
        Long urgentId = scheduler.submitJob(TENANT, urgent, USER);

        scheduler.registerWorker(WorkerSpec.builder().name("late").host("late.local").maxConcurrentTasks(1).build());

        assertThat(dispatcher.taskIds()).containsExactly(tasksOf(urgentId).get(0).getId());
    }

    @Test
    void workerCountAlwaysMatchesLiveTasks() {
        Long a = newWorker("a", 2);
        Long b = newWorker("b", 1);
        Long j1 = scheduler.submitJob(TENANT, jobSpec("mix-1", 3), USER);
        Long j2 = scheduler.submitJob(TENANT, jobSpec("mix-2", 2), USER);

        Long t = dispatcher.taskIds().get(0);
        runToCompletion(t);
        scheduler.cancelJob(TENANT, j2, null, USER);
        scheduler.onTaskStarted(dispatcher.taskIds().get(1));

        for (Long w : Arrays.asList(a, b)) {
            Worker worker = worker(w);
            long live = taskRepo.countByWorkerIdAndStatusIn(w, TaskStatus.HOLDING_CAPACITY);
            assertThat(worker.getCurrentTaskCount()).isEqualTo((int) live);
            assertThat(worker.getCurrentTaskCount()).isBetween(0, worker.getMaxConcurrentTasks());
        }
        assertThat(jobStore.get(TENANT, j1).getStatus()).isIn(JobStatus.QUEUED, JobStatus.RUNNING);
    }
}
