package com.example.batch.service;

import com.example.batch.domain.*;
import com.example.batch.error.*;
import com.example.batch.repo.QueryFilters;
import com.example.batch.repo.TaskRepo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityManager;
import javax.persistence.PersistenceContext;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Task 实体与状态机。
 * 修改 Task 的操作都先锁所属 job 再锁 task，完成 / 失败时在同一事务内
 * 归还容量、重算 job 进度，兄弟 Task 并发完成不会读到过期的完成数。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStore {

    private final TaskRepo taskRepo;
    private final JobStore jobStore;
    private final WorkerRegistry workerRegistry;
    private final HistoryRecorder history;
    private final TaskTransitions transitions;
    private final PayloadMapper payloads;

    @PersistenceContext
    private EntityManager em;

    @Transactional
    public List<BatchTask> createTasks(BatchJob job, List<TaskSpec> specs, String actor) {
        List<BatchTask> created = new ArrayList<>();
        if (specs == null || specs.isEmpty()) return created;

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < specs.size(); i++) {
            TaskSpec spec = specs.get(i);
            if (spec == null) throw new InvalidSpecException("Task spec #" + (i + 1) + " must not be null");
            int seq = spec.getSequenceNumber() == null ? i + 1 : spec.getSequenceNumber();
            if (seq < 1) throw new InvalidSpecException("sequenceNumber must be >= 1, got " + seq);
            if (!seen.add(seq)) throw new InvalidSpecException("Duplicate sequenceNumber " + seq + " in job " + job.getId());
            if (spec.getMaxRetries() != null && spec.getMaxRetries() < 0) {
                throw new InvalidSpecException("Task maxRetries must be >= 0, got " + spec.getMaxRetries());
            }
            if (spec.getTimeoutMinutes() != null && spec.getTimeoutMinutes() < 1) {
                throw new InvalidSpecException("Task timeoutMinutes must be >= 1, got " + spec.getTimeoutMinutes());
            }

            BatchTask t = new BatchTask();
            t.setTenantId(job.getTenantId());
            t.setJobId(job.getId());
            t.setSequenceNumber(seq);
            t.setName(isBlank(spec.getName()) ? defaultName(job, seq) : spec.getName().trim());
            t.setParameters(payloads.write(spec.getParameters()));
            t.setTimeoutMinutes(spec.getTimeoutMinutes());
            t.setMaxRetries(spec.getMaxRetries() == null ? 3 : spec.getMaxRetries());
            t.setStatus(TaskStatus.PENDING);
            taskRepo.save(t);
            history.recordTask(t, null, "Task created", actor);
            created.add(t);
        }
        log.info("Tasks created: job={}, count={}", job.getId(), created.size());
        return created;
    }

    /**
     * job 中 sequence_number 最小的 PENDING Task
     */
    @Transactional(readOnly = true)
    public Optional<Long> claimNextTask(Long jobId) {
        List<Long> ids = taskRepo.findIdsByJobIdAndStatus(jobId, TaskStatus.PENDING, PageRequest.of(0, 1));
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    /**
     * PENDING -> ASSIGNED。调用前必须已 {@link WorkerRegistry#reserveCapacity(Long)} 成功。
     * 状态用 compare-and-set 修改，返回 0 说明被其它调用方抢走。
     */
    @Transactional
    public BatchTask assignTask(Long taskId, Long workerId, String actor) {
        lockOwningJob(taskId);
        if (!workerRegistry.hasReservation(workerId)) throw new CapacityUnavailableException(workerId);

        int ok = taskRepo.compareAndSetWorker(taskId, workerId, TaskStatus.PENDING, TaskStatus.ASSIGNED, tsNow());
        BatchTask task = em.find(BatchTask.class, taskId);
        if (task == null) throw new NotFoundException("Task", taskId);
        em.refresh(task);
        if (ok == 0) {
            TaskTransitions.check(task, TaskStatus.ASSIGNED);
            throw new InvalidTransitionException("Task", taskId, task.getStatus(), TaskStatus.ASSIGNED);
        }

        history.recordTask(task, TaskStatus.PENDING, "Assigned to worker " + workerId, actor);
        log.info("Task assigned: id={}, job={}, seq={}, worker={}", taskId, task.getJobId(), task.getSequenceNumber(), workerId);
        return task;
    }

    @Transactional
    public BatchTask startTask(Long taskId, String actor) {
        BatchJob job = lockOwningJob(taskId);
        BatchTask task = lockTask(taskId);
        String who = actorOr(actor, task);

        transitions.apply(task, TaskStatus.RUNNING, "Task started", who);
        task.setStartedAt(tsNow());
        jobStore.markStarted(job, who);

        log.info("Task started: id={}, job={}, worker={}", taskId, task.getJobId(), task.getWorkerId());
        return task;
    }

    @Transactional
    public BatchTask reportProgress(Long taskId, int percent) {
        if (percent < 0 || percent > 100) throw new InvalidSpecException("progress must be within 0..100, got " + percent);
        BatchTask task = lockTask(taskId);
        if (task.getStatus() != TaskStatus.RUNNING) {
            if (task.getStatus().isFinal()) throw new TerminalStateException("Task", taskId, task.getStatus());
            throw new InvalidTransitionException("Task id=" + taskId + " is not running (status=" + task.getStatus() + ")");
        }
        task.setProgressPercent(percent);
        return task;
    }

    /**
     * RUNNING -> COMPLETED，归还容量，重算 job 进度（可能完成 job）
     */
    @Transactional
    public BatchTask completeTask(Long taskId, JsonNode result, String actor) {
        lockOwningJob(taskId);
        BatchTask task = lockTask(taskId);
        Timestamp now = tsNow();

        transitions.apply(task, TaskStatus.COMPLETED, "Task completed", actorOr(actor, task));
        task.setCompletedAt(now);
        task.setProgressPercent(100);
        task.setResultData(payloads.write(result));

        workerRegistry.releaseCapacity(task.getWorkerId(), TaskOutcome.COMPLETED, TaskTransitions.durationSeconds(task, now));
        int progress = jobStore.recomputeProgress(task.getJobId());

        log.info("Task completed: id={}, job={}, jobProgress={}", taskId, task.getJobId(), progress);
        return task;
    }

    /**
     * RUNNING -> FAILED。只记录结果，不会让 job 失败
     */
    @Transactional
    public BatchTask failTask(Long taskId, JsonNode error, String actor) {
        lockOwningJob(taskId);
        BatchTask task = lockTask(taskId);
        Timestamp now = tsNow();

        transitions.apply(task, TaskStatus.FAILED, "Task failed", actorOr(actor, task));
        task.setCompletedAt(now);
        task.setErrorDetails(payloads.write(error));

        workerRegistry.releaseCapacity(task.getWorkerId(), TaskOutcome.FAILED, TaskTransitions.durationSeconds(task, now));
        jobStore.recomputeProgress(task.getJobId());

        log.warn("Task failed: id={}, job={}, worker={}", taskId, task.getJobId(), task.getWorkerId());
        return task;
    }

    /**
     * non-terminal -> CANCELLED。tenantId 为 null 表示内部调用。
     */
    @Transactional
    public BatchTask cancelTask(Long tenantId, Long taskId, String reason, String actor) {
        lockOwningJob(taskId);
        BatchTask task = lockTask(taskId);
        if (tenantId != null && !tenantId.equals(task.getTenantId())) throw new NotFoundException("Task", taskId);

        transitions.cancel(task, reason == null ? "Task cancelled" : reason, actor);
        jobStore.recomputeProgress(task.getJobId());

        log.info("Task cancelled: id={}, job={}", taskId, task.getJobId());
        return task;
    }

    @Transactional(readOnly = true)
    public BatchTask get(Long tenantId, Long taskId) {
        return taskRepo.findByIdAndTenantId(taskId, tenantId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    @Transactional(readOnly = true)
    public Page<BatchTask> list(Long tenantId, Long jobId, Long workerId, TaskStatus status, Pageable pageable) {
        Pageable p = QueryFilters.sorted(pageable, Sort.by("jobId", "sequenceNumber"));
        return taskRepo.findAll(QueryFilters.tasks(tenantId, jobId, workerId, status), p);
    }

    @Transactional(readOnly = true)
    public List<BatchTask> listForJob(Long tenantId, Long jobId) {
        jobStore.get(tenantId, jobId);
        return taskRepo.findByJobIdOrderBySequenceNumberAsc(jobId);
    }

    /**
     * 外部 Worker 轮询：已分配给它、尚未开始的 Task
     */
    @Transactional(readOnly = true)
    public List<BatchTask> listAssigned(Long workerId) {
        workerRegistry.get(workerId);
        return taskRepo.findByWorkerIdAndStatusOrderByIdAsc(workerId, TaskStatus.ASSIGNED);
    }

    @Transactional(readOnly = true)
    public List<BatchTask> findRunningWithTimeout() {
        return taskRepo.findTimed(TaskStatus.RUNNING);
    }

    private BatchJob lockOwningJob(Long taskId) {
        Long jobId = taskRepo.findJobIdById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
        return jobStore.lockJob(jobId);
    }

    private BatchTask lockTask(Long taskId) {
        return taskRepo.lockById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    private static String actorOr(String actor, BatchTask task) {
        return actor != null ? actor : HistoryRecorder.workerActor(task.getWorkerId());
    }

    private static String defaultName(BatchJob job, int seq) {
        String base = job.getName() + " #" + seq;
        return base.length() > 100 ? base.substring(base.length() - 100) : base;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
