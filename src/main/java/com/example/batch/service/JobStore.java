package com.example.batch.service;

import com.example.batch.domain.*;
import com.example.batch.error.*;
import com.example.batch.repo.JobRepo;
import com.example.batch.repo.QueryFilters;
import com.example.batch.repo.TaskRepo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Job 实体与状态机。所有修改都先 {@link #lockJob(Long)}，同一 job 上的进度重算、取消、重试串行执行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private final JobRepo jobRepo;
    private final TaskRepo taskRepo;
    private final HistoryRecorder history;
    private final TaskTransitions taskTransitions;
    private final PayloadMapper payloads;

    @Transactional
    public BatchJob createJob(Long tenantId, JobSpec spec, String actor) {
        validate(tenantId, spec);

        BatchJob job = new BatchJob();
        job.setTenantId(tenantId);
        job.setName(spec.getName().trim());
        job.setDescription(spec.getDescription());
        job.setType(spec.getType());
        job.setPriority(spec.getPriority() == null ? JobPriority.NORMAL : spec.getPriority());
        job.setStatus(JobStatus.PENDING);
        job.setParameters(payloads.write(spec.getParameters()));
        job.setScheduledStart(spec.getScheduledStart());
        job.setTimeoutMinutes(spec.getTimeoutMinutes());
        job.setParentJobId(spec.getParentJobId());
        job.setMaxRetries(spec.getMaxRetries() == null ? 3 : spec.getMaxRetries());
        job.setRetryCount(0);
        job.setProgressPercent(0);
        job.setCreatedBy(actor);
        job.setLastUpdatedBy(actor);
        jobRepo.save(job);

        history.recordJob(job, null, "Job created", actor);
        log.info("Job created: id={}, tenant={}, type={}, priority={}, scheduledStart={}",
                job.getId(), tenantId, job.getType(), job.getPriority(), job.getScheduledStart());
        return job;
    }

    private void validate(Long tenantId, JobSpec spec) {
        if (tenantId == null) throw new InvalidSpecException("tenantId is required");
        if (spec == null) throw new InvalidSpecException("Job spec must not be null");
        if (spec.getName() == null || spec.getName().trim().isEmpty()) throw new InvalidSpecException("Job name must not be empty");
        if (spec.getName().trim().length() > 100) throw new InvalidSpecException("Job name must be at most 100 characters");
        if (spec.getType() == null) throw new InvalidSpecException("Job type is required");
        if (spec.getMaxRetries() != null && spec.getMaxRetries() < 0) {
            throw new InvalidSpecException("maxRetries must be >= 0, got " + spec.getMaxRetries());
        }
        if (spec.getTimeoutMinutes() != null && spec.getTimeoutMinutes() < 1) {
            throw new InvalidSpecException("timeoutMinutes must be >= 1, got " + spec.getTimeoutMinutes());
        }
        if (spec.getScheduledStart() != null && !spec.getScheduledStart().after(tsNow())) {
            throw new InvalidSpecException("scheduledStart must be in the future: " + spec.getScheduledStart());
        }
        if (spec.getParentJobId() != null && !jobRepo.existsByIdAndTenantId(spec.getParentJobId(), tenantId)) {
            throw new InvalidSpecException("Unknown parent job id=" + spec.getParentJobId());
        }
    }

    @Transactional(readOnly = true)
    public BatchJob get(Long tenantId, Long jobId) {
        return jobRepo.findByIdAndTenantId(jobId, tenantId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    @Transactional(readOnly = true)
    public Page<BatchJob> list(Long tenantId, JobStatus status, JobType type, JobPriority priority, Pageable pageable) {
        Pageable p = QueryFilters.sorted(pageable, Sort.by(Sort.Direction.DESC, "createdAt", "id"));
        return jobRepo.findAll(QueryFilters.jobs(tenantId, status, type, priority), p);
    }

    /**
     * 加行锁读取 job，事务结束前其它 job 级操作会在此等待
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BatchJob lockJob(Long jobId) {
        return jobRepo.lockById(jobId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    /**
     * 带租户校验的加锁，tenantId 为 null 表示内部调用（watchdog 等）
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BatchJob lockJob(Long tenantId, Long jobId) {
        BatchJob job = lockJob(jobId);
        if (tenantId != null && !tenantId.equals(job.getTenantId())) throw new NotFoundException("Job", jobId);
        return job;
    }

    /**
     * PENDING 且已到 scheduled_start 时转为 QUEUED
     *
     * @return 是否发生了迁移
     */
    @Transactional
    public boolean queueIfDue(Long jobId, Timestamp now, String actor) {
        BatchJob job = lockJob(jobId);
        if (job.getStatus() != JobStatus.PENDING) return false;
        if (job.getScheduledStart() != null && job.getScheduledStart().after(now)) return false;
        transition(job, JobStatus.QUEUED, "Job dispatched", actor);
        return true;
    }

    /**
     * 第一个 Task 开始时调用（job 已由调用方加锁）
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void markStarted(BatchJob job, String actor) {
        if (job.getStatus() == JobStatus.QUEUED) {
            job.setActualStart(tsNow());
            transition(job, JobStatus.RUNNING, "First task started", actor);
        } else if (job.getStatus() == JobStatus.PAUSED && job.getPausedFrom() == JobStatus.QUEUED) {
            // 暂停期间已分配的 Task 开始了，恢复时应回到 RUNNING
            job.setActualStart(tsNow());
            job.setPausedFrom(JobStatus.RUNNING);
        }
    }

    /**
     * progress = floor(100 * completed / total)。达到 100 且 job 为 RUNNING 时转为 COMPLETED。
     * 对已终态的 job 是 no-op。
     */
    @Transactional
    public int recomputeProgress(Long jobId) {
        return applyProgress(lockJob(jobId));
    }

    private int applyProgress(BatchJob job) {
        if (job.getStatus().isTerminal()) return job.getProgressPercent();

        long total = taskRepo.countByJobId(job.getId());
        long completed = taskRepo.countByJobIdAndStatus(job.getId(), TaskStatus.COMPLETED);
        int progress = total == 0 ? 0 : (int) (100 * completed / total);

        if (progress < 100) {
            job.setProgressPercent(progress);
            return progress;
        }
        if (job.getStatus() != JobStatus.RUNNING) {
            // PAUSED 时推迟到 resume 再完成，100 只与 COMPLETED 同时出现
            log.debug("All tasks done but job not running, defer completion: id={}, status={}", job.getId(), job.getStatus());
            return job.getProgressPercent();
        }
        job.setProgressPercent(100);
        job.setCompletedAt(tsNow());
        transition(job, JobStatus.COMPLETED, "All tasks completed", HistoryRecorder.SYSTEM);
        log.info("Job completed: id={}, tasks={}", job.getId(), total);
        return 100;
    }

    @Transactional
    public BatchJob failJob(Long tenantId, Long jobId, JsonNode error, String actor) {
        BatchJob job = lockJob(tenantId, jobId);
        requireTransition(job, JobStatus.FAILED);
        job.setErrorDetails(payloads.write(error));
        job.setCompletedAt(tsNow());
        transition(job, JobStatus.FAILED, "Job failed", actor);
        log.warn("Job failed: id={}", jobId);
        return job;
    }

    /**
     * 重试：超过 max_retries 直接拒绝且不做任何修改。
     * RUNNING 且存在 FAILED Task 时先记录 RUNNING -> FAILED，再 FAILED -> PENDING，
     * 全部 Task 重置为 PENDING 后重新入队。
     */
    @Transactional
    public BatchJob retryJob(Long tenantId, Long jobId, String actor) {
        BatchJob job = lockJob(tenantId, jobId);
        if (job.getRetryCount() >= job.getMaxRetries()) {
            throw new RetryExhaustedException(jobId, job.getRetryCount(), job.getMaxRetries());
        }
        if (job.getStatus() == JobStatus.RUNNING) {
            if (taskRepo.countByJobIdAndStatus(jobId, TaskStatus.FAILED) == 0) {
                throw new InvalidTransitionException("Job id=" + jobId + " is RUNNING without failed tasks, nothing to retry");
            }
            transition(job, JobStatus.FAILED, "Task failure", actor);
        }
        if (job.getStatus() != JobStatus.FAILED) {
            if (job.getStatus().isFinal()) throw new TerminalStateException("Job", jobId, job.getStatus());
            throw new InvalidTransitionException("Job", jobId, job.getStatus(), JobStatus.PENDING);
        }

        int attempt = job.getRetryCount() + 1;
        job.setRetryCount(attempt);
        job.setProgressPercent(0);
        job.setErrorDetails(null);
        job.setResultData(null);
        job.setActualStart(null);
        job.setCompletedAt(null);
        transition(job, JobStatus.PENDING, "Job retry attempt " + attempt, actor);

        List<BatchTask> tasks = taskRepo.lockByJobId(jobId);
        List<Long> held = new ArrayList<>();
        for (BatchTask t : tasks) {
            held.add(taskTransitions.resetForRetry(t, actor));
        }
        taskTransitions.releaseHeld(held);
        transition(job, JobStatus.QUEUED, "Job re-queued for retry", actor);

        log.info("Job retried: id={}, attempt={}/{}, tasksReset={}", jobId, attempt, job.getMaxRetries(), tasks.size());
        return job;
    }

    /**
     * 取消并级联到所有未终态 Task，归还其占用的容量。COMPLETED / CANCELLED 抛 TerminalState。
     */
    @Transactional
    public BatchJob cancelJob(Long tenantId, Long jobId, String reason, String actor) {
        BatchJob job = lockJob(tenantId, jobId);
        if (job.getStatus().isFinal()) throw new TerminalStateException("Job", jobId, job.getStatus());

        JobStatus from = job.getStatus();
        job.setPausedFrom(null);
        job.setCompletedAt(tsNow());
        transition(job, JobStatus.CANCELLED, reason == null ? "Job cancelled by user" : reason, actor);

        int cancelled = 0;
        List<Long> held = new ArrayList<>();
        for (BatchTask t : taskRepo.lockByJobId(jobId)) {
            if (t.getStatus().isTerminal()) continue;
            held.add(taskTransitions.cancelHolding(t, "Task cancelled due to job cancellation", actor));
            cancelled++;
        }
        taskTransitions.releaseHeld(held);
        log.info("Job cancelled: id={}, from={}, tasksCancelled={}", jobId, from, cancelled);
        return job;
    }

    @Transactional
    public BatchJob pauseJob(Long tenantId, Long jobId, String actor) {
        BatchJob job = lockJob(tenantId, jobId);
        JobStatus from = job.getStatus();
        requireTransition(job, JobStatus.PAUSED);
        job.setPausedFrom(from);
        transition(job, JobStatus.PAUSED, "Job paused", actor);
        log.info("Job paused: id={}, from={}", jobId, from);
        return job;
    }

    @Transactional
    public BatchJob resumeJob(Long tenantId, Long jobId, String actor) {
        BatchJob job = lockJob(tenantId, jobId);
        if (job.getStatus() != JobStatus.PAUSED) {
            throw new InvalidTransitionException("Job id=" + jobId + " is not paused (status=" + job.getStatus() + ")");
        }
        JobStatus target = job.getPausedFrom() == null ? JobStatus.PENDING : job.getPausedFrom();
        job.setPausedFrom(null);
        transition(job, target, "Job resumed", actor);
        if (target == JobStatus.RUNNING) {
            applyProgress(job);
        }
        log.info("Job resumed: id={}, status={}", jobId, job.getStatus());
        return job;
    }

    @Transactional(readOnly = true)
    public List<Long> findDueJobIds(Timestamp now) {
        return jobRepo.findDueIds(JobStatus.PENDING, now);
    }

    /**
     * 有 PENDING Task 且可分配的 job，优先级高的在前，同优先级按创建时间
     */
    @Transactional(readOnly = true)
    public List<Long> findAssignableJobIds() {
        List<BatchJob> jobs = new ArrayList<>(jobRepo.findWithTaskInStatus(
                EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING), TaskStatus.PENDING));
        jobs.sort(Comparator.comparing(BatchJob::getPriority).reversed());
        return jobs.stream().map(BatchJob::getId).collect(Collectors.toList());
    }

    /**
     * actual_start + timeout 已过期的 job
     */
    @Transactional(readOnly = true)
    public List<BatchJob> findTimedOut(Timestamp now) {
        List<BatchJob> candidates = jobRepo.findTimeoutCandidates(EnumSet.of(JobStatus.RUNNING, JobStatus.PAUSED), now);
        List<BatchJob> expired = new ArrayList<>();
        for (BatchJob j : candidates) {
            long deadline = j.getActualStart().getTime() + j.getTimeoutMinutes() * 60_000L;
            if (deadline < now.getTime()) expired.add(j);
        }
        return expired;
    }

    private void transition(BatchJob job, JobStatus to, String reason, String actor) {
        JobStatus from = job.getStatus();
        requireTransition(job, to);
        job.setStatus(to);
        job.setLastUpdatedBy(actor);
        history.recordJob(job, from, reason, actor);
    }

    static void requireTransition(BatchJob job, JobStatus to) {
        JobStatus from = job.getStatus();
        if (from.canTransitionTo(to)) return;
        if (from.isFinal()) throw new TerminalStateException("Job", job.getId(), from);
        throw new InvalidTransitionException("Job", job.getId(), from, to);
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
