package com.example.batch.service;

import com.example.batch.domain.TaskOutcome;
import com.example.batch.domain.TaskStatus;
import com.example.batch.domain.Worker;
import com.example.batch.domain.WorkerStatus;
import com.example.batch.error.InvalidSpecException;
import com.example.batch.error.InvalidTransitionException;
import com.example.batch.error.NotFoundException;
import com.example.batch.repo.QueryFilters;
import com.example.batch.repo.TaskRepo;
import com.example.batch.repo.WorkerCandidate;
import com.example.batch.repo.WorkerRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Worker 容量与健康状态。
 * - reserve / release 都是单条条件 UPDATE，同一 Worker 的并发调用不会超卖
 * - 心跳丢失只会把 Worker 置为 OFFLINE，不会改动已分配的 Task
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerRegistry {

    private static final Set<WorkerStatus> OFFLINE_ONLY = Collections.unmodifiableSet(EnumSet.of(WorkerStatus.OFFLINE));
    private static final Set<WorkerStatus> BUSY_ONLY = Collections.unmodifiableSet(EnumSet.of(WorkerStatus.BUSY));
    private static final Set<WorkerStatus> ANY = Collections.unmodifiableSet(EnumSet.allOf(WorkerStatus.class));
    private static final Pageable FIRST = PageRequest.of(0, 1);

    private final WorkerRepo workerRepo;
    private final TaskRepo taskRepo;

    @Transactional
    public Long registerWorker(WorkerSpec spec) {
        if (spec == null) throw new InvalidSpecException("Worker spec must not be null");
        if (isBlank(spec.getName())) throw new InvalidSpecException("Worker name must not be empty");
        if (isBlank(spec.getHost())) throw new InvalidSpecException("Worker host must not be empty");
        if (spec.getMaxConcurrentTasks() == null || spec.getMaxConcurrentTasks() < 1) {
            throw new InvalidSpecException("maxConcurrentTasks must be >= 1, got " + spec.getMaxConcurrentTasks());
        }

        Worker w = new Worker();
        w.setName(spec.getName().trim());
        w.setHost(spec.getHost().trim());
        w.setMaxConcurrentTasks(spec.getMaxConcurrentTasks());
        w.setStatus(WorkerStatus.IDLE);
        w.setActive(Boolean.TRUE);
        w.setCurrentTaskCount(0);
        workerRepo.save(w);

        log.info("Worker registered: id={}, name={}, host={}, capacity={}", w.getId(), w.getName(), w.getHost(), w.getMaxConcurrentTasks());
        return w.getId();
    }

    @Transactional
    public void heartbeat(Long workerId, Timestamp at) {
        Timestamp now = tsNow();
        if (workerRepo.touchHeartbeat(workerId, at == null ? now : at, now) == 0) {
            throw new NotFoundException("Worker", workerId);
        }
        int revived = workerRepo.moveIfDrained(workerId, OFFLINE_ONLY, WorkerStatus.IDLE, now)
                + workerRepo.moveIfLoaded(workerId, OFFLINE_ONLY, WorkerStatus.BUSY, now);
        if (revived > 0) {
            log.info("Worker back online: id={}", workerId);
        }
    }

    /**
     * 原子 check-and-increment：is_active、状态可调度且 count < max 时 +1 并置为 BUSY。
     *
     * @return false 表示容量不可用（未做任何修改）
     */
    @Transactional
    public boolean reserveCapacity(Long workerId) {
        int ok = workerRepo.tryReserve(workerId, WorkerStatus.BUSY, WorkerStatus.SCHEDULABLE, tsNow());
        if (ok == 0) {
            if (!workerRepo.existsById(workerId)) throw new NotFoundException("Worker", workerId);
            log.debug("No capacity on worker id={}", workerId);
            return false;
        }
        return true;
    }

    /**
     * 归还一个容量并累计指标；count 归零且仍 active 时 BUSY -> IDLE。
     *
     * @param durationSeconds 从 started_at 起算的执行时长，未开始的 Task 传 null
     */
    @Transactional
    public void releaseCapacity(Long workerId, TaskOutcome outcome, Double durationSeconds) {
        Timestamp now = tsNow();
        int processed = outcome.countsAsProcessed() ? 1 : 0;
        int failed = outcome == TaskOutcome.FAILED ? 1 : 0;

        int ok = workerRepo.release(workerId, processed, failed, now);
        if (ok == 0) {
            if (!workerRepo.existsById(workerId)) throw new NotFoundException("Worker", workerId);
            log.error("Capacity release without reservation: worker id={}, outcome={}", workerId, outcome);
            return;
        }
        if (processed == 1 && durationSeconds != null) {
            workerRepo.foldDuration(workerId, durationSeconds);
        }
        workerRepo.moveIfDrained(workerId, BUSY_ONLY, WorkerStatus.IDLE, now);
    }

    /**
     * 当前是否持有一个尚未被 Task 占用的预留：count 大于 ASSIGNED/RUNNING 的实际数量
     */
    @Transactional(readOnly = true)
    public boolean hasReservation(Long workerId) {
        int reserved = workerRepo.findCurrentTaskCount(workerId)
                .orElseThrow(() -> new NotFoundException("Worker", workerId));
        long live = taskRepo.countByWorkerIdAndStatusIn(workerId, TaskStatus.HOLDING_CAPACITY);
        return reserved > live;
    }

    /**
     * 在全部 Worker 中挑选：count 最小优先，其次 last_heartbeat 最早，最后按 id。
     * 不阻塞，没有合格 Worker 时返回 empty。
     */
    @Transactional(readOnly = true)
    public Optional<Long> selectCandidate() {
        return first(workerRepo.findCandidates(WorkerStatus.SCHEDULABLE, FIRST));
    }

    /**
     * 只在给定的 Worker 池中挑选，空池返回 empty
     */
    @Transactional(readOnly = true)
    public Optional<Long> selectCandidate(Collection<Long> pool) {
        if (pool == null || pool.isEmpty()) return Optional.empty();
        return first(workerRepo.findCandidatesIn(WorkerStatus.SCHEDULABLE, pool, FIRST));
    }

    @Transactional
    public void setActive(Long workerId, boolean active) {
        if (workerRepo.updateActive(workerId, active, tsNow()) == 0) throw new NotFoundException("Worker", workerId);
        log.info("Worker {}: id={}", active ? "activated" : "deactivated", workerId);
    }

    /**
     * 人工设置状态。IDLE / BUSY 视为恢复服务，按当前 count 决定落到哪一个。
     */
    @Transactional
    public void updateStatus(Long workerId, WorkerStatus status) {
        Timestamp now = tsNow();
        if (status == WorkerStatus.IDLE || status == WorkerStatus.BUSY) {
            int moved = workerRepo.moveIfDrained(workerId, ANY, WorkerStatus.IDLE, now)
                    + workerRepo.moveIfLoaded(workerId, ANY, WorkerStatus.BUSY, now);
            if (moved == 0) {
                if (!workerRepo.existsById(workerId)) throw new NotFoundException("Worker", workerId);
                throw new InvalidTransitionException("Worker id=" + workerId + " is inactive and cannot return to service");
            }
        } else if (workerRepo.updateStatus(workerId, status, now) == 0) {
            throw new NotFoundException("Worker", workerId);
        }
        log.info("Worker status updated: id={}, status={}", workerId, status);
    }

    /**
     * 心跳早于 cutoff 的 IDLE / BUSY Worker 置为 OFFLINE
     */
    @Transactional
    public int markStaleOffline(Timestamp cutoff) {
        return workerRepo.markStale(WorkerStatus.OFFLINE, WorkerStatus.SCHEDULABLE, cutoff, tsNow());
    }

    @Transactional(readOnly = true)
    public Worker get(Long workerId) {
        return workerRepo.findById(workerId).orElseThrow(() -> new NotFoundException("Worker", workerId));
    }

    @Transactional(readOnly = true)
    public Page<Worker> list(WorkerStatus status, Boolean active, Pageable pageable) {
        return workerRepo.findAll(QueryFilters.workers(status, active), QueryFilters.sorted(pageable, Sort.by("name", "id")));
    }

    private static Optional<Long> first(List<WorkerCandidate> candidates) {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0).getId());
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
