package com.example.batch.service;

import com.example.batch.domain.BatchTask;
import com.example.batch.domain.TaskOutcome;
import com.example.batch.domain.TaskStatus;
import com.example.batch.error.InvalidTransitionException;
import com.example.batch.error.TerminalStateException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 已加锁 Task 上的状态变更，供 TaskStore 与 JobStore（级联取消 / 重试重置）共用。
 * 调用方负责先锁 job 再锁 task。
 */
@Component
@RequiredArgsConstructor
public class TaskTransitions {

    private final HistoryRecorder history;
    private final WorkerRegistry workerRegistry;

    public static void check(BatchTask task, TaskStatus to) {
        TaskStatus from = task.getStatus();
        if (from.canTransitionTo(to)) return;
        if (from.isFinal()) throw new TerminalStateException("Task", task.getId(), from);
        throw new InvalidTransitionException("Task", task.getId(), from, to);
    }

    /**
     * 校验迁移表后变更状态并写 history，返回变更前状态
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TaskStatus apply(BatchTask task, TaskStatus to, String reason, String actor) {
        TaskStatus from = task.getStatus();
        check(task, to);
        task.setStatus(to);
        history.recordTask(task, from, reason, actor);
        return from;
    }

    /**
     * non-terminal -> CANCELLED，占用容量时立即归还（不计入 Worker 指标）
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void cancel(BatchTask task, String reason, String actor) {
        Long heldBy = cancelHolding(task, reason, actor);
        if (heldBy != null) {
            workerRegistry.releaseCapacity(heldBy, TaskOutcome.CANCELLED, null);
        }
    }

    /**
     * non-terminal -> CANCELLED，但不归还容量
     *
     * @return 仍被占用容量的 Worker id，没有则为 null；调用方须经 {@link #releaseHeld(List)} 归还
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Long cancelHolding(BatchTask task, String reason, String actor) {
        TaskStatus from = apply(task, TaskStatus.CANCELLED, reason, actor);
        task.setCompletedAt(tsNow());
        return from.holdsCapacity() ? task.getWorkerId() : null;
    }

    /**
     * retry 重置，任意状态 -> PENDING。这是迁移表之外唯一允许的变更。
     *
     * @return 重置前占用容量的 Worker id，没有则为 null；调用方须经 {@link #releaseHeld(List)} 归还
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Long resetForRetry(BatchTask task, String actor) {
        TaskStatus from = task.getStatus();
        Long heldBy = from.holdsCapacity() ? task.getWorkerId() : null;

        task.setStatus(TaskStatus.PENDING);
        task.setWorkerId(null);
        task.setStartedAt(null);
        task.setCompletedAt(null);
        task.setErrorDetails(null);
        task.setResultData(null);
        task.setProgressPercent(0);

        if (from != TaskStatus.PENDING) {
            history.recordTask(task, from, "Reset for job retry", actor);
        }
        return heldBy;
    }

    /**
     * 级联归还容量。按 Worker id 升序加行锁，两个级联同时跨越同一批 Worker 时不会互相等待成环。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int releaseHeld(List<Long> workerIds) {
        List<Long> ordered = new ArrayList<>();
        for (Long id : workerIds) {
            if (id != null) ordered.add(id);
        }
        Collections.sort(ordered);
        for (Long id : ordered) {
            workerRegistry.releaseCapacity(id, TaskOutcome.CANCELLED, null);
        }
        return ordered.size();
    }

    static Double durationSeconds(BatchTask task, Timestamp end) {
        if (task.getStartedAt() == null || end == null) return null;
        return Math.max(0L, end.getTime() - task.getStartedAt().getTime()) / 1000.0;
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
