package com.example.batch.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Job 状态机。所有状态变更都必须经过 {@link #canTransitionTo(JobStatus)} 校验。
 */
public enum JobStatus {
    PENDING,    // 已创建，等待派发（可能是延迟派发）
    QUEUED,     // 已入队，等待第一个 Task 开始
    RUNNING,    // 至少一个 Task 已开始
    COMPLETED,  // 全部 Task 完成
    FAILED,     // 失败（可重试）
    CANCELLED,  // 已取消
    PAUSED;     // 暂停，不再分配新 Task

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(QUEUED, CANCELLED, PAUSED));
        TRANSITIONS.put(QUEUED, EnumSet.of(RUNNING, CANCELLED, PAUSED));
        TRANSITIONS.put(RUNNING, EnumSet.of(COMPLETED, FAILED, CANCELLED, PAUSED));
        TRANSITIONS.put(PAUSED, EnumSet.of(PENDING, QUEUED, RUNNING, CANCELLED));
        // retry 与失败后取消
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(JobStatus.class));
    }

    public boolean canTransitionTo(JobStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    public Set<JobStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 不可再变更的状态（FAILED 仍可 retry / cancel）
     */
    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean acceptsAssignments() {
        return this == QUEUED || this == RUNNING;
    }
}
