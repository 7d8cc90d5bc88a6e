package com.example.batch.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum TaskStatus {
    PENDING,    // 待分配（可领取）
    ASSIGNED,   // 已预留 Worker 容量并分配
    RUNNING,    // Worker 已上报开始
    COMPLETED,  // 成功
    FAILED,     // 失败（需 Job 级 retry）
    CANCELLED;  // 已取消

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(ASSIGNED, CANCELLED));
        TRANSITIONS.put(ASSIGNED, EnumSet.of(RUNNING, CANCELLED));
        TRANSITIONS.put(RUNNING, EnumSet.of(COMPLETED, FAILED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(TaskStatus.class));
    }

    /**
     * 占用 Worker 容量的状态
     */
    public static final Set<TaskStatus> HOLDING_CAPACITY = Collections.unmodifiableSet(EnumSet.of(ASSIGNED, RUNNING));

    public static final Set<TaskStatus> NON_TERMINAL = Collections.unmodifiableSet(EnumSet.of(PENDING, ASSIGNED, RUNNING));

    public boolean canTransitionTo(TaskStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean holdsCapacity() {
        return HOLDING_CAPACITY.contains(this);
    }
}
