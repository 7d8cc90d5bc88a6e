package com.example.batch.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum WorkerStatus {
    IDLE,        // 空闲
    BUSY,        // 有在途 Task（容量未满时仍可分配）
    OFFLINE,     // 心跳超时
    MAINTENANCE, // 人工维护
    ERROR;       // 异常

    public static final Set<WorkerStatus> SCHEDULABLE = Collections.unmodifiableSet(EnumSet.of(IDLE, BUSY));

    public boolean isSchedulable() {
        return SCHEDULABLE.contains(this);
    }
}
