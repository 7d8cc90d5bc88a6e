package com.example.batch.domain;

/**
 * 释放 Worker 容量时的结果，决定统计指标如何累计
 */
public enum TaskOutcome {
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean countsAsProcessed() {
        return this != CANCELLED;
    }
}
