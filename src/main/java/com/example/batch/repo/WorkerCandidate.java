package com.example.batch.repo;

import lombok.Getter;
import lombok.ToString;

import java.sql.Timestamp;
import java.util.Date;

/**
 * 候选 Worker 的只读投影，不进入持久化上下文
 */
@Getter
@ToString
public class WorkerCandidate {
    private final Long id;
    private final Integer currentTaskCount;
    private final Timestamp lastHeartbeat;

    // JPQL 构造表达式里 Timestamp 列的类型是 java.util.Date
    public WorkerCandidate(Long id, Integer currentTaskCount, Date lastHeartbeat) {
        this.id = id;
        this.currentTaskCount = currentTaskCount;
        this.lastHeartbeat = toTimestamp(lastHeartbeat);
    }

    private static Timestamp toTimestamp(Date d) {
        if (d == null || d instanceof Timestamp) return (Timestamp) d;
        return new Timestamp(d.getTime());
    }
}
