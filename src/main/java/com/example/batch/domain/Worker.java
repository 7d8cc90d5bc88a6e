package com.example.batch.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

/**
 * 执行节点。注册后只通过 WorkerRepo 的条件 UPDATE 修改计数与状态，
 * 不要在事务里修改已加载的实体再 save（会覆盖并发的容量计数）。
 */
@Entity
@Getter @Setter @ToString
@Table(name = "batch_worker", indexes = {@Index(name = "idx_worker_pick", columnList = "is_active, status, current_task_count"), @Index(name = "idx_worker_heartbeat", columnList = "last_heartbeat")})
public class Worker {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "host", nullable = false, length = 200)
    private String host;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WorkerStatus status = WorkerStatus.IDLE;

    @Column(name = "is_active", nullable = false)
    private Boolean active = Boolean.TRUE;

    @Column(name = "last_heartbeat", columnDefinition = "TIMESTAMP(3)")
    private Timestamp lastHeartbeat;

    @Column(name = "max_concurrent_tasks", nullable = false)
    private Integer maxConcurrentTasks = 1;

    @Column(name = "current_task_count", nullable = false)
    private Integer currentTaskCount = 0;

    @Column(name = "total_tasks_processed", nullable = false)
    private Integer totalTasksProcessed = 0;

    @Column(name = "failed_task_count", nullable = false)
    private Integer failedTaskCount = 0;

    // 秒，completed + failed 的滑动平均
    @Column(name = "average_task_duration")
    private Double averageTaskDuration;

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        createdAt = now;
        updatedAt = now;
        if (lastHeartbeat == null) lastHeartbeat = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }
}
