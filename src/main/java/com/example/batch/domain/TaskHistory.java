package com.example.batch.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Immutable
@Getter @ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "batch_task_history", indexes = {@Index(name = "idx_task_history_task", columnList = "task_id, created_at"), @Index(name = "idx_task_history_job", columnList = "job_id")})
public class TaskHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private Long taskId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private Long jobId;

    @Column(name = "worker_id", updatable = false)
    private Long workerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16, updatable = false)
    private TaskStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 16, updatable = false)
    private TaskStatus newStatus;

    @Column(name = "reason", length = 500, updatable = false)
    private String reason;

    @Column(name = "actor", length = 64, updatable = false)
    private String actor;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    public static TaskHistory of(BatchTask task, TaskStatus previous, String reason, String actor) {
        TaskHistory h = new TaskHistory();
        h.taskId = task.getId();
        h.jobId = task.getJobId();
        h.workerId = task.getWorkerId();
        h.previousStatus = previous;
        h.newStatus = task.getStatus();
        h.reason = reason;
        h.actor = actor;
        h.createdAt = new Timestamp(System.currentTimeMillis());
        return h;
    }
}
