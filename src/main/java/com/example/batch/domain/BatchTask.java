package com.example.batch.domain;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Getter @Setter @ToString
@Table(name = "batch_task",
        uniqueConstraints = {@UniqueConstraint(name = "uk_task_job_seq", columnNames = {"job_id", "sequence_number"})},
        indexes = {@Index(name = "idx_task_claim", columnList = "job_id, status, sequence_number"), @Index(name = "idx_task_worker_status", columnList = "worker_id, status"), @Index(name = "idx_task_tenant", columnList = "tenant_id")})
public class BatchTask {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    // 仅 ASSIGNED / RUNNING 时计入容量，终态保留用于审计
    @Column(name = "worker_id")
    private Long workerId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "sequence_number", nullable = false)
    private Integer sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskStatus status = TaskStatus.PENDING;

    @Lob
    @JsonRawValue
    @Column(name = "parameters")
    private String parameters;

    @Lob
    @JsonRawValue
    @Column(name = "result_data")
    private String resultData;

    @Lob
    @JsonRawValue
    @Column(name = "error_details")
    private String errorDetails;

    @Column(name = "started_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp startedAt;

    @Column(name = "completed_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp completedAt;

    @Column(name = "timeout_minutes")
    private Integer timeoutMinutes;

    @Column(name = "progress_percent", nullable = false)
    private Integer progressPercent = 0;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private Integer maxRetries = 3;

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }
}
