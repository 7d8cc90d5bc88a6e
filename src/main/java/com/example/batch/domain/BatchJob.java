package com.example.batch.domain;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Getter @Setter @ToString
@Table(name = "batch_job", indexes = {@Index(name = "idx_job_tenant_status", columnList = "tenant_id, status"), @Index(name = "idx_job_status_start", columnList = "status, scheduled_start"), @Index(name = "idx_job_parent", columnList = "parent_job_id")})
public class BatchJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 32)
    private JobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobPriority priority = JobPriority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status = JobStatus.PENDING;

    // PAUSED 之前的状态，resume 时恢复
    @Enumerated(EnumType.STRING)
    @Column(name = "paused_from", length = 16)
    private JobStatus pausedFrom;

    @Lob
    @JsonRawValue
    @Column(name = "parameters")
    private String parameters;

    @Column(name = "scheduled_start", columnDefinition = "TIMESTAMP(3)")
    private Timestamp scheduledStart;

    @Column(name = "actual_start", columnDefinition = "TIMESTAMP(3)")
    private Timestamp actualStart;

    @Column(name = "completed_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp completedAt;

    @Column(name = "timeout_minutes")
    private Integer timeoutMinutes;

    @Column(name = "parent_job_id")
    private Long parentJobId;

    @Lob
    @JsonRawValue
    @Column(name = "result_data")
    private String resultData;

    @Lob
    @JsonRawValue
    @Column(name = "error_details")
    private String errorDetails;

    @Column(name = "progress_percent", nullable = false)
    private Integer progressPercent = 0;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private Integer maxRetries = 3;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "last_updated_by", length = 64)
    private String lastUpdatedBy;

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
