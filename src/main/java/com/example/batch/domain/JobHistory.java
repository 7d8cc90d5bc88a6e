package com.example.batch.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import javax.persistence.*;
import java.sql.Timestamp;

/**
 * Job 状态变更审计，只追加不修改
 */
@Entity
@Immutable
@Getter @ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "batch_job_history", indexes = {@Index(name = "idx_job_history_job", columnList = "job_id, created_at")})
public class JobHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16, updatable = false)
    private JobStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 16, updatable = false)
    private JobStatus newStatus;

    @Column(name = "reason", length = 500, updatable = false)
    private String reason;

    @Column(name = "progress_percent", updatable = false)
    private Integer progressPercent;

    @Column(name = "actor", length = 64, updatable = false)
    private String actor;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    public static JobHistory of(BatchJob job, JobStatus previous, String reason, String actor) {
        JobHistory h = new JobHistory();
        h.jobId = job.getId();
        h.previousStatus = previous;
        h.newStatus = job.getStatus();
        h.reason = reason;
        h.progressPercent = job.getProgressPercent();
        h.actor = actor;
        h.createdAt = new Timestamp(System.currentTimeMillis());
        return h;
    }
}
