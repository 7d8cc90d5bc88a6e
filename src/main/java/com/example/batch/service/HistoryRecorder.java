package com.example.batch.service;

import com.example.batch.domain.*;
import com.example.batch.error.NotFoundException;
import com.example.batch.repo.JobHistoryRepo;
import com.example.batch.repo.JobRepo;
import com.example.batch.repo.TaskHistoryRepo;
import com.example.batch.repo.TaskRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 状态变更审计。写入必须与状态变更处于同一事务（MANDATORY），
 * 变更回滚时审计一并回滚，保证每次变更恰好一条记录。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryRecorder {

    public static final String SYSTEM = "system";
    public static final String WATCHDOG = "watchdog";

    private final JobHistoryRepo jobHistoryRepo;
    private final TaskHistoryRepo taskHistoryRepo;
    private final JobRepo jobRepo;
    private final TaskRepo taskRepo;

    public static String workerActor(Long workerId) {
        return workerId == null ? SYSTEM : "worker:" + workerId;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public JobHistory recordJob(BatchJob job, JobStatus previous, String reason, String actor) {
        JobHistory h = jobHistoryRepo.save(JobHistory.of(job, previous, reason, actor));
        log.debug("Job history: job={}, {} -> {}, reason={}", job.getId(), previous, job.getStatus(), reason);
        return h;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public TaskHistory recordTask(BatchTask task, TaskStatus previous, String reason, String actor) {
        TaskHistory h = taskHistoryRepo.save(TaskHistory.of(task, previous, reason, actor));
        log.debug("Task history: task={}, {} -> {}, reason={}", task.getId(), previous, task.getStatus(), reason);
        return h;
    }

    @Transactional(readOnly = true)
    public List<JobHistory> jobHistory(Long tenantId, Long jobId) {
        if (!jobRepo.existsByIdAndTenantId(jobId, tenantId)) throw new NotFoundException("Job", jobId);
        return jobHistoryRepo.findByJobIdOrderByCreatedAtAscIdAsc(jobId);
    }

    @Transactional(readOnly = true)
    public Page<JobHistory> jobHistory(Long tenantId, Long jobId, Pageable pageable) {
        if (!jobRepo.existsByIdAndTenantId(jobId, tenantId)) throw new NotFoundException("Job", jobId);
        return jobHistoryRepo.findByJobIdOrderByCreatedAtAscIdAsc(jobId, pageable);
    }

    @Transactional(readOnly = true)
    public List<TaskHistory> taskHistory(Long tenantId, Long taskId) {
        if (!taskRepo.findByIdAndTenantId(taskId, tenantId).isPresent()) throw new NotFoundException("Task", taskId);
        return taskHistoryRepo.findByTaskIdOrderByCreatedAtAscIdAsc(taskId);
    }

    @Transactional(readOnly = true)
    public Page<TaskHistory> taskHistory(Long tenantId, Long taskId, Pageable pageable) {
        if (!taskRepo.findByIdAndTenantId(taskId, tenantId).isPresent()) throw new NotFoundException("Task", taskId);
        return taskHistoryRepo.findByTaskIdOrderByCreatedAtAscIdAsc(taskId, pageable);
    }
}
