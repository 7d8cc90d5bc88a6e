package com.example.batch.web;

import com.example.batch.domain.*;
import com.example.batch.service.HistoryRecorder;
import com.example.batch.service.JobSpec;
import com.example.batch.service.JobStore;
import com.example.batch.service.Scheduler;
import com.example.batch.service.TaskStore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {
    private final Scheduler scheduler;
    private final JobStore jobStore;
    private final TaskStore taskStore;
    private final HistoryRecorder history;

    @PostMapping
    public ResponseEntity<BatchJob> submit(@RequestHeader("X-Tenant-Id") Long tenantId,
                                           @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                                           @Valid @RequestBody JobSpec spec) {
        Long id = scheduler.submitJob(tenantId, spec, user);
        return ResponseEntity.status(HttpStatus.CREATED).body(jobStore.get(tenantId, id));
    }

    @GetMapping
    public Page<BatchJob> list(@RequestHeader("X-Tenant-Id") Long tenantId,
                               @RequestParam(required = false) JobStatus status,
                               @RequestParam(required = false) JobType type,
                               @RequestParam(required = false) JobPriority priority,
                               Pageable pageable) {
        return jobStore.list(tenantId, status, type, priority, pageable);
    }

    @GetMapping("/{id}")
    public BatchJob get(@RequestHeader("X-Tenant-Id") Long tenantId, @PathVariable Long id) {
        return jobStore.get(tenantId, id);
    }

    @GetMapping("/{id}/tasks")
    public List<BatchTask> tasks(@RequestHeader("X-Tenant-Id") Long tenantId, @PathVariable Long id) {
        return taskStore.listForJob(tenantId, id);
    }

    @GetMapping("/{id}/history")
    public Page<JobHistory> history(@RequestHeader("X-Tenant-Id") Long tenantId, @PathVariable Long id, Pageable pageable) {
        return history.jobHistory(tenantId, id, pageable);
    }

    @PostMapping("/{id}/cancel")
    public BatchJob cancel(@RequestHeader("X-Tenant-Id") Long tenantId,
                           @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                           @PathVariable Long id,
                           @RequestParam(required = false) String reason) {
        return scheduler.cancelJob(tenantId, id, reason, user);
    }

    @PostMapping("/{id}/retry")
    public BatchJob retry(@RequestHeader("X-Tenant-Id") Long tenantId,
                          @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                          @PathVariable Long id) {
        return scheduler.retryJob(tenantId, id, user);
    }

    @PostMapping("/{id}/pause")
    public BatchJob pause(@RequestHeader("X-Tenant-Id") Long tenantId,
                          @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                          @PathVariable Long id) {
        return scheduler.pauseJob(tenantId, id, user);
    }

    @PostMapping("/{id}/resume")
    public BatchJob resume(@RequestHeader("X-Tenant-Id") Long tenantId,
                           @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                           @PathVariable Long id) {
        return scheduler.resumeJob(tenantId, id, user);
    }

    @PostMapping("/{id}/fail")
    public BatchJob fail(@RequestHeader("X-Tenant-Id") Long tenantId,
                         @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                         @PathVariable Long id,
                         @RequestBody(required = false) JsonNode error) {
        return scheduler.failJob(tenantId, id, error, user);
    }
}
