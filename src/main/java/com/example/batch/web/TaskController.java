package com.example.batch.web;

import com.example.batch.domain.BatchTask;
import com.example.batch.domain.TaskHistory;
import com.example.batch.domain.TaskStatus;
import com.example.batch.service.HistoryRecorder;
import com.example.batch.service.Scheduler;
import com.example.batch.service.TaskStore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Task 查询与 Worker 回调。start / progress / complete / fail 不带 X-User 时记为 worker:&lt;id&gt;。
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {
    private final Scheduler scheduler;
    private final TaskStore taskStore;
    private final HistoryRecorder history;

    @GetMapping
    public Page<BatchTask> list(@RequestHeader("X-Tenant-Id") Long tenantId,
                                @RequestParam(required = false) Long jobId,
                                @RequestParam(required = false) Long workerId,
                                @RequestParam(required = false) TaskStatus status,
                                Pageable pageable) {
        return taskStore.list(tenantId, jobId, workerId, status, pageable);
    }

    @GetMapping("/{id}")
    public BatchTask get(@RequestHeader("X-Tenant-Id") Long tenantId, @PathVariable Long id) {
        return taskStore.get(tenantId, id);
    }

    @GetMapping("/{id}/history")
    public Page<TaskHistory> history(@RequestHeader("X-Tenant-Id") Long tenantId, @PathVariable Long id, Pageable pageable) {
        return history.taskHistory(tenantId, id, pageable);
    }

    @PostMapping("/{id}/start")
    public BatchTask start(@RequestHeader("X-Tenant-Id") Long tenantId,
                           @RequestHeader(value = "X-User", required = false) String user,
                           @PathVariable Long id) {
        taskStore.get(tenantId, id);
        return scheduler.startTask(id, user);
    }

    @PostMapping("/{id}/progress")
    public BatchTask progress(@RequestHeader("X-Tenant-Id") Long tenantId,
                              @PathVariable Long id,
                              @Valid @RequestBody ProgressRequest req) {
        taskStore.get(tenantId, id);
        scheduler.onTaskProgress(id, req.getPercent());
        return taskStore.get(tenantId, id);
    }

    @PostMapping("/{id}/complete")
    public BatchTask complete(@RequestHeader("X-Tenant-Id") Long tenantId,
                              @RequestHeader(value = "X-User", required = false) String user,
                              @PathVariable Long id,
                              @RequestBody(required = false) JsonNode result) {
        taskStore.get(tenantId, id);
        return scheduler.completeTask(id, result, user);
    }

    @PostMapping("/{id}/fail")
    public BatchTask fail(@RequestHeader("X-Tenant-Id") Long tenantId,
                          @RequestHeader(value = "X-User", required = false) String user,
                          @PathVariable Long id,
                          @RequestBody(required = false) JsonNode error) {
        taskStore.get(tenantId, id);
        return scheduler.failTask(id, error, user);
    }

    @PostMapping("/{id}/cancel")
    public BatchTask cancel(@RequestHeader("X-Tenant-Id") Long tenantId,
                            @RequestHeader(value = "X-User", defaultValue = "anonymous") String user,
                            @PathVariable Long id,
                            @RequestParam(required = false) String reason) {
        return scheduler.cancelTask(tenantId, id, reason, user);
    }
}
