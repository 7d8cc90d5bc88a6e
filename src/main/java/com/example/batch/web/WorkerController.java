package com.example.batch.web;

import com.example.batch.domain.BatchTask;
import com.example.batch.domain.Worker;
import com.example.batch.domain.WorkerStatus;
import com.example.batch.service.Scheduler;
import com.example.batch.service.TaskStore;
import com.example.batch.service.WorkerRegistry;
import com.example.batch.service.WorkerSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

@RestController
@RequestMapping("/api/workers")
@RequiredArgsConstructor
public class WorkerController {
    private final Scheduler scheduler;
    private final WorkerRegistry workerRegistry;
    private final TaskStore taskStore;

    @PostMapping
    public ResponseEntity<Worker> register(@Valid @RequestBody WorkerSpec spec) {
        Long id = scheduler.registerWorker(spec);
        return ResponseEntity.status(HttpStatus.CREATED).body(workerRegistry.get(id));
    }

    @GetMapping
    public Page<Worker> list(@RequestParam(required = false) WorkerStatus status,
                             @RequestParam(required = false) Boolean active,
                             Pageable pageable) {
        return workerRegistry.list(status, active, pageable);
    }

    @GetMapping("/{id}")
    public Worker get(@PathVariable Long id) {
        return workerRegistry.get(id);
    }

    @GetMapping("/{id}/assignments")
    public List<BatchTask> assignments(@PathVariable Long id) {
        return taskStore.listAssigned(id);
    }

    @PostMapping("/{id}/heartbeat")
    public Worker heartbeat(@PathVariable Long id) {
        scheduler.heartbeat(id);
        return workerRegistry.get(id);
    }

    @PutMapping("/{id}/active")
    public Worker active(@PathVariable Long id, @RequestParam boolean value) {
        workerRegistry.setActive(id, value);
        return workerRegistry.get(id);
    }

    @PutMapping("/{id}/status")
    public Worker status(@PathVariable Long id, @Valid @RequestBody WorkerStatusRequest req) {
        workerRegistry.updateStatus(id, req.getStatus());
        return workerRegistry.get(id);
    }
}
