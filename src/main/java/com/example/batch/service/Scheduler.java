package com.example.batch.service;

import com.example.batch.dispatch.DispatchException;
import com.example.batch.dispatch.TaskCompletionCallback;
import com.example.batch.dispatch.TaskDispatcher;
import com.example.batch.domain.BatchJob;
import com.example.batch.domain.BatchTask;
import com.example.batch.error.SchedulerException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 编排 Job / Task / Worker 之间的交互，自身不持久化任何状态。
 * <p>
 * 分配单元（领取 Task + 预占容量 + 分配 + 下发）在一个事务内完成，并先锁住 job：
 * 下发失败时整个事务回滚，Task 仍是 PENDING，预占的容量随之撤销。
 * 容量释放、Worker 注册、心跳都会重新触发分配，不会阻塞等待空闲 Worker。
 */
@Slf4j
@Service
public class Scheduler implements TaskCompletionCallback {

    private static final int MAX_CONTENDED = 16;

    private enum Step { ASSIGNED, CONTENDED, STOP }

    private final JobStore jobStore;
    private final TaskStore taskStore;
    private final WorkerRegistry workerRegistry;
    private final TaskPlanner planner;
    private final TaskDispatcher dispatcher;
    private final TaskScheduler taskScheduler;
    private final PayloadMapper payloads;
    private final TransactionTemplate tx;

    // jobId -> 延迟下发
    private final Map<Long, ScheduledFuture<?>> deferred = new ConcurrentHashMap<>();

    public Scheduler(JobStore jobStore, TaskStore taskStore, WorkerRegistry workerRegistry, TaskPlanner planner,
                     TaskDispatcher dispatcher, TaskScheduler taskScheduler, PayloadMapper payloads,
                     PlatformTransactionManager txManager) {
        this.jobStore = jobStore;
        this.taskStore = taskStore;
        this.workerRegistry = workerRegistry;
        this.planner = planner;
        this.dispatcher = dispatcher;
        this.taskScheduler = taskScheduler;
        this.payloads = payloads;
        // 回调可能在分配事务的 afterCommit 中执行（线程池饱和时 CallerRuns），必须开新事务
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 创建 Job 与其 Task；未设置 scheduled_start 时立即入队并分配，否则到点再下发。
     */
    public Long submitJob(Long tenantId, JobSpec spec, String actor) {
        BatchJob job = tx.execute(s -> {
            BatchJob j = jobStore.createJob(tenantId, spec, actor);
            taskStore.createTasks(j, planner.plan(j, spec), actor);
            return j;
        });
        dispatchOrDefer(job.getId(), job.getScheduledStart());
        return job.getId();
    }

    void dispatchOrDefer(Long jobId, Timestamp scheduledStart) {
        if (scheduledStart == null || !scheduledStart.after(tsNow())) {
            dispatchDue(jobId);
            return;
        }
        ScheduledFuture<?> f = taskScheduler.schedule(() -> runDeferred(jobId), scheduledStart.toInstant());
        ScheduledFuture<?> prev = deferred.put(jobId, f);
        if (prev != null) prev.cancel(false);
        log.info("Job dispatch deferred: id={}, at={}", jobId, scheduledStart);
    }

    private void runDeferred(Long jobId) {
        deferred.remove(jobId);
        try {
            dispatchDue(jobId);
        } catch (SchedulerException | DataAccessException e) {
            log.warn("Deferred dispatch failed: job={} : {}", jobId, e.getMessage());
        }
    }

    /**
     * PENDING 且到期的 job 转为 QUEUED，然后分配其 PENDING Task
     *
     * @return 本次分配的 Task 数
     */
    public int dispatchDue(Long jobId) {
        if (jobStore.queueIfDue(jobId, tsNow(), HistoryRecorder.SYSTEM)) {
            log.info("Job queued: id={}", jobId);
        }
        return assignPendingTasks(jobId);
    }

    /**
     * 按 sequence_number 顺序分配，直到没有 PENDING Task 或没有可用 Worker。
     * 瞬时失败（无容量、锁超时、下发失败）不抛出，Task 留待下一次触发。
     *
     * @return 本次分配的 Task 数
     */
    public int assignPendingTasks(Long jobId) {
        int assigned = 0;
        int contended = 0;
        while (true) {
            Step step;
            try {
                step = tx.execute(s -> assignNext(jobId, s));
            } catch (SchedulerException e) {
                log.warn("Assignment rejected: job={} code={} : {}", jobId, e.getCode(), e.getMessage());
                break;
            } catch (DataAccessException e) {
                log.warn("Assignment transient failure: job={} : {}", jobId, e.getMessage());
                break;
            }
            if (step == Step.ASSIGNED) {
                assigned++;
                contended = 0;
            } else if (step == Step.CONTENDED) {
                if (++contended >= MAX_CONTENDED) break;
            } else {
                break;
            }
        }
        if (assigned > 0) log.info("Tasks assigned: job={}, count={}", jobId, assigned);
        return assigned;
    }

    private Step assignNext(Long jobId, TransactionStatus status) {
        BatchJob job = jobStore.lockJob(jobId);
        if (!job.getStatus().acceptsAssignments()) return Step.STOP;

        Optional<Long> taskId = taskStore.claimNextTask(jobId);
        if (!taskId.isPresent()) return Step.STOP;

        Optional<Long> workerId = workerRegistry.selectCandidate();
        if (!workerId.isPresent()) {
            log.debug("No eligible worker, task stays pending: job={}, task={}", jobId, taskId.get());
            return Step.STOP;
        }
        if (!workerRegistry.reserveCapacity(workerId.get())) {
            // 选中之后被其它调用方占满
            return Step.CONTENDED;
        }

        BatchTask task = taskStore.assignTask(taskId.get(), workerId.get(), HistoryRecorder.SYSTEM);
        try {
            dispatcher.dispatch(workerId.get(), task.getId(), payloads.read(task.getParameters()));
        } catch (DispatchException e) {
            log.warn("Dispatch failed, assignment rolled back: job={}, task={}, worker={} : {}",
                    jobId, task.getId(), workerId.get(), e.getMessage());
            status.setRollbackOnly();
            return Step.STOP;
        }
        return Step.ASSIGNED;
    }

    /**
     * 所有可分配的 job 依次分配，优先级高的先拿到容量
     */
    public int assignAllPending() {
        int assigned = 0;
        for (Long jobId : jobStore.findAssignableJobIds()) {
            if (!workerRegistry.selectCandidate().isPresent()) break;
            assigned += assignPendingTasks(jobId);
        }
        return assigned;
    }

    /**
     * 补扫到期但未下发的延迟 job（进程重启后内存中的定时器会丢失）
     */
    public int dispatchDueJobs() {
        List<Long> due = jobStore.findDueJobIds(tsNow());
        for (Long jobId : due) {
            ScheduledFuture<?> f = deferred.remove(jobId);
            if (f != null) f.cancel(false);
            try {
                dispatchDue(jobId);
            } catch (SchedulerException | DataAccessException e) {
                log.warn("Due dispatch failed: job={} : {}", jobId, e.getMessage());
            }
        }
        return due.size();
    }

    public boolean isDeferred(Long jobId) {
        return deferred.containsKey(jobId);
    }

    // ---- Worker 回调 ----

    @Override
    public void onTaskStarted(Long taskId) {
        tx.executeWithoutResult(s -> taskStore.startTask(taskId, null));
    }

    @Override
    public void onTaskProgress(Long taskId, int percent) {
        tx.executeWithoutResult(s -> taskStore.reportProgress(taskId, percent));
    }

    @Override
    public void onTaskCompleted(Long taskId, JsonNode result) {
        completeTask(taskId, result, null);
    }

    @Override
    public void onTaskFailed(Long taskId, JsonNode error) {
        failTask(taskId, error, null);
    }

    public BatchTask startTask(Long taskId, String actor) {
        return tx.execute(s -> taskStore.startTask(taskId, actor));
    }

    public BatchTask completeTask(Long taskId, JsonNode result, String actor) {
        BatchTask t = tx.execute(s -> taskStore.completeTask(taskId, result, actor));
        afterCapacityFreed(t.getJobId());
        return t;
    }

    /**
     * Worker 上报失败或 watchdog 判定超时。只记录，不会让 job 失败。
     */
    public BatchTask failTask(Long taskId, JsonNode error, String actor) {
        BatchTask t = tx.execute(s -> taskStore.failTask(taskId, error, actor));
        afterCapacityFreed(t.getJobId());
        return t;
    }

    public BatchTask cancelTask(Long tenantId, Long taskId, String reason, String actor) {
        BatchTask t = tx.execute(s -> taskStore.cancelTask(tenantId, taskId, reason, actor));
        afterCapacityFreed(t.getJobId());
        return t;
    }

    // ---- Job 操作 ----

    public BatchJob cancelJob(Long tenantId, Long jobId, String reason, String actor) {
        BatchJob job = tx.execute(s -> jobStore.cancelJob(tenantId, jobId, reason, actor));
        ScheduledFuture<?> f = deferred.remove(jobId);
        if (f != null) f.cancel(false);
        assignAllPending();
        return job;
    }

    public BatchJob retryJob(Long tenantId, Long jobId, String actor) {
        BatchJob job = tx.execute(s -> jobStore.retryJob(tenantId, jobId, actor));
        afterCapacityFreed(jobId);
        return job;
    }

    public BatchJob pauseJob(Long tenantId, Long jobId, String actor) {
        return tx.execute(s -> jobStore.pauseJob(tenantId, jobId, actor));
    }

    public BatchJob resumeJob(Long tenantId, Long jobId, String actor) {
        BatchJob job = tx.execute(s -> jobStore.resumeJob(tenantId, jobId, actor));
        switch (job.getStatus()) {
            case PENDING:
                dispatchOrDefer(jobId, job.getScheduledStart());
                break;
            case QUEUED:
            case RUNNING:
                assignPendingTasks(jobId);
                break;
            default:
                break;
        }
        return job;
    }

    public BatchJob failJob(Long tenantId, Long jobId, JsonNode error, String actor) {
        return tx.execute(s -> jobStore.failJob(tenantId, jobId, error, actor));
    }

    // ---- Worker ----

    public Long registerWorker(WorkerSpec spec) {
        Long id = workerRegistry.registerWorker(spec);
        assignAllPending();
        return id;
    }

    public void heartbeat(Long workerId) {
        workerRegistry.heartbeat(workerId, tsNow());
        assignAllPending();
    }

    private void afterCapacityFreed(Long jobId) {
        assignPendingTasks(jobId);
        assignAllPending();
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
