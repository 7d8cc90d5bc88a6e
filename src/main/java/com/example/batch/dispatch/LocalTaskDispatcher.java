package com.example.batch.dispatch;

import com.example.batch.domain.JobType;
import com.example.batch.error.SchedulerException;
import com.example.batch.repo.TaskRepo;
import com.example.batch.service.PayloadMapper;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * scheduler.dispatch.mode=local：在本进程 taskExec 线程池中执行 job 类型对应的 {@link TaskRunner}。
 * 分配事务提交后才提交到线程池，回滚的分配不会被执行。
 * 每个 {@link JobType} 至多一个 Runner，重复注册在启动时失败；没有 Runner 的类型下发失败，Task 留在 PENDING。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "scheduler.dispatch", name = "mode", havingValue = "local")
public class LocalTaskDispatcher implements TaskDispatcher {

    private final Map<JobType, TaskRunner> runners;
    private final TaskRepo taskRepo;
    private final ThreadPoolTaskExecutor taskExec;
    private final ObjectProvider<TaskCompletionCallback> callback; // Scheduler 反过来依赖本类
    private final PayloadMapper payloads;

    public LocalTaskDispatcher(ObjectProvider<TaskRunner> runners, TaskRepo taskRepo, ThreadPoolTaskExecutor taskExec,
                               ObjectProvider<TaskCompletionCallback> callback, PayloadMapper payloads) {
        this.runners = index(runners.orderedStream().collect(Collectors.toList()));
        this.taskRepo = taskRepo;
        this.taskExec = taskExec;
        this.callback = callback;
        this.payloads = payloads;
        log.info("Local dispatch enabled: types={}", this.runners.keySet());
    }

    static Map<JobType, TaskRunner> index(List<TaskRunner> list) {
        Map<JobType, TaskRunner> map = new EnumMap<>(JobType.class);
        if (list == null) return map;
        for (TaskRunner r : list) {
            JobType type = r.jobType();
            if (type == null) {
                throw new IllegalStateException("TaskRunner.jobType() must not be null: " + r.getClass().getName());
            }
            TaskRunner prev = map.putIfAbsent(type, r);
            if (prev != null) {
                throw new IllegalStateException("Duplicate runner for " + type + ": "
                        + prev.getClass().getName() + ", " + r.getClass().getName());
            }
        }
        return map;
    }

    public Set<JobType> supportedTypes() {
        Set<JobType> types = EnumSet.noneOf(JobType.class);
        types.addAll(runners.keySet());
        return Collections.unmodifiableSet(types);
    }

    @Override
    public void dispatch(Long workerId, Long taskId, JsonNode parameters) throws DispatchException {
        JobType type = taskRepo.findJobTypeByTaskId(taskId)
                .orElseThrow(() -> new DispatchException("Unknown task id=" + taskId));
        TaskRunner r = runners.get(type);
        if (r == null) throw new DispatchException("No runner for type=" + type);

        final JsonNode params = parameters == null ? payloads.read(null) : parameters;
        final Runnable work = () -> executeAndReport(r, taskId, workerId, params);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(taskId, type, work);
                }
            });
        } else {
            submit(taskId, type, work);
        }
    }

    private void submit(Long taskId, JobType type, Runnable work) {
        log.info("Submit task to pool: id={}, type={}", taskId, type);
        taskExec.execute(work);
    }

    /**
     * 真正执行体（线程池中运行）：开始 -> Runner -> 完成 / 失败回写
     */
    private void executeAndReport(TaskRunner r, Long taskId, Long workerId, JsonNode params) {
        TaskCompletionCallback cb = callback.getObject();
        try {
            cb.onTaskStarted(taskId);
        } catch (SchedulerException e) {
            // 提交后、开始前被取消
            log.warn("Task start rejected id={} : {}", taskId, e.getMessage());
            return;
        }

        log.info("Start execute task: id={}, worker={}, runner={}", taskId, workerId, r.getClass().getSimpleName());
        JsonNode result;
        try {
            result = r.run(new TaskExecution(taskId, workerId, params, p -> reportProgress(cb, taskId, p)));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Task interrupted id={}", taskId, ie);
            report(taskId, () -> cb.onTaskFailed(taskId, payloads.error("Interrupted during execution")));
            return;
        } catch (Exception e) {
            log.error("Task failed id={}", taskId, e);
            report(taskId, () -> cb.onTaskFailed(taskId, payloads.error(e)));
            return;
        }
        report(taskId, () -> cb.onTaskCompleted(taskId, result));
    }

    private boolean reportProgress(TaskCompletionCallback cb, Long taskId, int percent) {
        try {
            cb.onTaskProgress(taskId, percent);
            return true;
        } catch (SchedulerException e) {
            log.debug("Progress rejected id={} : {}", taskId, e.getMessage());
            return false;
        }
    }

    private void report(Long taskId, Runnable outcome) {
        try {
            outcome.run();
        } catch (SchedulerException e) {
            // 运行期间 Task / Job 被取消，结果丢弃
            log.warn("Task outcome rejected id={} code={} : {}", taskId, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to report outcome for task id={}", taskId, e);
        }
    }
}
