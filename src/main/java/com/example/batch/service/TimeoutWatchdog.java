package com.example.batch.service;

import com.example.batch.domain.BatchJob;
import com.example.batch.domain.BatchTask;
import com.example.batch.error.SchedulerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * 超时看门狗：RUNNING Task 超过 started_at + timeout 记为失败，
 * job 超过 actual_start + timeout 整体取消。与 Worker 回调竞争时以先提交者为准。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeoutWatchdog {

    private final Scheduler scheduler;
    private final TaskStore taskStore;
    private final JobStore jobStore;
    private final PayloadMapper payloads;

    @Value("${scheduler.watchdog.enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${scheduler.watchdog.delay-ms:30000}", initialDelay = 10000L)
    public void tick() {
        if (!enabled) return;
        try {
            sweepOnce();
        } catch (DataAccessException e) {
            log.warn("Timeout sweep aborted: {}", e.getMessage());
        }
    }

    /**
     * @return 本轮处理的 Task 与 job 总数
     */
    public int sweepOnce() {
        Timestamp now = Timestamp.from(Instant.now());
        int handled = 0;

        for (BatchTask t : taskStore.findRunningWithTimeout()) {
            long deadline = t.getStartedAt().getTime() + t.getTimeoutMinutes() * 60_000L;
            if (deadline >= now.getTime()) continue;
            try {
                scheduler.failTask(t.getId(),
                        payloads.error("Task timed out after " + t.getTimeoutMinutes() + " minutes"),
                        HistoryRecorder.WATCHDOG);
                log.warn("Task timed out: id={}, job={}, timeoutMinutes={}", t.getId(), t.getJobId(), t.getTimeoutMinutes());
                handled++;
            } catch (SchedulerException e) {
                log.info("Task timeout skipped, state changed concurrently: id={} : {}", t.getId(), e.getMessage());
            }
        }

        for (BatchJob j : jobStore.findTimedOut(now)) {
            try {
                scheduler.cancelJob(null, j.getId(),
                        "Job timed out after " + j.getTimeoutMinutes() + " minutes", HistoryRecorder.WATCHDOG);
                log.warn("Job timed out: id={}, timeoutMinutes={}", j.getId(), j.getTimeoutMinutes());
                handled++;
            } catch (SchedulerException e) {
                log.info("Job timeout skipped, state changed concurrently: id={} : {}", j.getId(), e.getMessage());
            }
        }
        return handled;
    }
}
