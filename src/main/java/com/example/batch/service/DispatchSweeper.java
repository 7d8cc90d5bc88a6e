package com.example.batch.service;

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
 * 周期补扫：过期 Worker 置 OFFLINE，到期的延迟 job 入队，再按优先级分配所有 PENDING Task。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchSweeper {

    private final Scheduler scheduler;
    private final WorkerRegistry workerRegistry;

    @Value("${scheduler.sweep.enabled:true}")
    private boolean enabled;

    // <= 0 表示不按心跳判定下线
    @Value("${scheduler.worker.heartbeat-timeout-ms:90000}")
    private long heartbeatTimeoutMs;

    @Scheduled(fixedDelayString = "${scheduler.sweep.delay-ms:2000}", initialDelay = 3000L)
    public void tick() {
        if (!enabled) return;
        try {
            sweepOnce();
        } catch (SchedulerException | DataAccessException e) {
            log.warn("Dispatch sweep aborted: {}", e.getMessage());
        }
    }

    public int sweepOnce() {
        if (heartbeatTimeoutMs > 0) {
            Timestamp cutoff = Timestamp.from(Instant.now().minusMillis(heartbeatTimeoutMs));
            int stale = workerRegistry.markStaleOffline(cutoff);
            if (stale > 0) log.warn("Workers marked offline (heartbeat expired): count={}", stale);
        }
        int due = scheduler.dispatchDueJobs();
        int assigned = scheduler.assignAllPending();
        if (due > 0 || assigned > 0) log.info("Dispatch sweep: dueJobs={}, assigned={}", due, assigned);
        return assigned;
    }
}
