package com.example.batch.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * scheduler.dispatch.mode=external（默认）：分配提交即视为下发完成。
 * Worker 进程轮询 GET /api/workers/{id}/assignments 取走 ASSIGNED Task，
 * 再通过 /api/tasks/{id}/start、/complete、/fail 回报。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "scheduler.dispatch", name = "mode", havingValue = "external", matchIfMissing = true)
public class ExternalTaskDispatcher implements TaskDispatcher {

    @Override
    public void dispatch(Long workerId, Long taskId, JsonNode parameters) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    log.info("Task ready for pickup: id={}, worker={}", taskId, workerId);
                }
            });
        } else {
            log.info("Task ready for pickup: id={}, worker={}", taskId, workerId);
        }
    }
}
