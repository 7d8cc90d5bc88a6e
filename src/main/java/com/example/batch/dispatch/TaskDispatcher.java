package com.example.batch.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 把已分配的 Task 交给 Worker 执行。传输方式（队列、RPC、进程内线程池）由实现决定。
 */
public interface TaskDispatcher {

    /**
     * 在分配事务内调用；抛出异常时分配回滚，Task 保持 PENDING，预占容量被归还。
     */
    void dispatch(Long workerId, Long taskId, JsonNode parameters) throws DispatchException;
}
