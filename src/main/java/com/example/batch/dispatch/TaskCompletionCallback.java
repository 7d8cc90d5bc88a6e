package com.example.batch.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Worker 侧运行时回调调度核心。
 * 被拒绝的回调（Task 已被取消、已终态等）以 {@link com.example.batch.error.SchedulerException} 抛出。
 */
public interface TaskCompletionCallback {

    void onTaskStarted(Long taskId);

    void onTaskProgress(Long taskId, int percent);

    void onTaskCompleted(Long taskId, JsonNode result);

    void onTaskFailed(Long taskId, JsonNode error);
}
