package com.example.batch.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.ToString;

import java.util.function.IntPredicate;

@Getter
@ToString(exclude = "progressSink")
public class TaskExecution {

    private final Long taskId;
    private final Long workerId;
    private final JsonNode parameters;
    private final IntPredicate progressSink;

    public TaskExecution(Long taskId, Long workerId, JsonNode parameters, IntPredicate progressSink) {
        this.taskId = taskId;
        this.workerId = workerId;
        this.parameters = parameters;
        this.progressSink = progressSink;
    }

    /**
     * @return false 表示进度被拒绝（Task 已不在 RUNNING），Runner 可据此提前结束
     */
    public boolean reportProgress(int percent) {
        return progressSink.test(percent);
    }
}
