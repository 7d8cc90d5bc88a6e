package com.example.batch.dispatch;

import com.example.batch.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 进程内执行某一类 job 的 Task。返回值写入 result_data，抛出异常记为 Task 失败。
 */
public interface TaskRunner {

    JobType jobType();

    JsonNode run(TaskExecution execution) throws Exception;
}
