package com.example.batch.service;

import com.example.batch.domain.BatchJob;

import java.util.List;

/**
 * 把一次 Job 提交展开为 Task 列表。
 */
public interface TaskPlanner {

    List<TaskSpec> plan(BatchJob job, JobSpec spec);
}
