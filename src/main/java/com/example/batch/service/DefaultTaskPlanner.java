package com.example.batch.service;

import com.example.batch.domain.BatchJob;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 提交中带了 tasks 就原样使用，否则生成一个携带 job 参数的单 Task。
 */
@Component
public class DefaultTaskPlanner implements TaskPlanner {

    @Override
    public List<TaskSpec> plan(BatchJob job, JobSpec spec) {
        if (spec.getTasks() != null && !spec.getTasks().isEmpty()) {
            return spec.getTasks();
        }
        TaskSpec single = TaskSpec.builder()
                .name(job.getName())
                .sequenceNumber(1)
                .parameters(spec.getParameters())
                .maxRetries(job.getMaxRetries())
                .build();
        return Collections.singletonList(single);
    }
}
