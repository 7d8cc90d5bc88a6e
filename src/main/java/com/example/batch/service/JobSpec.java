package com.example.batch.service;

import com.example.batch.domain.JobPriority;
import com.example.batch.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import java.sql.Timestamp;
import java.util.List;

/**
 * 提交 Job 的输入。tasks 为空时由 {@link TaskPlanner} 决定如何展开。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSpec {
    @NotBlank
    @Size(max = 100)
    private String name;

    @Size(max = 500)
    private String description;

    @NotNull
    private JobType type;

    private JobPriority priority;

    private JsonNode parameters;

    // 必须严格晚于提交时刻
    private Timestamp scheduledStart;

    @Min(1)
    private Integer timeoutMinutes;

    @Min(0)
    private Integer maxRetries;

    private Long parentJobId;

    @Valid
    private List<TaskSpec> tasks;
}
