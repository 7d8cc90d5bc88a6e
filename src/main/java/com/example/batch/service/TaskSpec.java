package com.example.batch.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Min;
import javax.validation.constraints.Size;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSpec {
    @Size(max = 100)
    private String name;

    // 为空时取列表位置（从 1 开始）
    @Min(1)
    private Integer sequenceNumber;

    private JsonNode parameters;

    @Min(1)
    private Integer timeoutMinutes;

    @Min(0)
    private Integer maxRetries;
}
