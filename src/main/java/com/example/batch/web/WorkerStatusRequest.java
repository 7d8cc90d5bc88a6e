package com.example.batch.web;

import com.example.batch.domain.WorkerStatus;
import lombok.Data;

import javax.validation.constraints.NotNull;

@Data
public class WorkerStatusRequest {
    @NotNull
    private WorkerStatus status;
}
