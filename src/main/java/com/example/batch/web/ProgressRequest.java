package com.example.batch.web;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

@Data
public class ProgressRequest {
    @NotNull
    @Min(0)
    @Max(100)
    private Integer percent;
}
