package com.example.batch.domain;

public enum JobType {
    BILLING,
    INVENTORY,
    REPORT,
    DATA_PROCESSING
}
