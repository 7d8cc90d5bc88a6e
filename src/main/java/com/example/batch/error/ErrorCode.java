package com.example.batch.error;

public enum ErrorCode {
    NOT_FOUND,
    INVALID_TRANSITION,
    INVALID_SPEC,
    RETRY_EXHAUSTED,
    CAPACITY_UNAVAILABLE,
    TERMINAL_STATE,
    CONTENTION
}
