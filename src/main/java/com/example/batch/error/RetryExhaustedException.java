package com.example.batch.error;

public class RetryExhaustedException extends SchedulerException {

    public RetryExhaustedException(Long jobId, int retryCount, int maxRetries) {
        super(ErrorCode.RETRY_EXHAUSTED, "Maximum retry attempts exceeded for job id=" + jobId
                + " (retryCount=" + retryCount + ", maxRetries=" + maxRetries + ")");
    }
}
