package com.example.batch.error;

public class CapacityUnavailableException extends SchedulerException {

    public CapacityUnavailableException(Long workerId) {
        super(ErrorCode.CAPACITY_UNAVAILABLE, "No capacity reservation held on worker id=" + workerId);
    }
}
