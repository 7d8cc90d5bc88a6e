package com.example.batch.error;

public class InvalidSpecException extends SchedulerException {

    public InvalidSpecException(String message) {
        super(ErrorCode.INVALID_SPEC, message);
    }
}
