package com.example.batch.error;

public class InvalidTransitionException extends SchedulerException {

    public InvalidTransitionException(String entity, Object id, Enum<?> from, Enum<?> to) {
        super(ErrorCode.INVALID_TRANSITION, entity + " id=" + id + " cannot move from " + from + " to " + to);
    }

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }
}
