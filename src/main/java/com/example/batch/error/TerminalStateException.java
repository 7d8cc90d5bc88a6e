package com.example.batch.error;

public class TerminalStateException extends SchedulerException {

    public TerminalStateException(String entity, Object id, Enum<?> status) {
        super(ErrorCode.TERMINAL_STATE, entity + " id=" + id + " is already " + status);
    }
}
