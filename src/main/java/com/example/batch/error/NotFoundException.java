package com.example.batch.error;

public class NotFoundException extends SchedulerException {

    public NotFoundException(String entity, Object id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: id=" + id);
    }
}
