package com.example.batch.error;

/**
 * 调度核心的同步拒绝。抛出后所在事务回滚，实体保持上一个合法状态。
 */
public abstract class SchedulerException extends RuntimeException {

    private final ErrorCode code;

    protected SchedulerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
