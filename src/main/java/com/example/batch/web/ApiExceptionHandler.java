package com.example.batch.web;

import com.example.batch.error.ErrorCode;
import com.example.batch.error.SchedulerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * SchedulerException -> HTTP 状态。请求格式错误统一按 INVALID_SPEC 返回 400。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SchedulerException.class)
    public ResponseEntity<ApiError> onScheduler(SchedulerException e) {
        HttpStatus status = statusOf(e.getCode());
        log.info("Request rejected: code={}, status={} : {}", e.getCode(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ApiError(e.getCode().name(), e.getMessage()));
    }

    // MethodArgumentNotValidException 是 BindException 的子类
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiError> onInvalid(BindException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        if (msg.isEmpty()) msg = e.getBindingResult().toString();
        return badRequest(msg);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> onMalformed(Exception e) {
        return badRequest(e.getMessage());
    }

    /**
     * 锁等待超时、死锁牺牲等瞬时冲突：未做任何修改，客户端可重试
     */
    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ApiError> onContention(TransientDataAccessException e) {
        log.warn("Request hit lock contention: {}", e.getMessage());
        return ResponseEntity.status(statusOf(ErrorCode.CONTENTION))
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(new ApiError(ErrorCode.CONTENTION.name(), "Resource busy, retry later"));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_SPEC:
                return HttpStatus.BAD_REQUEST;
            case CONTENTION:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.CONFLICT;
        }
    }

    private static ResponseEntity<ApiError> badRequest(String msg) {
        return ResponseEntity.badRequest().body(new ApiError(ErrorCode.INVALID_SPEC.name(), msg));
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }
}
