package com.tasksync.shared.web;

import com.tasksync.shared.errors.ErrorKind;
import com.tasksync.shared.errors.TaskSyncException;
import com.tasksync.shared.errors.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Maps the error taxonomy to RFC 7807 problem responses.
 *
 * Every body carries a stable {@code kind}, a {@code retryable} hint and the request
 * {@code correlationId}, so clients can tell a conflict worth retrying from a rejected input.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final String TYPE_BASE = "https://tasksync.app/errors/";

    @ExceptionHandler(TaskSyncException.class)
    public ProblemDetail handleTaskSync(TaskSyncException ex) {
        switch (ex.getKind()) {
            case CORRUPT_STREAM -> log.error("Corrupt stream reached API boundary: {}", ex.getMessage(), ex);
            case TRANSIENT_INFRASTRUCTURE -> log.warn("Transient failure: {}", ex.getMessage(), ex);
            default -> log.info("Request rejected: kind={}, message={}", ex.getKind(), ex.getMessage());
        }
        String detail = ex.getKind() == ErrorKind.CORRUPT_STREAM
                ? "Task history is inconsistent and has been flagged for inspection"
                : ex.getMessage();
        ProblemDetail problem = problem(ex.getKind(), detail);
        if (ex instanceof ValidationException) {
            problem.setProperty("violations", ((ValidationException) ex).getViolations());
        }
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleBeanValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.info("Request rejected: kind={}, message={}", ErrorKind.VALIDATION, detail);
        return problem(ErrorKind.VALIDATION, detail);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.info("Request rejected: kind={}, message={}", ErrorKind.VALIDATION, ex.getMessage());
        return problem(ErrorKind.VALIDATION, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(TYPE_BASE + "internal"));
        problem.setProperty("kind", "internal");
        problem.setProperty("retryable", false);
        enrich(problem);
        return problem;
    }

    private ProblemDetail problem(ErrorKind kind, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(kind.status(), detail);
        problem.setTitle(kind.status().getReasonPhrase());
        problem.setType(URI.create(TYPE_BASE + kind.wireName()));
        problem.setProperty("kind", kind.wireName());
        problem.setProperty("retryable", kind.retryable());
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = CorrelationIdFilter.currentCorrelationId();
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
    }
}
