package com.tasksync.shared.web;

import com.tasksync.shared.errors.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("handleTaskSync — validation maps to 400 with violations and correlation id")
    void validation_mapsTo400() {
        MDC.put(CorrelationIdFilter.MDC_KEY, "corr-123");

        ProblemDetail problem = handler.handleTaskSync(
                new ValidationException(List.of("title must not be blank", "too many tags")));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(problem.getProperties())
                .containsEntry("kind", "validation_error")
                .containsEntry("retryable", false)
                .containsEntry("correlationId", "corr-123")
                .containsEntry("violations", List.of("title must not be blank", "too many tags"))
                .containsKey("timestamp");
    }

    @Test
    @DisplayName("handleTaskSync — each kind maps to its status code")
    void kinds_mapToStatus() {
        assertThat(handler.handleTaskSync(new TaskNotFoundException("f", "t")).getStatus()).isEqualTo(404);
        assertThat(handler.handleTaskSync(new AuthorizationException("u", "f")).getStatus()).isEqualTo(403);
        assertThat(handler.handleTaskSync(new TransientInfrastructureException("throttled")).getStatus()).isEqualTo(503);
    }

    @Test
    @DisplayName("handleTaskSync — concurrency conflict is 409 and marked retryable")
    void conflict_isRetryable409() {
        ProblemDetail problem = handler.handleTaskSync(new ConcurrencyConflictException("t", 4, null));

        assertThat(problem.getStatus()).isEqualTo(409);
        assertThat(problem.getProperties())
                .containsEntry("kind", "concurrency_conflict")
                .containsEntry("retryable", true);
    }

    @Test
    @DisplayName("handleTaskSync — corrupt stream hides internals behind a 500")
    void corruptStream_is500WithoutInternals() {
        ProblemDetail problem = handler.handleTaskSync(new CorruptStreamException("t", "e", "First event is update"));

        assertThat(problem.getStatus()).isEqualTo(500);
        assertThat(problem.getDetail()).doesNotContain("First event");
        assertThat(problem.getProperties()).containsEntry("kind", "corrupt_stream");
    }

    @Test
    @DisplayName("handleGeneric — unexpected exceptions become a generic 500")
    void generic_is500() {
        ProblemDetail problem = handler.handleGeneric(new IllegalStateException("boom"));

        assertThat(problem.getStatus()).isEqualTo(500);
        assertThat(problem.getDetail()).isEqualTo("An unexpected error occurred");
        assertThat(problem.getProperties()).doesNotContainKey("correlationId");
    }
}
