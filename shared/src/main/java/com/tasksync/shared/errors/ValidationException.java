package com.tasksync.shared.errors;

import java.util.List;

/** Malformed or out-of-bounds input. Never retried. */
public class ValidationException extends TaskSyncException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> violations) {
        super(ErrorKind.VALIDATION, String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
