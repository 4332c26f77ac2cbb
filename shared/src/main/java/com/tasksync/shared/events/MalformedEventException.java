package com.tasksync.shared.events;

/**
 * A payload that cannot be turned into a {@link TaskEvent}, or an event that can never be
 * applied. Retrying does not help; consumers route it to the dead-letter channel.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
