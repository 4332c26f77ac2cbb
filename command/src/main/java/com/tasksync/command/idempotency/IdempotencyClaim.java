package com.tasksync.command.idempotency;

import com.tasksync.command.domain.CommandResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Result of claiming an idempotency key. */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdempotencyClaim {

    public enum Status {
        /** First sighting: the caller owns the key and must complete or release it. */
        CLAIMED,
        /** Another request with the same key has not finished yet. */
        IN_PROGRESS,
        /** The command already ran; {@link #getResult()} holds its outcome. */
        COMPLETED
    }

    private final Status status;
    private final CommandResult result;

    public static IdempotencyClaim claimed() {
        return new IdempotencyClaim(Status.CLAIMED, null);
    }

    public static IdempotencyClaim inProgress() {
        return new IdempotencyClaim(Status.IN_PROGRESS, null);
    }

    public static IdempotencyClaim completed(CommandResult result) {
        return new IdempotencyClaim(Status.COMPLETED, result);
    }
}
