package com.tasksync.command.config;

import com.tasksync.shared.domain.UnknownEventPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Command processing settings, bound from {@code tasksync.commands.*}:
 *
 * <pre>
 * tasksync:
 *   commands:
 *     max-attempts: 4
 *     initial-backoff: 50ms
 *     backoff-multiplier: 2.0
 *     randomization-factor: 0.5
 *     unknown-event-policy: skip
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "tasksync.commands")
public class CommandProperties {

    /** Load/decide/append cycles per command before a conflict is surfaced. */
    private int maxAttempts = 4;
    private Duration initialBackoff = Duration.ofMillis(50);
    private double backoffMultiplier = 2.0;
    /** Jitter: each delay is drawn from [d·(1-f), d·(1+f)]. */
    private double randomizationFactor = 0.5;
    private UnknownEventPolicy unknownEventPolicy = UnknownEventPolicy.SKIP;
}
