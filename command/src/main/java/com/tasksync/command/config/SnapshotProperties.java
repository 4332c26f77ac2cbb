package com.tasksync.command.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "tasksync.snapshots")
public class SnapshotProperties {

    /** Events since the last snapshot that trigger a new one. */
    private int eventThreshold = 50;
    /** Age of the last snapshot that triggers a new one, provided events were appended since. */
    private Duration maxAge = Duration.ofDays(7);
    /** How long a superseded snapshot stays readable before it is purged. */
    private Duration expiryGrace = Duration.ofHours(1);
}
