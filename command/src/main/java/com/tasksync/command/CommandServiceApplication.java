package com.tasksync.command;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Task Command Service: Entry Point
 *
 * Write side: commands, event store, outbox relay, snapshots.
 *
 * Port: 8081 (see application.yml)
 */
@SpringBootApplication(scanBasePackages = {
        "com.tasksync.command",
        "com.tasksync.shared.kafka",
        "com.tasksync.shared.outbox",
        "com.tasksync.shared.web",
        "com.tasksync.shared.security"
})
@EnableKafka
@EntityScan(basePackages = {"com.tasksync.command", "com.tasksync.shared.outbox"})
@EnableJpaRepositories(basePackages = {"com.tasksync.command", "com.tasksync.shared.outbox"})
public class CommandServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CommandServiceApplication.class, args);
    }
}
