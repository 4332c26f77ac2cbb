package com.tasksync.projection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Task Projection Service: Entry Point
 *
 * Read side: consumes the task change-feed into the task_projections table and serves
 * list/get queries from it.
 *
 * Port: 8082 (see application.yml)
 */
@SpringBootApplication(scanBasePackages = {
        "com.tasksync.projection",
        "com.tasksync.shared.kafka",
        "com.tasksync.shared.web",
        "com.tasksync.shared.security"
})
@EnableKafka
public class ProjectionServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProjectionServiceApplication.class, args);
    }
}
