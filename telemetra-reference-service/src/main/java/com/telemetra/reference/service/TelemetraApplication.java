package com.telemetra.reference.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Runnable ingestion and query gateway: REST controllers, JDBC storage and the background job
 * pool in one process. Scheduling drives the pending/stale job sweep.
 */
@EnableScheduling
@SpringBootApplication(scanBasePackages = {"com.telemetra"})
public class TelemetraApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetraApplication.class, args);
    }
}
