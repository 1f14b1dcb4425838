package com.whereq.crucible;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Crucible.
 * This service schedules kernel test executions across a pool of container,
 * emulator and physical environments.
 */
@SpringBootApplication
@EnableScheduling
public class CrucibleApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrucibleApplication.class, args);
    }
}
