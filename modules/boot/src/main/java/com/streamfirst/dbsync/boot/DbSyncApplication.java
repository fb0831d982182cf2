package com.streamfirst.dbsync.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Runs the coordinator as a standalone process: opens the primary and replica files under the
 * configured data directory and keeps replicating and backing up until shut down.
 */
@SpringBootApplication
public class DbSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbSyncApplication.class, args);
    }
}
