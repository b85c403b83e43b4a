package com.samsung.ees.infra.api.remotedb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the remote device database query service.
 */
@SpringBootApplication
public class RemoteDbQueryApplication {
    public static void main(String[] args) {
        SpringApplication.run(RemoteDbQueryApplication.class, args);
    }
}
