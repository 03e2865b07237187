package com.driftmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DriftMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftMonitorApplication.class, args);
    }
}
