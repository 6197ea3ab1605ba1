package com.taskrelay.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskRelayApplication.class, args);
    }
}
