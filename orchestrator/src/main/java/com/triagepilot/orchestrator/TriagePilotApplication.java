package com.triagepilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriagePilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriagePilotApplication.class, args);
    }
}
