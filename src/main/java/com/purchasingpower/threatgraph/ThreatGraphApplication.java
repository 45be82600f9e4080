package com.purchasingpower.threatgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThreatGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreatGraphApplication.class, args);
    }
}
