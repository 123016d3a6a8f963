package com.fraud.cohortanomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CohortAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CohortAnomalyApplication.class, args);
    }
}
