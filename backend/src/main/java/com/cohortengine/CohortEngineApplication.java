package com.cohortengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CohortEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CohortEngineApplication.class, args);
    }
}
