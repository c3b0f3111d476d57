package com.purchasingpower.retrievalplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetrievalPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetrievalPlannerApplication.class, args);
    }
}
