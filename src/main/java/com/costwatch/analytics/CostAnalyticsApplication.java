package com.costwatch.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnalyticsApplication.class, args);
    }
}
