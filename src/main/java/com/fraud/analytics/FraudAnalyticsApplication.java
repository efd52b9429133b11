package com.fraud.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class FraudAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudAnalyticsApplication.class, args);
    }
}
