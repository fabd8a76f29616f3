package com.cloudcostbuddy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Multi-cloud cost aggregation and alerting engine.
 *
 * Normalizes AWS, Azure and GCP billing data into one view and evaluates
 * user alert rules against it on a schedule.
 */
@SpringBootApplication
@EnableScheduling
public class CostBuddyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostBuddyApplication.class, args);
    }
}
