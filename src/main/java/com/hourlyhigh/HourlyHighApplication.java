package com.hourlyhigh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HourlyHighApplication {

    private static final Logger log = LoggerFactory.getLogger(HourlyHighApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HourlyHighApplication.class, args);
        log.info("Hourly High Aggregation Service started.");
        log.info("Highs API:    GET http://localhost:8080/highs?category=5&from=<unix>&to=<unix>");
        log.info("Submit:       POST http://localhost:8080/trades?commit=true");
        log.info("Status:       GET http://localhost:8080/status");
        log.info("Health:       GET http://localhost:8080/actuator/health");
    }
}
