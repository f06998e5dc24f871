package dev.pekelund.carereport.reportparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the care report service.
 */
@SpringBootApplication
public class ReportParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportParserApplication.class, args);
    }
}
