package dev.pekelund.medinterp.reportservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the report interpretation service.
 */
@SpringBootApplication
public class ReportInterpreterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportInterpreterApplication.class, args);
    }
}
