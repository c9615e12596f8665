package com.vidnyan.convcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * convcheck - repository convention checks for Spring projects.
 *
 * Validates spring.factories registrations, bean proxying declarations
 * and test suite completeness.
 */
@SpringBootApplication
public class ConvCheckApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ConvCheckApplication.class, args)));
    }
}
