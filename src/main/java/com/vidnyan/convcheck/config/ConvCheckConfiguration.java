package com.vidnyan.convcheck.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.convcheck.application.port.out.SelfInvocationDetector;
import com.vidnyan.convcheck.domain.check.ConventionCheck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for convcheck components.
 */
@Slf4j
@Configuration(value = "convCheckConfiguration", proxyBeanMethods = false)
public class ConvCheckConfiguration {

    /**
     * ObjectMapper for the JSON report.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available checks on startup.
     */
    @Bean
    public String logConventionChecks(List<ConventionCheck> checks, SelfInvocationDetector detector) {
        log.info("Registered {} convention checks:", checks.size());
        checks.forEach(c -> log.info("  - {}: {}", c.name(), c.description()));
        log.info("Self-invocation detector: {}", detector.getName());
        return "checks-logged";
    }
}
