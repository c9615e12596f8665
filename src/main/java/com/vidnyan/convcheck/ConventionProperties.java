package com.vidnyan.convcheck;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the convention checks.
 * Can be configured via application.properties or command-line arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "convcheck")
public class ConventionProperties {

    /**
     * Project directories to check. Nothing runs when empty.
     */
    private List<String> projects = new ArrayList<>();

    /**
     * Also check nested directories that hold a build file.
     */
    private boolean discoverSubprojects = false;

    /**
     * Names of the checks to run.
     * Default: all checks
     */
    private List<String> checks = new ArrayList<>();

    /**
     * Stop at the first failed check.
     */
    private boolean failFast = true;

    /**
     * Delete *.log, *.gz and *.orig files once the run ends.
     */
    private boolean cleanLogs = true;

    /**
     * Optional path of a JSON report.
     */
    private String reportFile;

    private Proxy proxy = new Proxy();

    @Data
    public static class Proxy {

        /**
         * Self-invocation detector: "regex" or "javaparser".
         */
        private String detector = "regex";
    }
}
