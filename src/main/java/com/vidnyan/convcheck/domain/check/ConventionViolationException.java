package com.vidnyan.convcheck.domain.check;

import java.util.List;

/**
 * Raised by a {@link ConventionCheck} when a project breaks a convention.
 * Carries the project, the violated rule and the offending entries.
 */
public class ConventionViolationException extends RuntimeException {

    private final ViolationType type;
    private final String project;
    private final List<String> offenders;

    public ConventionViolationException(ViolationType type, String project, List<String> offenders, String message) {
        super(message);
        this.type = type;
        this.project = project;
        this.offenders = List.copyOf(offenders);
    }

    public static ConventionViolationException missingRegisteredClasses(String project, List<String> paths) {
        return new ConventionViolationException(ViolationType.MISSING_REGISTERED_CLASS, project, paths,
                String.format("%s: Spring configuration class does not exist: %s",
                        project, String.join(", ", paths)));
    }

    public static ConventionViolationException missingProxyDeclaration(String project, List<String> fileNames) {
        return new ConventionViolationException(ViolationType.MISSING_PROXY_DECLARATION, project, fileNames,
                String.format("%s: Configuration class %s should be marked with proxyBeanMethods = false",
                        project, String.join(", ", fileNames)));
    }

    public static ConventionViolationException missingTestSuite(String project, List<String> testClasses) {
        return new ConventionViolationException(ViolationType.MISSING_TEST_SUITE, project, testClasses,
                String.format("Project %s is missing a TestsSuite class, while it contains %d tests: %s",
                        project, testClasses.size(), String.join(", ", testClasses)));
    }

    public static ConventionViolationException ambiguousTestSuite(String project, List<String> suites) {
        return new ConventionViolationException(ViolationType.AMBIGUOUS_TEST_SUITE, project, suites,
                String.format("Project %s has more than one TestsSuite: %s", project, String.join(", ", suites)));
    }

    public static ConventionViolationException incompleteTestSuite(String project, String suite, List<String> missing) {
        return new ConventionViolationException(ViolationType.INCOMPLETE_TEST_SUITE, project, missing,
                String.format("Found %d missing test class(es) in %s of %s: %s",
                        missing.size(), suite, project, String.join(", ", missing)));
    }

    public ViolationType type() {
        return type;
    }

    public String project() {
        return project;
    }

    public List<String> offenders() {
        return offenders;
    }
}
