package com.vidnyan.convcheck.domain.check;

/**
 * Conventions a project can break. Every violation aborts the current check.
 */
public enum ViolationType {
    MISSING_REGISTERED_CLASS("Spring configuration class does not exist"),
    MISSING_PROXY_DECLARATION("Configuration class should be marked with proxyBeanMethods = false"),
    MISSING_TEST_SUITE("Project is missing a TestsSuite class"),
    AMBIGUOUS_TEST_SUITE("Project has more than one TestsSuite"),
    INCOMPLETE_TEST_SUITE("TestsSuite does not include every test class");

    private final String rule;

    ViolationType(String rule) {
        this.rule = rule;
    }

    public String rule() {
        return rule;
    }
}
