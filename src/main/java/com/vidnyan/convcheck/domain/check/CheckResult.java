package com.vidnyan.convcheck.domain.check;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of running one check against one project.
 */
public record CheckResult(
    String checkName,
    String project,
    CheckStatus status,
    ViolationType violationType,
    List<String> offenders,
    String message,
    Duration duration
) {

    public enum CheckStatus {
        PASSED,
        FAILED,
        ERROR
    }

    public static CheckResult passed(String checkName, String project, Duration duration) {
        return new CheckResult(checkName, project, CheckStatus.PASSED, null, List.of(), null, duration);
    }

    public static CheckResult failed(String checkName, ConventionViolationException violation, Duration duration) {
        return new CheckResult(checkName, violation.project(), CheckStatus.FAILED,
                violation.type(), violation.offenders(), violation.getMessage(), duration);
    }

    public static CheckResult error(String checkName, String project, String message, Duration duration) {
        return new CheckResult(checkName, project, CheckStatus.ERROR, null, List.of(), message, duration);
    }

    /**
     * A failed or errored check breaks the build.
     */
    public boolean isBroken() {
        return status == CheckStatus.FAILED || status == CheckStatus.ERROR;
    }
}
