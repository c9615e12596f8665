package com.vidnyan.convcheck.application.port.in;

import com.vidnyan.convcheck.domain.check.CheckResult;
import com.vidnyan.convcheck.domain.model.Project;

import java.util.List;

/**
 * Primary use case: run the convention checks over a set of projects.
 */
public interface RunChecksUseCase {

    RunResult run(RunRequest request);

    /**
     * Run request parameters.
     */
    record RunRequest(
        List<Project> projects,
        List<String> checkNames,    // Empty = all checks
        boolean failFast
    ) {
        public static RunRequest forProjects(List<Project> projects) {
            return new RunRequest(projects, List.of(), true);
        }
    }

    /**
     * Run result.
     */
    record RunResult(
        List<CheckResult> results,
        RunStats stats
    ) {
        public boolean isSuccessful() {
            return results.stream().noneMatch(CheckResult::isBroken);
        }

        public List<CheckResult> broken() {
            return results.stream()
                    .filter(CheckResult::isBroken)
                    .toList();
        }

        public int exitCode() {
            return isSuccessful() ? 0 : 1;
        }
    }

    /**
     * Run statistics.
     */
    record RunStats(
        int projectsChecked,
        int checksRun,
        int failures,
        long totalDurationMs
    ) {}
}
