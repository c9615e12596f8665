package com.vidnyan.convcheck.application.service;

import com.vidnyan.convcheck.application.port.in.RunChecksUseCase;
import com.vidnyan.convcheck.application.port.out.BuildFinalizer;
import com.vidnyan.convcheck.domain.check.CheckResult;
import com.vidnyan.convcheck.domain.check.ConventionCheck;
import com.vidnyan.convcheck.domain.check.ConventionViolationException;
import com.vidnyan.convcheck.domain.model.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the convention checks over each project and collects their outcomes.
 * Registered finalizers run once at the end of every run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConventionCheckService implements RunChecksUseCase {

    private final List<ConventionCheck> conventionChecks;
    private final List<BuildFinalizer> buildFinalizers;

    @Override
    public RunResult run(RunRequest request) {
        Instant startTime = Instant.now();
        List<CheckResult> results = new ArrayList<>();
        try {
            List<ConventionCheck> checks = selectChecks(request.checkNames());
            log.info("Running {} checks over {} projects", checks.size(), request.projects().size());
            runChecks(request, checks, results);
        } finally {
            finish(request.projects());
        }

        long failures = results.stream().filter(CheckResult::isBroken).count();
        long projectsChecked = results.stream().map(CheckResult::project).distinct().count();
        RunStats stats = new RunStats(
                (int) projectsChecked,
                results.size(),
                (int) failures,
                Duration.between(startTime, Instant.now()).toMillis()
        );
        log.info("Run complete: {} checks, {} failures in {}ms",
                stats.checksRun(), stats.failures(), stats.totalDurationMs());
        return new RunResult(List.copyOf(results), stats);
    }

    private void runChecks(RunRequest request, List<ConventionCheck> checks, List<CheckResult> results) {
        for (Project project : request.projects()) {
            log.info("Checking {}", project);
            for (ConventionCheck check : checks) {
                CheckResult result = runCheck(check, project);
                results.add(result);
                if (result.isBroken() && request.failFast()) {
                    log.warn("Stopping after {} failed for {}", check.name(), project);
                    return;
                }
            }
        }
    }

    private CheckResult runCheck(ConventionCheck check, Project project) {
        Instant start = Instant.now();
        try {
            check.check(project);
            log.debug("  {} passed", check.name());
            return CheckResult.passed(check.name(), project.displayName(), Duration.between(start, Instant.now()));
        } catch (ConventionViolationException e) {
            log.warn("  {} failed: {}", check.name(), e.getMessage());
            return CheckResult.failed(check.name(), e, Duration.between(start, Instant.now()));
        } catch (IOException | UncheckedIOException e) {
            log.error("  {} could not read {}: {}", check.name(), project, e.getMessage());
            return CheckResult.error(check.name(), project.displayName(), e.getMessage(),
                    Duration.between(start, Instant.now()));
        }
    }

    private List<ConventionCheck> selectChecks(List<String> checkNames) {
        if (checkNames.isEmpty()) {
            return conventionChecks;
        }
        for (String name : checkNames) {
            if (conventionChecks.stream().noneMatch(c -> c.name().equals(name))) {
                throw new IllegalArgumentException("Unknown check: " + name);
            }
        }
        return conventionChecks.stream()
                .filter(c -> checkNames.contains(c.name()))
                .toList();
    }

    private void finish(List<Project> projects) {
        for (BuildFinalizer finalizer : buildFinalizers) {
            try {
                log.debug("Running finalizer {}", finalizer.getName());
                finalizer.finish(projects);
            } catch (RuntimeException e) {
                log.error("Finalizer {} failed", finalizer.getName(), e);
            }
        }
    }
}
