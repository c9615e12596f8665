package com.vidnyan.convcheck.adapter.in.cli;

import com.vidnyan.convcheck.ConventionProperties;
import com.vidnyan.convcheck.adapter.out.scanner.ProjectScanner;
import com.vidnyan.convcheck.application.port.in.RunChecksUseCase;
import com.vidnyan.convcheck.application.port.in.RunChecksUseCase.RunRequest;
import com.vidnyan.convcheck.application.port.in.RunChecksUseCase.RunResult;
import com.vidnyan.convcheck.application.port.out.ReportWriter;
import com.vidnyan.convcheck.domain.check.CheckResult;
import com.vidnyan.convcheck.domain.model.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI runner for the convention checks.
 * Runs when convcheck.projects is set; the exit code is 0 only when every check passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConventionCheckCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RunChecksUseCase runChecksUseCase;
    private final ProjectScanner projectScanner;
    private final ReportWriter reportWriter;
    private final ConventionProperties properties;

    private int exitCode = 0;

    @Override
    public void run(String... args) throws Exception {
        if (properties.getProjects().isEmpty()) {
            log.info("No project specified. Set convcheck.projects property.");
            return;
        }

        List<Project> projects = projectScanner.resolveProjects(
                properties.getProjects().stream().map(Path::of).toList(),
                properties.isDiscoverSubprojects());

        RunResult result = runChecksUseCase.run(
                new RunRequest(projects, properties.getChecks(), properties.isFailFast()));
        printResults(result);

        if (properties.getReportFile() != null && !properties.getReportFile().isBlank()) {
            reportWriter.write(result, Path.of(properties.getReportFile()));
        }
        exitCode = result.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printResults(RunResult result) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CONVENTION CHECKS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Projects checked: {}", result.stats().projectsChecked());
        log.info(" Checks run:       {}", result.stats().checksRun());
        log.info(" Failures:         {}", result.stats().failures());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (result.isSuccessful()) {
            log.info(" All conventions hold.");
            return;
        }

        for (CheckResult broken : result.broken()) {
            log.error("");
            log.error(" {} [{}] {}", broken.status(), broken.checkName(), broken.project());
            if (broken.violationType() != null) {
                log.error(" Rule:    {}", broken.violationType().rule());
            }
            log.error(" Message: {}", broken.message());
        }
    }
}
