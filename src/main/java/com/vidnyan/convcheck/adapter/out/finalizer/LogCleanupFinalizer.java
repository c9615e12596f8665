package com.vidnyan.convcheck.adapter.out.finalizer;

import com.vidnyan.convcheck.adapter.out.scanner.ProjectScanner;
import com.vidnyan.convcheck.application.port.out.BuildFinalizer;
import com.vidnyan.convcheck.domain.model.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Deletes build log files left in project trees.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "convcheck.clean-logs", havingValue = "true", matchIfMissing = true)
public class LogCleanupFinalizer implements BuildFinalizer {

    static final List<String> LOG_SUFFIXES = List.of(".log", ".gz", ".orig");

    private final ProjectScanner projectScanner;

    @Override
    public void finish(List<Project> projects) {
        int deleted = 0;
        for (Project project : projects) {
            try {
                for (Path file : projectScanner.findFiles(
                        project.root(), LogCleanupFinalizer::isLogFile, project.nestedProjects())) {
                    if (delete(file)) {
                        deleted++;
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to scan {} for log files: {}", project, e.getMessage());
            }
        }
        log.info("Cleaned {} log files", deleted);
    }

    static boolean isLogFile(String fileName) {
        return LOG_SUFFIXES.stream().anyMatch(fileName::endsWith);
    }

    private boolean delete(Path file) {
        try {
            log.debug("Deleting {}", file);
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
            return false;
        }
    }
}
