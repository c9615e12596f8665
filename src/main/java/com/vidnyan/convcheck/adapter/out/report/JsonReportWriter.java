package com.vidnyan.convcheck.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.convcheck.application.port.in.RunChecksUseCase.RunResult;
import com.vidnyan.convcheck.application.port.out.ReportWriter;
import com.vidnyan.convcheck.domain.check.CheckResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes run results as a JSON document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(RunResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), toDto(result));
        log.info("Wrote report to {}", target);
    }

    private ReportDto toDto(RunResult result) {
        ReportDto dto = new ReportDto();
        dto.successful = result.isSuccessful();
        dto.projectsChecked = result.stats().projectsChecked();
        dto.checksRun = result.stats().checksRun();
        dto.failures = result.stats().failures();
        dto.durationMs = result.stats().totalDurationMs();
        dto.results = result.results().stream().map(this::toDto).toList();
        return dto;
    }

    private CheckResultDto toDto(CheckResult result) {
        CheckResultDto dto = new CheckResultDto();
        dto.check = result.checkName();
        dto.project = result.project();
        dto.status = result.status().name();
        dto.violation = result.violationType() != null ? result.violationType().name() : null;
        dto.offenders = result.offenders();
        dto.message = result.message();
        dto.durationMs = result.duration().toMillis();
        return dto;
    }

    // DTO classes for JSON serialization
    static class ReportDto {
        public boolean successful;
        public int projectsChecked;
        public int checksRun;
        public int failures;
        public long durationMs;
        public List<CheckResultDto> results;
    }

    static class CheckResultDto {
        public String check;
        public String project;
        public String status;
        public String violation;
        public List<String> offenders;
        public String message;
        public long durationMs;
    }
}
