package com.vidnyan.convcheck.application.port.out;

import com.vidnyan.convcheck.application.port.in.RunChecksUseCase.RunResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for persisting the results of a check run.
 */
public interface ReportWriter {

    void write(RunResult result, Path target) throws IOException;
}
