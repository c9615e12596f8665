package com.vidnyan.convcheck.application.port.out;

import com.vidnyan.convcheck.domain.model.Project;

import java.util.List;

/**
 * Step that runs once at the end of every check run, whatever its outcome.
 */
public interface BuildFinalizer {

    void finish(List<Project> projects);

    default String getName() {
        return getClass().getSimpleName();
    }
}
