package com.vidnyan.convcheck.domain.check;

import com.vidnyan.convcheck.domain.model.Project;

import java.io.IOException;

/**
 * A stateless convention check run once per project.
 * Passing is silent; a broken convention raises {@link ConventionViolationException}.
 */
public interface ConventionCheck {

    /**
     * Name used to select the check from configuration.
     */
    String name();

    String description();

    /**
     * Check the project's file tree.
     *
     * @throws ConventionViolationException when the project breaks the convention
     * @throws IOException when the project tree cannot be read
     */
    void check(Project project) throws IOException;
}
