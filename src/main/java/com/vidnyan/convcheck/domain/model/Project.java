package com.vidnyan.convcheck.domain.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A build-project unit with the conventional Maven/Gradle layout.
 * Immutable value object. {@code nestedProjects} are roots of other projects
 * below this one; their files belong to them, not to this project.
 */
public record Project(
    Path root,
    String displayName,
    List<Path> nestedProjects
) {

    public Project {
        nestedProjects = List.copyOf(nestedProjects);
    }

    public Project(Path root, String displayName) {
        this(root, displayName, List.of());
    }

    public static final String MAIN_JAVA = "src/main/java";
    public static final String MAIN_RESOURCES = "src/main/resources";
    public static final String TEST_JAVA = "src/test/java";
    public static final String SPRING_FACTORIES = "META-INF/spring.factories";

    /**
     * Create a project from a directory, canonicalizing its path.
     */
    public static Project at(Path directory) {
        try {
            Path canonical = directory.toRealPath();
            Path name = canonical.getFileName();
            return new Project(canonical, "project '" + (name != null ? name : canonical) + "'");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve project directory " + directory, e);
        }
    }

    public Project withNestedProjects(List<Path> nested) {
        return new Project(root, displayName, nested);
    }

    public Path mainJava() {
        return root.resolve(MAIN_JAVA);
    }

    public Path mainResources() {
        return root.resolve(MAIN_RESOURCES);
    }

    public Path testJava() {
        return root.resolve(TEST_JAVA);
    }

    public Path springFactories() {
        return mainResources().resolve(SPRING_FACTORIES);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
