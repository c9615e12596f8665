package com.vidnyan.convcheck.adapter.out.scanner;

import com.vidnyan.convcheck.domain.model.Project;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Scans project trees.
 * Resolves project directories and finds files by name.
 */
@Slf4j
@Component
public class ProjectScanner {

    private static final List<String> BUILD_FILES = List.of("pom.xml", "build.gradle", "build.gradle.kts");
    private static final Set<String> IGNORED_DIRECTORIES = Set.of("target", "build", "out", "node_modules");

    /**
     * Find regular files below root whose file name is accepted by the filter.
     * Results are sorted by path. A missing root yields no files.
     */
    public List<Path> findFiles(Path root, Predicate<String> fileNameFilter) throws IOException {
        return findFiles(root, fileNameFilter, List.of());
    }

    /**
     * Same as {@link #findFiles(Path, Predicate)}, skipping anything under the excluded directories.
     */
    public List<Path> findFiles(Path root, Predicate<String> fileNameFilter, Collection<Path> excluded)
            throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> excluded.stream().noneMatch(p::startsWith))
                    .filter(p -> fileNameFilter.test(p.getFileName().toString()))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Turn the configured directories into projects.
     * With discovery on, nested directories holding a build file become projects too.
     */
    public List<Project> resolveProjects(List<Path> directories, boolean discoverSubprojects) throws IOException {
        Map<Path, Project> projects = new LinkedHashMap<>();
        for (Path directory : directories) {
            if (!Files.isDirectory(directory)) {
                throw new IOException("Project directory does not exist: " + directory);
            }
            Project project = Project.at(directory);
            projects.putIfAbsent(project.root(), project);

            if (discoverSubprojects) {
                for (Path nested : discoverSubprojectRoots(project.root())) {
                    Project sub = Project.at(nested);
                    projects.putIfAbsent(sub.root(), sub);
                }
            }
        }
        log.debug("Resolved {} projects from {}", projects.size(), directories);
        return attachNestedProjects(List.copyOf(projects.values()));
    }

    private static List<Project> attachNestedProjects(List<Project> projects) {
        List<Project> attached = new ArrayList<>(projects.size());
        for (Project parent : projects) {
            List<Path> nested = projects.stream()
                    .map(Project::root)
                    .filter(root -> !root.equals(parent.root()) && root.startsWith(parent.root()))
                    .sorted()
                    .toList();
            attached.add(nested.isEmpty() ? parent : parent.withNestedProjects(nested));
        }
        return List.copyOf(attached);
    }

    private List<Path> discoverSubprojectRoots(Path root) throws IOException {
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || IGNORED_DIRECTORIES.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (BUILD_FILES.stream().anyMatch(f -> Files.isRegularFile(dir.resolve(f)))) {
                    found.add(dir);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        found.sort(null);
        return found;
    }
}
