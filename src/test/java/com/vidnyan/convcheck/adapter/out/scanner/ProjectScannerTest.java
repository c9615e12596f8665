package com.vidnyan.convcheck.adapter.out.scanner;

import com.vidnyan.convcheck.domain.model.Project;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectScannerTest {

    @TempDir
    Path tempDir;

    private final ProjectScanner scanner = new ProjectScanner();

    @Test
    void findFiles_ShouldMatchFileNamesRecursively() throws IOException {
        // Arrange
        Path pkg = tempDir.resolve("src/test/java/com/example");
        Files.createDirectories(pkg);
        Files.writeString(pkg.resolve("FooTests.java"), "class FooTests {}");
        Files.writeString(pkg.resolve("Helper.java"), "class Helper {}");
        Files.writeString(tempDir.resolve("BarTests.java"), "class BarTests {}");

        // Act
        List<Path> results = scanner.findFiles(tempDir, name -> name.endsWith("Tests.java"));

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.stream().anyMatch(p -> p.endsWith("FooTests.java")));
        assertTrue(results.stream().anyMatch(p -> p.endsWith("BarTests.java")));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("Helper.java")));
    }

    @Test
    void findFiles_WithMissingRoot_ShouldReturnEmpty() throws IOException {
        assertTrue(scanner.findFiles(tempDir.resolve("missing"), name -> true).isEmpty());
    }

    @Test
    void resolveProjects_ShouldDiscoverNestedBuilds() throws IOException {
        Files.writeString(tempDir.resolve("pom.xml"), "<project/>");
        Files.createDirectories(tempDir.resolve("service/src/main/java"));
        Files.writeString(tempDir.resolve("service/build.gradle"), "");
        Files.createDirectories(tempDir.resolve("target/classes"));
        Files.writeString(tempDir.resolve("target/classes/pom.xml"), "<project/>");
        Files.createDirectories(tempDir.resolve("docs"));

        List<Project> projects = scanner.resolveProjects(List.of(tempDir), true);

        assertEquals(2, projects.size());
        assertEquals(tempDir.toRealPath(), projects.get(0).root());
        assertEquals("project 'service'", projects.get(1).displayName());
        assertEquals(List.of(tempDir.toRealPath().resolve("service")), projects.get(0).nestedProjects());
        assertTrue(projects.get(1).nestedProjects().isEmpty());
    }

    @Test
    void findFiles_ShouldSkipExcludedDirectories() throws IOException {
        Path nested = tempDir.resolve("child");
        Files.createDirectories(nested);
        Files.writeString(tempDir.resolve("AppConfiguration.java"), "");
        Files.writeString(nested.resolve("ChildConfiguration.java"), "");

        List<Path> results = scanner.findFiles(tempDir, name -> name.endsWith("Configuration.java"), List.of(nested));

        assertEquals(List.of(tempDir.resolve("AppConfiguration.java")), results);
    }

    @Test
    void resolveProjects_WithoutDiscovery_ShouldKeepConfiguredDirectoriesOnly() throws IOException {
        Files.createDirectories(tempDir.resolve("service"));
        Files.writeString(tempDir.resolve("service/pom.xml"), "<project/>");

        List<Project> projects = scanner.resolveProjects(List.of(tempDir, tempDir), false);

        assertEquals(1, projects.size());
    }

    @Test
    void resolveProjects_WithMissingDirectory_ShouldFail() {
        assertThrows(IOException.class,
                () -> scanner.resolveProjects(List.of(tempDir.resolve("nope")), false));
    }
}
