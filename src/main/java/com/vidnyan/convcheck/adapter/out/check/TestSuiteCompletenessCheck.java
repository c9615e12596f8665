package com.vidnyan.convcheck.adapter.out.check;

import com.vidnyan.convcheck.adapter.out.scanner.ProjectScanner;
import com.vidnyan.convcheck.domain.check.ConventionCheck;
import com.vidnyan.convcheck.domain.check.ConventionViolationException;
import com.vidnyan.convcheck.domain.model.Project;
import com.vidnyan.convcheck.domain.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ensures a project with several test classes has exactly one tests suite
 * and that the suite references every test class.
 */
@Slf4j
@Component
@Order(30)
public class TestSuiteCompletenessCheck implements ConventionCheck {

    public static final String NAME = "validateTestsSuites";

    static final Pattern TEST_SUITE = Pattern.compile(".*TestsSuite\\.java");
    static final Pattern TEST_CLASS = Pattern.compile(".*Tests\\.java");
    static final Pattern EXCLUDED_TEST_CLASS = Pattern.compile(".*(Base|Abstract).*Tests\\.java");

    private final ProjectScanner projectScanner;
    private final PrintStream console;

    @Autowired
    public TestSuiteCompletenessCheck(ProjectScanner projectScanner) {
        this(projectScanner, System.out);
    }

    TestSuiteCompletenessCheck(ProjectScanner projectScanner, PrintStream console) {
        this.projectScanner = projectScanner;
        this.console = console;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Ensure all projects contain a tests suite that contains test classes";
    }

    @Override
    public void check(Project project) throws IOException {
        Path testSources = project.testJava();
        if (!Files.isDirectory(testSources)) {
            log.debug("{}: no {}", project, Project.TEST_JAVA);
            return;
        }

        List<Path> suites = projectScanner.findFiles(testSources, name -> TEST_SUITE.matcher(name).find());
        List<Path> testClasses = projectScanner.findFiles(testSources, TestSuiteCompletenessCheck::isTestClass);
        log.debug("{}: {} test suites, {} test classes", project, suites.size(), testClasses.size());

        if (testClasses.size() > 1 && suites.isEmpty()) {
            throw ConventionViolationException.missingTestSuite(project.displayName(),
                    testClasses.stream().map(p -> p.getFileName().toString()).toList());
        }
        if (suites.size() > 1) {
            throw ConventionViolationException.ambiguousTestSuite(project.displayName(),
                    suites.stream().map(p -> p.getFileName().toString()).toList());
        }
        if (suites.isEmpty()) {
            return;
        }

        SourceFile suite = SourceFile.read(suites.get(0));
        List<String> missing = testClasses.stream()
                .map(TestSuiteCompletenessCheck::compiledUnitName)
                .filter(reference -> !suite.contains(reference))
                .distinct()
                .sorted()
                .toList();

        if (!missing.isEmpty()) {
            console.println(suite.fileName() + " of " + project.displayName() + " does not include:");
            console.println(String.join(", ", missing));
            throw ConventionViolationException.incompleteTestSuite(project.displayName(), suite.fileName(), missing);
        }
    }

    static boolean isTestClass(String fileName) {
        return TEST_CLASS.matcher(fileName).find() && !EXCLUDED_TEST_CLASS.matcher(fileName).find();
    }

    static String compiledUnitName(Path testClass) {
        return testClass.getFileName().toString().replace(".java", ".class");
    }
}
