package com.vidnyan.convcheck.adapter.out.check;

import com.vidnyan.convcheck.domain.check.ConventionCheck;
import com.vidnyan.convcheck.domain.check.ConventionViolationException;
import com.vidnyan.convcheck.domain.model.Project;
import com.vidnyan.convcheck.domain.model.SpringFactories;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that every class registered in {@code META-INF/spring.factories}
 * exists as a source file under {@code src/main/java}.
 */
@Slf4j
@Component
@Order(10)
public class ConfigFactoryCheck implements ConventionCheck {

    public static final String NAME = "verifySpringConfigurationFactories";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Examine spring.factories file and ensure @Configuration classes can be located";
    }

    @Override
    public void check(Project project) throws IOException {
        Path registrationFile = project.springFactories();
        if (!Files.exists(registrationFile)) {
            log.debug("{}: no {}", project, Project.SPRING_FACTORIES);
            return;
        }

        SpringFactories factories = SpringFactories.load(registrationFile);
        List<String> missing = new ArrayList<>();
        for (String className : factories.allClassNames()) {
            Path sourceFile = sourceFileOf(project, className);
            if (!Files.exists(sourceFile)) {
                missing.add(sourceFile.toString());
            }
        }
        log.debug("{}: {} registered classes, {} missing",
                project, factories.allClassNames().size(), missing.size());

        if (!missing.isEmpty()) {
            throw ConventionViolationException.missingRegisteredClasses(project.displayName(), missing);
        }
    }

    static Path sourceFileOf(Project project, String className) {
        Path path = project.mainJava();
        String[] segments = className.split("\\.");
        for (int i = 0; i < segments.length - 1; i++) {
            path = path.resolve(segments[i]);
        }
        return path.resolve(segments[segments.length - 1] + ".java");
    }
}
