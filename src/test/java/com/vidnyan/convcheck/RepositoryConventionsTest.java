package com.vidnyan.convcheck;

import com.vidnyan.convcheck.adapter.out.check.BeanProxyDeclarationCheck;
import com.vidnyan.convcheck.adapter.out.detector.RegexSelfInvocationDetector;
import com.vidnyan.convcheck.adapter.out.scanner.ProjectScanner;
import com.vidnyan.convcheck.domain.model.Project;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

/**
 * Runs the proxy declaration check against this repository's own sources.
 */
class RepositoryConventionsTest {

    private final Project self = Project.at(Path.of("."));

    @Test
    void ownConfigurationClasses_ShouldDeclareProxyBeanMethods() {
        BeanProxyDeclarationCheck check =
                new BeanProxyDeclarationCheck(new ProjectScanner(), new RegexSelfInvocationDetector());

        assertDoesNotThrow(() -> check.check(self));
    }
}
