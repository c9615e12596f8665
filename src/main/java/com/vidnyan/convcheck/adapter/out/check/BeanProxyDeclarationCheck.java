package com.vidnyan.convcheck.adapter.out.check;

import com.vidnyan.convcheck.adapter.out.scanner.ProjectScanner;
import com.vidnyan.convcheck.application.port.out.SelfInvocationDetector;
import com.vidnyan.convcheck.domain.check.ConventionCheck;
import com.vidnyan.convcheck.domain.check.ConventionViolationException;
import com.vidnyan.convcheck.domain.model.Project;
import com.vidnyan.convcheck.domain.model.SourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks {@code @Configuration} classes that never call their own bean methods
 * declare {@code proxyBeanMethods} explicitly.
 */
@Slf4j
@Component
@Order(20)
@RequiredArgsConstructor
public class BeanProxyDeclarationCheck implements ConventionCheck {

    public static final String NAME = "verifySpringConfigurationCanDisableBeanProxying";

    static final String FILE_SUFFIX = "Configuration.java";
    static final String CONFIGURATION_MARKER = "@Configuration";
    static final Pattern PROXY_DECLARATION = Pattern.compile(
            "@Configuration\\(value\\s*=\\s*\"(\\w+)\",\\s*proxyBeanMethods\\s*=\\s*(false|true)\\)");

    private final ProjectScanner projectScanner;
    private final SelfInvocationDetector selfInvocationDetector;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Examine @Configuration files and check whether proxying bean methods can be disabled";
    }

    @Override
    public void check(Project project) throws IOException {
        List<Path> candidates = projectScanner.findFiles(
                project.root(), name -> name.endsWith(FILE_SUFFIX), project.nestedProjects());
        List<String> undeclared = new ArrayList<>();

        for (Path path : candidates) {
            SourceFile file = SourceFile.read(path);
            if (!file.contains(CONFIGURATION_MARKER)) {
                continue;
            }
            Set<String> selfInvoked = selfInvocationDetector.findSelfInvokedMethods(file);
            if (!selfInvoked.isEmpty()) {
                log.debug("{} calls its own bean methods {}", file.fileName(), selfInvoked);
                continue;
            }
            // TODO: confirm with the build owners whether this should apply to self-invoking classes instead
            if (!PROXY_DECLARATION.matcher(file.content()).find()) {
                undeclared.add(file.fileName());
            }
        }
        log.debug("{}: {} configuration candidates, {} without proxy declaration",
                project, candidates.size(), undeclared.size());

        if (!undeclared.isEmpty()) {
            throw ConventionViolationException.missingProxyDeclaration(project.displayName(), undeclared);
        }
    }
}
