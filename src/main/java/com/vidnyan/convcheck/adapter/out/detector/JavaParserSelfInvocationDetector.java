package com.vidnyan.convcheck.adapter.out.detector;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.vidnyan.convcheck.application.port.out.SelfInvocationDetector;
import com.vidnyan.convcheck.domain.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parse-tree detection of self-invocation.
 * Only unqualified or {@code this.}-qualified calls to public methods declared
 * by the same class count. Files that do not parse fall back to the text heuristic.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "convcheck.proxy.detector", havingValue = "javaparser")
public class JavaParserSelfInvocationDetector implements SelfInvocationDetector {

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    private final SelfInvocationDetector fallback = new RegexSelfInvocationDetector();

    @Override
    public Set<String> findSelfInvokedMethods(SourceFile configurationClass) {
        ParseResult<CompilationUnit> result = parser.parse(configurationClass.content());
        Optional<CompilationUnit> unit = result.getResult();
        if (!result.isSuccessful() || unit.isEmpty()) {
            log.warn("Failed to parse {}, using text heuristic: {}",
                    configurationClass.path(), result.getProblems());
            return fallback.findSelfInvokedMethods(configurationClass);
        }

        Set<String> selfInvoked = new LinkedHashSet<>();
        for (ClassOrInterfaceDeclaration type : unit.get().findAll(ClassOrInterfaceDeclaration.class)) {
            Set<String> publicMethods = type.getMethods().stream()
                    .filter(MethodDeclaration::isPublic)
                    .map(MethodDeclaration::getNameAsString)
                    .collect(Collectors.toSet());

            type.getMethods().forEach(method -> method.findAll(MethodCallExpr.class).stream()
                    .filter(call -> isOwnInstanceCall(call.getScope()))
                    .map(MethodCallExpr::getNameAsString)
                    .filter(publicMethods::contains)
                    .forEach(selfInvoked::add));
        }
        return selfInvoked;
    }

    private boolean isOwnInstanceCall(Optional<Expression> scope) {
        return scope.isEmpty() || scope.get().isThisExpr();
    }
}
