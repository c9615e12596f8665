package com.vidnyan.convcheck.adapter.out.check;

import com.vidnyan.convcheck.adapter.out.detector.RegexSelfInvocationDetector;
import com.vidnyan.convcheck.adapter.out.scanner.ProjectScanner;
import com.vidnyan.convcheck.domain.check.ConventionViolationException;
import com.vidnyan.convcheck.domain.check.ViolationType;
import com.vidnyan.convcheck.domain.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BeanProxyDeclarationCheckTest {

    private static final String PLAIN_CONFIGURATION = """
            package com.example;

            @Configuration
            public class %s {

                @Bean
                public DataSource dataSource() {
                    return new DataSource();
                }

                @Bean
                public List<String> names() {
                    return List.of("a");
                }
            }
            """;

    @TempDir
    Path tempDir;

    private Project project;
    private BeanProxyDeclarationCheck check;

    @BeforeEach
    void setUp() {
        project = Project.at(tempDir);
        check = new BeanProxyDeclarationCheck(new ProjectScanner(), new RegexSelfInvocationDetector());
    }

    @Test
    void check_WithoutSelfInvocationOrDeclaration_ShouldFail() throws IOException {
        write("AppConfiguration.java", PLAIN_CONFIGURATION.formatted("AppConfiguration"));

        ConventionViolationException e = assertThrows(ConventionViolationException.class,
                () -> check.check(project));

        assertEquals(ViolationType.MISSING_PROXY_DECLARATION, e.type());
        assertEquals(List.of("AppConfiguration.java"), e.offenders());
        assertTrue(e.getMessage().contains("proxyBeanMethods = false"));
    }

    @Test
    void check_WithExplicitDeclaration_ShouldPass() throws IOException {
        write("AppConfiguration.java", PLAIN_CONFIGURATION.formatted("AppConfiguration")
                .replace("@Configuration\n",
                        "@Configuration(value = \"appConfiguration\", proxyBeanMethods = false)\n"));

        assertDoesNotThrow(() -> check.check(project));
    }

    @Test
    void check_WithSelfInvokedBeanMethod_ShouldPassWithoutDeclaration() throws IOException {
        write("RepositoryConfiguration.java", """
                @Configuration
                public class RepositoryConfiguration {

                    @Bean
                    public Repository repository() {
                        return new Repository(dataSource());
                    }

                    @Bean
                    public DataSource dataSource() {
                        return new DataSource();
                    }
                }
                """);

        assertDoesNotThrow(() -> check.check(project));
    }

    @Test
    void check_ShouldIgnoreFilesOutsideTheNamingConvention() throws IOException {
        write("AppConfig.java", PLAIN_CONFIGURATION.formatted("AppConfig"));
        write("SettingsConfiguration.java", "public class SettingsConfiguration { public String name() { return \"\"; } }");

        assertDoesNotThrow(() -> check.check(project));
    }

    @Test
    void check_ShouldReportEveryUndeclaredClass() throws IOException {
        write("AlphaConfiguration.java", PLAIN_CONFIGURATION.formatted("AlphaConfiguration"));
        write("nested/BetaConfiguration.java", PLAIN_CONFIGURATION.formatted("BetaConfiguration"));

        ConventionViolationException e = assertThrows(ConventionViolationException.class,
                () -> check.check(project));

        assertEquals(List.of("AlphaConfiguration.java", "BetaConfiguration.java"), e.offenders());
    }

    @Test
    void check_ShouldNotCarryMethodNamesAcrossFiles() throws IOException {
        // dataSource( appears twice in the first file only
        write("a/FirstConfiguration.java", """
                @Configuration
                public class FirstConfiguration {
                    public Repository repository() { return new Repository(dataSource()); }
                    public DataSource dataSource() { return new DataSource(); }
                }
                """);
        write("b/SecondConfiguration.java", """
                @Configuration
                public class SecondConfiguration {
                    public Cache cache() { return new Cache(); }
                }
                """);

        ConventionViolationException e = assertThrows(ConventionViolationException.class,
                () -> check.check(project));

        assertEquals(List.of("SecondConfiguration.java"), e.offenders());
    }

    @Test
    void check_WithLatin1EncodedFile_ShouldStillReadIt() throws IOException {
        Path file = project.mainJava().resolve("com/example/AppConfiguration.java");
        Files.createDirectories(file.getParent());
        Files.write(file, """
                // Beans für die Anwendung
                @Configuration(value = "appConfiguration", proxyBeanMethods = false)
                public class AppConfiguration {
                    public Clock clock() { return Clock.systemUTC(); }
                }
                """.getBytes(StandardCharsets.ISO_8859_1));

        assertDoesNotThrow(() -> check.check(project));
    }

    @Test
    void check_ShouldIgnoreFilesOfNestedProjects() throws IOException {
        Path child = tempDir.resolve("child");
        Path file = child.resolve("src/main/java/com/example/ChildConfiguration.java");
        Files.createDirectories(file.getParent());
        Files.writeString(file, PLAIN_CONFIGURATION.formatted("ChildConfiguration"));
        Project parent = project.withNestedProjects(List.of(child.toRealPath()));

        assertDoesNotThrow(() -> check.check(parent));
        assertThrows(ConventionViolationException.class, () -> check.check(project));
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = project.mainJava().resolve("com/example").resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
