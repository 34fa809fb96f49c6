package com.agentverse.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Structural checks of the multi-module layout, run as part of the normal build.
 */
@DisplayName("Module Layout")
class ModuleLayoutTest {

    private static final List<String> MODULES = List.of(
            "libs/security", "libs/observability", "services/authz-service", "build-tools/verification");

    private static Path projectRoot;
    private static String rootPom;

    @BeforeAll
    static void resolveProjectRoot() throws IOException {
        // Surefire runs with the module directory as working directory.
        projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();
        assertThat(projectRoot.resolve("pom.xml"))
                .as("Root pom.xml must exist at project root: %s", projectRoot)
                .exists();
        rootPom = Files.readString(projectRoot.resolve("pom.xml"));
    }

    @Nested
    @DisplayName("Root POM")
    class RootPom {

        @Test
        @DisplayName("is a pom-packaged aggregator under com.agentverse")
        void coordinates() {
            assertThat(rootPom)
                    .contains("<groupId>com.agentverse</groupId>")
                    .contains("<artifactId>agentverse-authz-parent</artifactId>")
                    .contains("<packaging>pom</packaging>");
        }

        @Test
        @DisplayName("inherits the Spring Boot parent and targets Java 17")
        void parentAndRelease() {
            assertThat(rootPom)
                    .contains("spring-boot-starter-parent")
                    .contains("<maven.compiler.release>17</maven.compiler.release>");
        }

        @Test
        @DisplayName("declares every module")
        void modulesDeclared() {
            MODULES.forEach(module -> assertThat(rootPom).contains("<module>" + module + "</module>"));
        }

        @Test
        @DisplayName("declares no extra repositories")
        void mavenCentralOnly() {
            assertThat(rootPom).doesNotContain("<repositories>");
        }
    }

    @Nested
    @DisplayName("Modules")
    class Modules {

        @ParameterizedTest
        @ValueSource(strings = {"libs/security", "libs/observability", "services/authz-service",
                "build-tools/verification"})
        @DisplayName("each module has a pom inheriting the root")
        void modulePom(String module) throws IOException {
            Path pom = projectRoot.resolve(module).resolve("pom.xml");
            assertThat(pom).exists().isRegularFile();
            assertThat(Files.readString(pom)).contains("<artifactId>agentverse-authz-parent</artifactId>");
        }

        @ParameterizedTest
        @ValueSource(strings = {"libs/security", "libs/observability", "services/authz-service"})
        @DisplayName("library and service sources live under com/agentverse")
        void basePackage(String module) {
            assertThat(projectRoot.resolve(module).resolve("src/main/java/com/agentverse")).isDirectory();
            assertThat(projectRoot.resolve(module).resolve("src/test/java/com/agentverse")).isDirectory();
        }

        @Test
        @DisplayName("the service ships its configuration and logging setup")
        void serviceResources() {
            Path resources = projectRoot.resolve("services/authz-service/src/main/resources");
            assertThat(resources.resolve("application.yml")).isRegularFile();
            assertThat(resources.resolve("logback-spring.xml")).isRegularFile();
        }
    }

    @Test
    @DisplayName("the build is Maven only")
    void noOtherBuildTools() throws IOException {
        try (Stream<Path> files = Files.walk(projectRoot, 3)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.startsWith("build.gradle") || name.equals("BUILD.bazel")
                            || name.equals("build.xml"));
        }
    }
}
