package com.example.roledocs.service;

import com.example.roledocs.config.OutputConfig;
import com.example.roledocs.model.RepoType;
import com.example.roledocs.model.RoleDocumentation;
import com.example.roledocs.model.RoleDocumentation.DockerOption;
import com.example.roledocs.model.RoleDocumentation.GlobalOverride;
import com.example.roledocs.model.RoleDocumentation.SectionView;
import com.example.roledocs.model.RoleDocumentation.VariableView;
import com.example.roledocs.model.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoleDocumentGeneratorTest {

    private RoleDocumentGenerator generator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        OutputConfig outputConfig = new OutputConfig();
        outputConfig.getMarkdown().setPath(tempDir.toString());
        generator = new RoleDocumentGenerator(outputConfig);
    }

    @Test
    void shouldRenderSectionsWithTypeComments() {
        // When
        String markdown = generator.generate(plexDocumentation());

        // Then
        assertTrue(markdown.startsWith("# plex role variables\n"));
        assertTrue(markdown.contains("> - **Repository:** saltbox"));
        assertTrue(markdown.contains("> - **Variables:** 2"));
        assertTrue(markdown.contains("## Web\n"));
        assertTrue(markdown.contains("# Subdomain for the web interface\n"
                + "# Type: string\n"
                + "plex_role_web_subdomain: \"{{ plex_name }}\"\n"));
    }

    @Test
    void shouldRenderInstanceVariablesWithAdjustedIndent() {
        String markdown = generator.generate(plexDocumentation());

        assertTrue(markdown.contains("Instance-level (`plex2`):"));
        assertTrue(markdown.contains("plex2_web_subdomain: \"{{ plex_name }}\"\n"));
        assertTrue(markdown.contains("plex2_docker_envs: \"{{ a\n"
                + "                       | combine(b) }}\"\n"));
    }

    @Test
    void shouldRenderGlobalOverridesAndDockerOptions() {
        String markdown = generator.generate(plexDocumentation());

        assertTrue(markdown.contains("## Global Override Options"));
        assertTrue(markdown.contains("# Domain for plex\n"
                + "# Type: string\n"
                + "plex_role_web_domain: \"\"\n"));
        assertTrue(markdown.contains("# Type: bool (true/false)\nplex_role_autoheal_enabled:\n"));
        assertTrue(markdown.contains("### Resource Limits"));
        assertTrue(markdown.contains("# Type: int\nplex_role_docker_cpu_shares:\n"));
    }

    @Test
    void shouldRenderExampleForRoleWithoutInstances() {
        // Given
        RoleDocumentation doc = RoleDocumentation.builder()
                .roleName("demo")
                .repoType(RepoType.SANDBOX)
                .instanceName("demo2")
                .exampleVar("demo_role_web_enabled")
                .exampleValue("true")
                .sections(List.of(SectionView.builder()
                        .name("Basics")
                        .variables(List.of(view("demo_role_web_enabled", "demo2_web_enabled", VariableType.BOOL,
                                "", List.of("true"))))
                        .build()))
                .build();

        // When
        String markdown = generator.generate(doc);

        // Then
        assertTrue(markdown.contains("```yaml\ndemo_role_web_enabled: true\n```"));
        assertFalse(markdown.contains("Instance-level"));
        assertFalse(markdown.contains("## Global Override Options"));
    }

    @Test
    void shouldFormatOverrideDefaults() {
        assertEquals("\"\"", RoleDocumentGenerator.formatOverrideDefault("", VariableType.STRING));
        assertEquals("\"bridge\"", RoleDocumentGenerator.formatOverrideDefault("bridge", VariableType.STRING));
        assertEquals("'x'", RoleDocumentGenerator.formatOverrideDefault("'x'", VariableType.STRING_NUMBER));
        assertEquals("\"80\"", RoleDocumentGenerator.formatOverrideDefault("\"80\"", VariableType.STRING_NUMBER));
        assertEquals("true", RoleDocumentGenerator.formatOverrideDefault("true", VariableType.BOOL));
        assertEquals("[]", RoleDocumentGenerator.formatOverrideDefault("[]", VariableType.LIST));
    }

    @Test
    void shouldRebuildDefinitionLines() {
        VariableView block = view("plex_list", "plex2_list", VariableType.LIST, "", List.of("", "  - a"));

        assertEquals(List.of("plex_list:", "  - a"), RoleDocumentGenerator.renderLines(block));
    }

    @Test
    void shouldSaveToConfiguredDirectory() throws Exception {
        // When
        Path saved = generator.generateAndSave(plexDocumentation());

        // Then
        assertEquals(tempDir.resolve("plex_VARIABLES.md"), saved);
        assertTrue(Files.readString(saved).startsWith("# plex role variables"));
    }

    @Test
    void shouldSaveToExplicitFileCreatingDirectories() throws Exception {
        Path target = tempDir.resolve("docs").resolve("plex.md");

        Path saved = generator.save("# doc\n", target);

        assertEquals(target, saved);
        assertEquals("# doc\n", Files.readString(target));
    }

    private static RoleDocumentation plexDocumentation() {
        Map<String, GlobalOverride> overrides = new LinkedHashMap<>();
        overrides.put("_web_domain", GlobalOverride.builder()
                .suffix("_web_domain")
                .type(VariableType.STRING)
                .description("Domain for {role}")
                .defaultValue("")
                .hasDefault(true)
                .build());
        overrides.put("_autoheal_enabled", GlobalOverride.builder()
                .suffix("_autoheal_enabled")
                .type(VariableType.BOOL)
                .build());

        Map<String, List<DockerOption>> docker = new LinkedHashMap<>();
        docker.put("Resource Limits", List.of(new DockerOption("cpu_shares", VariableType.INT)));

        return RoleDocumentation.builder()
                .roleName("plex")
                .repoType(RepoType.SALTBOX)
                .hasInstances(true)
                .instancesVar("plex_instances")
                .instanceName("plex2")
                .sections(List.of(
                        SectionView.builder()
                                .name("Web")
                                .variables(List.of(view("plex_role_web_subdomain", "plex2_web_subdomain",
                                        VariableType.STRING, "Subdomain for the web interface",
                                        List.of("\"{{ plex_name }}\""))))
                                .build(),
                        SectionView.builder()
                                .name("Docker")
                                .variables(List.of(view("plex_role_docker_envs", "plex2_docker_envs",
                                        VariableType.DICT, "",
                                        List.of("\"{{ a", "                           | combine(b) }}\""))))
                                .build()))
                .globalOverrides(overrides)
                .dockerOptions(docker)
                .build();
    }

    private static VariableView view(String name, String instanceName, VariableType type,
                                     String comment, List<String> valueLines) {
        return VariableView.builder()
                .name(name)
                .instanceName(instanceName)
                .type(type)
                .comment(comment)
                .valueLines(valueLines)
                .rawValue(String.join("\n", valueLines))
                .multiline(valueLines.size() > 1)
                .lineNumber(1)
                .build();
    }
}
