package com.example.roledocs.service;

import com.example.roledocs.metrics.ParserMetrics;
import com.example.roledocs.model.RepoType;
import com.example.roledocs.model.RoleDocumentation;
import com.example.roledocs.model.RoleInfo;
import com.example.roledocs.service.parser.DefaultsParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RoleDocsServiceTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private RoleRepositoryResolver resolver;
    private RoleDataBuilder dataBuilder;
    private RoleDocumentGenerator generator;
    private RoleDocsService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        resolver = mock(RoleRepositoryResolver.class);
        dataBuilder = mock(RoleDataBuilder.class);
        generator = mock(RoleDocumentGenerator.class);
        service = new RoleDocsService(new DefaultsParser(), resolver, dataBuilder, generator,
                new ParserMetrics(registry));
    }

    @Test
    void shouldRecordMetricsForParsedDocument() {
        // When
        RoleInfo role = service.parse("a_x: 1\na_y: 2\n", "a", RepoType.SALTBOX);

        // Then
        assertEquals(2, role.getAllVariables().size());
        assertEquals(1.0, registry.get("roledocs.documents.parsed.total").counter().count());
        assertEquals(2.0, registry.get("roledocs.variables.count").gauge().value());
        assertEquals(1L, registry.get("roledocs.parse.duration").timer().count());
    }

    @Test
    void shouldResolveDefaultsFromRepositoryWhenPathMissing() throws Exception {
        // Given
        Path defaults = tempDir.resolve("main.yml");
        Files.writeString(defaults, "plex_name: plex\n");
        when(resolver.resolveDefaults("plex", RepoType.SALTBOX)).thenReturn(defaults);

        // When
        RoleInfo role = service.parseRole("plex", RepoType.SALTBOX, null);

        // Then
        assertEquals("plex_name", role.getAllVariables().get(0).getName());
        verify(resolver).resolveDefaults("plex", RepoType.SALTBOX);
    }

    @Test
    void shouldUseExplicitDefaultsFile() throws Exception {
        Path defaults = tempDir.resolve("custom.yml");
        Files.writeString(defaults, "plex_name: plex\n");

        service.parseRole("plex", RepoType.SANDBOX, defaults);

        verifyNoInteractions(resolver);
    }

    @Test
    void shouldCountFailedReads() {
        // Given
        Path missing = tempDir.resolve("missing.yml");

        // When & Then
        assertThrows(UncheckedIOException.class, () -> service.parseRole("plex", RepoType.SALTBOX, missing));
        assertEquals(1.0, registry.get("roledocs.documents.failed.total").counter().count());
    }

    @Test
    void shouldSaveToExplicitOutputFile() {
        // Given
        RoleInfo role = service.parse("plex_name: plex\n", "plex", RepoType.SALTBOX);
        RoleDocumentation doc = RoleDocumentation.builder().roleName("plex").build();
        Path output = tempDir.resolve("out.md");
        when(dataBuilder.build(role)).thenReturn(doc);
        when(generator.generate(doc)).thenReturn("# plex");
        when(generator.save("# plex", output)).thenReturn(output);

        // When
        Path saved = service.generateAndSave(role, output);

        // Then
        assertEquals(output, saved);
        verify(generator, never()).generateAndSave(any());
    }

    @Test
    void shouldSaveToConfiguredDirectoryByDefault() {
        RoleInfo role = service.parse("plex_name: plex\n", "plex", RepoType.SALTBOX);
        RoleDocumentation doc = RoleDocumentation.builder().roleName("plex").build();
        when(dataBuilder.build(role)).thenReturn(doc);
        when(generator.generateAndSave(doc)).thenReturn(tempDir.resolve("plex_VARIABLES.md"));

        assertEquals(tempDir.resolve("plex_VARIABLES.md"), service.generateAndSave(role, null));
    }
}
