package com.example.roledocs.service;

import com.example.roledocs.config.RepositoriesConfig;
import com.example.roledocs.model.RepoType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleRepositoryResolverTest {

    @TempDir
    Path tempDir;

    private RepositoriesConfig config;
    private RoleRepositoryResolver resolver;

    @BeforeEach
    void setUp() {
        config = new RepositoriesConfig();
        config.setSaltbox(tempDir.resolve("saltbox").toString());
        config.setSandbox(tempDir.resolve("sandbox").toString());
        resolver = new RoleRepositoryResolver(config);
    }

    @Test
    void shouldResolveDefaultsFileInSandbox() throws Exception {
        // Given
        Path defaults = tempDir.resolve("sandbox/roles/jellyfin/defaults/main.yml");
        Files.createDirectories(defaults.getParent());
        Files.writeString(defaults, "jellyfin_name: jellyfin\n");

        // When
        Path resolved = resolver.resolveDefaults("jellyfin", RepoType.SANDBOX);

        // Then
        assertEquals(defaults, resolved);
    }

    @Test
    void shouldRejectMissingDefaultsFile() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> resolver.resolveDefaults("plex", RepoType.SALTBOX));

        assertTrue(e.getMessage().contains("Defaults file not found"));
    }

    @Test
    void shouldRejectBlacklistedRole() throws Exception {
        // Given
        Path defaults = tempDir.resolve("saltbox/roles/common/defaults/main.yml");
        Files.createDirectories(defaults.getParent());
        Files.writeString(defaults, "common_x: 1\n");
        config.getBlacklist().setSaltbox(List.of("common"));

        // When & Then
        assertTrue(resolver.isBlacklisted("common", RepoType.SALTBOX));
        assertFalse(resolver.isBlacklisted("common", RepoType.SANDBOX));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveDefaults("common", RepoType.SALTBOX));
    }

    @Test
    void shouldRejectBlankRoleName() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveDefaults(" ", RepoType.SALTBOX));
    }

    @Test
    void shouldDeriveSaltboxPaths() {
        assertEquals(tempDir.resolve("saltbox/inventories/group_vars/all.yml"), config.inventoryPath());
        assertEquals(tempDir.resolve("saltbox/resources"), config.resourcesPath());
    }
}
