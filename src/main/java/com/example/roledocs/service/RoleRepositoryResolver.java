package com.example.roledocs.service;

import com.example.roledocs.config.RepositoriesConfig;
import com.example.roledocs.model.RepoType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Определяет расположение defaults-файла роли в репозитории saltbox или sandbox.
 */
@Service
@RequiredArgsConstructor
public class RoleRepositoryResolver {

    private final RepositoriesConfig repositoriesConfig;

    public Path resolveDefaults(String roleName, RepoType repoType) {
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        if (isBlacklisted(roleName, repoType)) {
            throw new IllegalArgumentException("Role " + roleName + " is blacklisted in " + repoType.getTag());
        }

        Path defaults = repositoryRoot(repoType).resolve("roles").resolve(roleName)
                .resolve("defaults").resolve("main.yml");
        if (!Files.isRegularFile(defaults)) {
            throw new IllegalArgumentException("Defaults file not found: " + defaults);
        }
        return defaults;
    }

    public boolean isBlacklisted(String roleName, RepoType repoType) {
        List<String> blacklist = switch (repoType) {
            case SALTBOX -> repositoriesConfig.getBlacklist().getSaltbox();
            case SANDBOX -> repositoriesConfig.getBlacklist().getSandbox();
        };
        return blacklist != null && blacklist.contains(roleName);
    }

    public Path repositoryRoot(RepoType repoType) {
        return switch (repoType) {
            case SALTBOX -> Path.of(repositoriesConfig.getSaltbox());
            case SANDBOX -> Path.of(repositoriesConfig.getSandbox());
        };
    }
}
