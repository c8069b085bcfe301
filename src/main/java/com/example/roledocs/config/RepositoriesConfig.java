package com.example.roledocs.config;

import com.example.roledocs.service.docker.DockerVarScanner;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Пути к репозиториям с ролями.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "repositories")
public class RepositoriesConfig {
    /**
     * Корень репозитория saltbox
     */
    private String saltbox = "/srv/git/saltbox";

    /**
     * Корень репозитория sandbox
     */
    private String sandbox = "/srv/git/sandbox";

    /**
     * Роли, исключённые из документирования
     */
    private Blacklist blacklist = new Blacklist();

    /**
     * Инвентарь с глобальными переопределениями role_var.
     */
    public Path inventoryPath() {
        return Path.of(saltbox, "inventories", "group_vars", "all.yml");
    }

    /**
     * Каталог ресурсов с задачами docker.
     */
    public Path resourcesPath() {
        return Path.of(saltbox, "resources");
    }

    /**
     * Сканер docker_var для каталога ресурсов saltbox.
     */
    @Bean
    public DockerVarScanner dockerVarScanner() {
        return new DockerVarScanner(resourcesPath());
    }

    @Data
    public static class Blacklist {
        private List<String> saltbox = new ArrayList<>();
        private List<String> sandbox = new ArrayList<>();
    }
}
