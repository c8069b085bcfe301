package com.example.roledocs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация вывода документации.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "output")
public class OutputConfig {

    private MarkdownConfig markdown = new MarkdownConfig();

    @Data
    public static class MarkdownConfig {
        /**
         * Путь для сохранения Markdown файлов
         */
        private String path = "./output";

        /**
         * Суффикс имени файла, перед ним подставляется имя роли
         */
        private String defaultFilename = "VARIABLES.md";
    }
}
