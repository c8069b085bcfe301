package com.example.roledocs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Настройки документирования дополнительных опций docker-контейнера.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "docker-overrides")
public class DockerOverridesConfig {

    /**
     * Суффиксы docker_var, которые не документируются (с префиксом _docker_ или без)
     */
    private List<String> ignoreSuffixes = new ArrayList<>();

    /**
     * Дополнительные типы опций поверх встроенной таблицы
     */
    private Types types = new Types();

    @Data
    public static class Types {
        private List<String> bool = new ArrayList<>();
        private List<String> integer = new ArrayList<>();
        private List<String> list = new ArrayList<>();
        private List<String> dict = new ArrayList<>();
    }
}
