package com.example.roledocs.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Глобальные переопределения, доступные через lookup('role_var', ...).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "global-overrides")
public class GlobalOverridesConfig {

    /**
     * Суффиксы, которые не попадают в документацию
     */
    private List<String> ignoreSuffixes = new ArrayList<>();

    /**
     * Описания известных переопределений
     */
    private List<OverrideVariable> variables = new ArrayList<>();

    public Optional<OverrideVariable> findVariable(String suffix) {
        return variables.stream()
                .filter(v -> suffix.equals(v.getSuffix()))
                .findFirst();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OverrideVariable {
        private String suffix;
        private String description;

        /**
         * Значение по умолчанию; null - не задано, "" - явно пустое
         */
        private String defaultValue;

        private String type;
        private String example;
    }
}
