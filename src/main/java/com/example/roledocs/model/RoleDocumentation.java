package com.example.roledocs.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Данные для генерации документации роли: типизированные переменные,
 * глобальные переопределения и дополнительные опции docker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleDocumentation {

    private String roleName;

    private RepoType repoType;

    private boolean hasInstances;

    private String instancesVar;

    /**
     * Имя инстанса для примеров (например: plex2)
     */
    private String instanceName;

    private boolean hasDefaultVars;

    @Builder.Default
    private List<SectionView> sections = new ArrayList<>();

    /**
     * Суффикс role_var -> описание переопределения
     */
    @Builder.Default
    private Map<String, GlobalOverride> globalOverrides = new LinkedHashMap<>();

    /**
     * Категория -> суффиксы опций docker, не объявленных ролью
     */
    @Builder.Default
    private Map<String, List<DockerOption>> dockerOptions = new LinkedHashMap<>();

    /**
     * Пример переменной для ролей без инстансов
     */
    private String exampleVar;

    private String exampleValue;

    public int getTotalVariables() {
        return sections.stream().mapToInt(SectionView::size).sum();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SectionView {
        private String name;

        @Builder.Default
        private List<VariableView> variables = new ArrayList<>();

        @Builder.Default
        private Map<String, List<VariableView>> subsections = new LinkedHashMap<>();

        public boolean hasContent() {
            return size() > 0;
        }

        public int size() {
            return variables.size() + subsections.values().stream().mapToInt(List::size).sum();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VariableView {
        private String name;
        private String rawValue;
        private VariableType type;
        private String comment;
        private boolean multiline;
        private List<String> valueLines;

        /**
         * Имя переменной для инстанса роли
         */
        private String instanceName;
        private int lineNumber;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GlobalOverride {
        private String suffix;
        private VariableType type;
        private String description;
        private String defaultValue;

        /**
         * Задано ли значение по умолчанию явно (в том числе пустое)
         */
        private boolean hasDefault;
        private String example;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DockerOption {
        private String suffix;
        private VariableType type;
    }
}
