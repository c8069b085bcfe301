package com.example.roledocs.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Результат разбора defaults-файла одной роли.
 */
@Value
@Builder
public class RoleInfo {
    /**
     * Имя роли (например: plex)
     */
    String name;

    /**
     * Репозиторий роли
     */
    RepoType repoType;

    /**
     * Имя секции -> секция
     */
    Map<String, Section> sections;

    /**
     * Имена секций в порядке появления
     */
    List<String> sectionOrder;

    /**
     * Все переменные документа в порядке объявления
     */
    List<Variable> allVariables;

    /**
     * Поддерживает ли роль несколько инстансов (есть переменная *_instances)
     */
    boolean hasInstances;

    /**
     * Имя переменной со списком инстансов
     */
    String instancesVar;

    /**
     * Есть ли пары *_default / *_custom
     */
    boolean hasDefaultVars;

    /**
     * Включён ли SSO по умолчанию
     */
    boolean ssoEnabled;

    boolean hasDns;

    boolean hasTraefik;

    boolean hasDocker;

    boolean hasWeb;

    /**
     * Есть ли переменные ThemePark
     */
    boolean hasThemePark;

    public Section getSection(String sectionName) {
        return sections.get(sectionName);
    }
}
