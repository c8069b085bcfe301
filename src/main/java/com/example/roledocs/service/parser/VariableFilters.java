package com.example.roledocs.service.parser;

import com.example.roledocs.model.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Правила скрытия переменных и переименования для инстансов роли.
 */
public final class VariableFilters {

    private static final String DEFAULT_SUFFIX = "_default";
    private static final String CUSTOM_SUFFIX = "_custom";

    private VariableFilters() {
    }

    /**
     * Собирает базовые имена, у которых есть варианты _default или _custom.
     * Сама базовая переменная в документации не показывается.
     *
     * @param variables переменные роли
     * @return множество базовых имён
     */
    public static Set<String> buildHideBaseSet(List<Variable> variables) {
        Set<String> hideBase = new LinkedHashSet<>();
        for (Variable variable : variables) {
            String name = variable.getName();
            if (name.endsWith(DEFAULT_SUFFIX)) {
                hideBase.add(name.substring(0, name.length() - DEFAULT_SUFFIX.length()));
            }
            if (name.endsWith(CUSTOM_SUFFIX)) {
                hideBase.add(name.substring(0, name.length() - CUSTOM_SUFFIX.length()));
            }
        }
        return hideBase;
    }

    /**
     * Возвращает переменные без базовых имён пар _default/_custom.
     */
    public static List<Variable> filterVariables(List<Variable> variables) {
        Set<String> hideBase = buildHideBaseSet(variables);
        List<Variable> filtered = new ArrayList<>();
        for (Variable variable : variables) {
            if (!hideBase.contains(variable.getName())) {
                filtered.add(variable);
            }
        }
        return filtered;
    }

    /**
     * Переводит имя переменной роли в имя переменной инстанса.
     * plex_role_docker_envs -> plex2_docker_envs, plex_name -> plex2_name;
     * plex_instances не меняется.
     *
     * @param variableName имя переменной роли
     * @param roleName     имя роли
     * @param instanceName имя инстанса
     * @return имя для инстанса или исходное имя
     */
    public static String generateInstanceName(String variableName, String roleName, String instanceName) {
        String rolePrefix = roleName + "_role_";
        if (variableName.startsWith(rolePrefix)) {
            return instanceName + "_" + variableName.substring(rolePrefix.length());
        }

        String simplePrefix = roleName + "_";
        if (variableName.startsWith(simplePrefix)) {
            String suffix = variableName.substring(simplePrefix.length());
            if (suffix.equals("instances")) {
                return variableName;
            }
            return instanceName + "_" + suffix;
        }

        return variableName;
    }

    /**
     * Пересчитывает отступы строк продолжения после смены длины имени переменной.
     * В первой строке старое имя заменяется новым; отступ остальных непустых строк
     * сдвигается на разницу длин имён, но не становится отрицательным.
     *
     * @param lines        строки значения (первая строка может содержать имя)
     * @param originalName исходное имя
     * @param newName      новое имя
     * @return строки с новыми отступами
     */
    public static List<String> adjustMultilineIndent(List<String> lines, String originalName, String newName) {
        if (lines.size() <= 1) {
            return lines;
        }

        int diff = newName.length() - originalName.length();
        List<String> result = new ArrayList<>(lines.size());
        result.add(lines.get(0).replaceFirst(Pattern.quote(originalName),
                Matcher.quoteReplacement(newName)));

        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            int indent = MultilineValueReader.indentOf(line);
            if (diff == 0 || indent == line.length()) {
                result.add(line);
                continue;
            }
            int newIndent = Math.max(0, indent + diff);
            result.add(" ".repeat(newIndent) + line.substring(indent));
        }
        return result;
    }
}
