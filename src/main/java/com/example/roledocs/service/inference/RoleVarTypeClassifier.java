package com.example.roledocs.service.inference;

import com.example.roledocs.model.VariableType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Определяет тип глобального переопределения lookup('role_var', '_suffix', ...)
 * по суффиксу и тексту строки, в которой встретился вызов.
 */
@Component
public class RoleVarTypeClassifier {

    /**
     * lookup('role_var', '_suffix' ...); группа 1 - суффикс
     */
    public static final Pattern ROLE_VAR_LOOKUP =
            Pattern.compile("lookup\\s*\\(\\s*['\"]role_var['\"]\\s*,\\s*['\"]([^'\"]+)['\"]");

    private static final Pattern DEFAULT_QUOTED = Pattern.compile("default=['\"]");
    private static final Pattern DEFAULT_BOOL = Pattern.compile("default=(false|true)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFAULT_DICT_OR_OMIT = Pattern.compile("default=(\\{\\}|omit)");
    private static final Pattern DEFAULT_LIST = Pattern.compile("default=\\[\\]");

    /**
     * Определяет тип переопределения.
     *
     * @param suffix суффикс из вызова lookup
     * @param line   строка (или значение), где встретился вызов
     * @return тип, никогда не null
     */
    public VariableType classify(String suffix, String line) {
        switch (suffix) {
            case "_depends_on_healthchecks":
                return VariableType.STRING_TRUE_FALSE;
            case "_depends_on_delay":
                return VariableType.STRING_NUMBER;
            case "_depends_on":
                return VariableType.STRING;
            default:
                break;
        }

        if (suffix.contains("_scheme")) {
            return VariableType.STRING_HTTP_HTTPS;
        }
        if (suffix.contains("_enabled") || suffix.contains("_proxy")) {
            return VariableType.BOOL;
        }
        if (suffix.contains("_domain") || suffix.contains("_subdomain") || suffix.contains("_url")) {
            return VariableType.STRING;
        }
        if (suffix.contains("_port") || suffix.contains("_timeout")) {
            return VariableType.STRING_NUMBER;
        }

        if (line.contains("| bool")) {
            return VariableType.BOOL;
        }
        if (DEFAULT_QUOTED.matcher(line).find()) {
            return VariableType.STRING;
        }
        if (DEFAULT_BOOL.matcher(line).find()) {
            return VariableType.BOOL;
        }
        if (DEFAULT_DICT_OR_OMIT.matcher(line).find()) {
            return VariableType.DICT_OMIT;
        }
        if (DEFAULT_LIST.matcher(line).find()) {
            return VariableType.LIST;
        }
        return VariableType.STRING;
    }

    /**
     * Возвращает суффиксы всех вызовов role_var в значении, без повторов, в порядке появления.
     */
    public static List<String> extractLookups(String value) {
        Set<String> suffixes = new LinkedHashSet<>();
        Matcher matcher = ROLE_VAR_LOOKUP.matcher(value);
        while (matcher.find()) {
            suffixes.add(matcher.group(1));
        }
        return new ArrayList<>(suffixes);
    }
}
