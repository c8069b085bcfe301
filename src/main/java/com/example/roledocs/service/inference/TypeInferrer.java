package com.example.roledocs.service.inference;

import com.example.roledocs.config.TypeInferenceConfig;
import com.example.roledocs.model.VariableType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Определяет тип переменной по имени и исходному значению.
 *
 * Порядок проверок: exact из конфигурации, overrides из конфигурации, форма значения,
 * patterns из конфигурации, встроенные суффиксы имени. По умолчанию - string.
 */
@Slf4j
@Service
public class TypeInferrer {

    private static final Pattern BOOL_VALUE = Pattern.compile("^(true|false|yes|no)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INT_VALUE = Pattern.compile("^-?\\d+$");
    private static final Pattern FLOAT_VALUE = Pattern.compile("^-?\\d+\\.\\d+$");
    private static final Pattern FLOW_LIST = Pattern.compile("^\\[.*\\]$", Pattern.DOTALL);
    private static final Pattern FLOW_DICT = Pattern.compile("^\\{.*\\}$", Pattern.DOTALL);

    private static final String TEMPLATE_OPEN = "{{";

    /**
     * Суффиксы имён в порядке проверки; первое совпадение определяет тип.
     */
    private static final List<NameRule> NAME_RULES = List.of(
            new NameRule(VariableType.BOOL, "_enabled", "_proxy", "_insecure"),
            new NameRule(VariableType.STRING, "_domain", "_subdomain", "_url", "_path", "_location",
                    "_folder", "_name", "_container", "_image", "_tag", "_repo", "_record", "_zone",
                    "_token", "_theme"),
            new NameRule(VariableType.STRING_NUMBER, "_port", "_timeout"),
            new NameRule(VariableType.STRING_HTTP_HTTPS, "_scheme"),
            new NameRule(VariableType.LIST, "_list", "_ports", "_volumes", "_networks", "_labels",
                    "_devices", "_addons", "_instances"),
            new NameRule(VariableType.DICT, "_envs", "_dict", "_options")
    );

    private final List<ConfiguredRule> exactRules;
    private final List<ConfiguredRule> overrideRules;
    private final List<ConfiguredRule> patternRules;

    /**
     * @param config правила из конфигурации; null - только встроенные эвристики
     * @throws IllegalArgumentException если в конфигурации указан неизвестный тип
     */
    public TypeInferrer(@Nullable TypeInferenceConfig config) {
        this.exactRules = new ArrayList<>();
        this.overrideRules = new ArrayList<>();
        this.patternRules = new ArrayList<>();

        if (config != null) {
            config.getExact().forEach(rule -> exactRules.add(ConfiguredRule.of(rule.getSuffix(), rule.getType())));
            config.getOverrides().forEach(rule -> overrideRules.add(ConfiguredRule.of(rule.getSuffix(), rule.getType())));
            config.getPatterns().forEach(rule ->
                    patternRules.add(ConfiguredRule.of(rule.getSuffixContains(), rule.getType())));
            log.debug("Loaded type inference rules: {} exact, {} overrides, {} patterns",
                    exactRules.size(), overrideRules.size(), patternRules.size());
        }
    }

    /**
     * Определяет тип переменной.
     *
     * @param name  имя переменной
     * @param value исходное значение (строки продолжения через \n)
     * @return тип, никогда не null
     */
    public VariableType inferType(String name, String value) {
        for (ConfiguredRule rule : exactRules) {
            if (name.endsWith(rule.key)) {
                return rule.type;
            }
        }
        for (ConfiguredRule rule : overrideRules) {
            if (name.endsWith(rule.key)) {
                return rule.type;
            }
        }

        Optional<VariableType> fromValue = inferFromValue(value == null ? "" : value);
        if (fromValue.isPresent()) {
            return fromValue.get();
        }

        for (ConfiguredRule rule : patternRules) {
            if (name.contains(rule.key)) {
                return rule.type;
            }
        }

        return inferFromName(name);
    }

    /**
     * Тип по форме значения. Пусто, если значение не является литералом
     * (шаблонные выражения, голые строки): тогда решают правила по имени.
     */
    Optional<VariableType> inferFromValue(String value) {
        if (value.contains("\n")) {
            String[] lines = value.split("\n", -1);
            String firstLine = lines[0].strip();

            if (firstLine.isEmpty() && lines.length > 1) {
                String secondLine = lines[1].strip();
                if (secondLine.startsWith("-")) {
                    return Optional.of(VariableType.LIST);
                }
                if (secondLine.contains(":") && !secondLine.startsWith("#")) {
                    return Optional.of(VariableType.DICT);
                }
            }
            if (firstLine.startsWith("-")) {
                return Optional.of(VariableType.LIST);
            }
        }

        String trimmed = value.strip();

        if (trimmed.isEmpty() || trimmed.equals("~") || trimmed.equals("null")) {
            return Optional.of(VariableType.NULL);
        }
        if (trimmed.equals("\"\"") || trimmed.equals("''")) {
            return Optional.of(VariableType.STRING);
        }
        if (BOOL_VALUE.matcher(trimmed).matches()) {
            return Optional.of(VariableType.BOOL);
        }
        if (INT_VALUE.matcher(trimmed).matches()) {
            return Optional.of(VariableType.INT);
        }
        if (FLOAT_VALUE.matcher(trimmed).matches()) {
            return Optional.of(VariableType.FLOAT);
        }
        if (FLOW_LIST.matcher(trimmed).matches()) {
            return Optional.of(VariableType.LIST);
        }
        if (!trimmed.startsWith(TEMPLATE_OPEN) && FLOW_DICT.matcher(trimmed).matches()) {
            return Optional.of(VariableType.DICT);
        }
        if (trimmed.startsWith("-")) {
            return Optional.of(VariableType.LIST);
        }
        if (trimmed.contains(TEMPLATE_OPEN)) {
            return Optional.empty();
        }
        if (trimmed.startsWith("\"") || trimmed.startsWith("'")) {
            return Optional.of(VariableType.STRING);
        }
        return Optional.empty();
    }

    VariableType inferFromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (NameRule rule : NAME_RULES) {
            if (rule.matches(lower)) {
                return rule.type;
            }
        }
        return VariableType.STRING;
    }

    private static final class NameRule {
        private final VariableType type;
        private final List<String> suffixes;

        NameRule(VariableType type, String... suffixes) {
            this.type = type;
            this.suffixes = List.of(suffixes);
        }

        boolean matches(String lowerName) {
            return suffixes.stream().anyMatch(lowerName::endsWith);
        }
    }

    private static final class ConfiguredRule {
        private final String key;
        private final VariableType type;

        private ConfiguredRule(String key, VariableType type) {
            this.key = key;
            this.type = type;
        }

        static ConfiguredRule of(String key, String typeLabel) {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("Type inference rule without suffix for type " + typeLabel);
            }
            return new ConfiguredRule(key, VariableType.fromLabel(typeLabel));
        }
    }
}
