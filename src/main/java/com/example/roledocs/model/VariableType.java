package com.example.roledocs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Категории типов значений переменных роли.
 */
public enum VariableType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    LIST("list"),
    DICT("dict"),

    /**
     * Словарь, который по умолчанию не передаётся (default={} или omit)
     */
    DICT_OMIT("dict/omit"),

    /**
     * Строка, принимающая только "true"/"false"
     */
    STRING_TRUE_FALSE("string (true/false)"),

    /**
     * Число, записанное строкой (порты, таймауты)
     */
    STRING_NUMBER("string (number)"),

    /**
     * Строка, принимающая только "http"/"https"
     */
    STRING_HTTP_HTTPS("string (http/https)"),

    /**
     * Пустое значение (~, null или ничего)
     */
    NULL("null");

    private final String label;

    VariableType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Комментарий с типом для вставки в документацию.
     */
    public String comment() {
        return switch (this) {
            case BOOL -> "# Type: bool (true/false)";
            case STRING_TRUE_FALSE -> "# Type: string (\"true\"/\"false\")";
            case STRING_NUMBER -> "# Type: string (quoted number)";
            case STRING_HTTP_HTTPS -> "# Type: string (\"http\"/\"https\")";
            default -> "# Type: " + label;
        };
    }

    /**
     * Ключевое слово типа без уточнений: "string (number)" -> "string".
     */
    public String keyword() {
        for (int i = 0; i < label.length(); i++) {
            char ch = label.charAt(i);
            if (ch == ' ' || ch == '(') {
                return label.substring(0, i);
            }
        }
        return label;
    }

    /**
     * Разбирает тип из конфигурации.
     *
     * @param label метка типа ("bool", "string (number)") или имя константы
     * @return тип
     * @throws IllegalArgumentException если метка неизвестна
     */
    public static VariableType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Type label must not be empty");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("bool (true/false)") || normalized.equals("boolean")) {
            return BOOL;
        }
        for (VariableType type : values()) {
            if (type.label.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
