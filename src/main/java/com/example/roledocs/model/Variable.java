package com.example.roledocs.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Переменная из defaults/main.yml роли.
 */
@Value
@Builder
public class Variable {
    /**
     * Имя переменной (например: plex_role_web_subdomain)
     */
    String name;

    /**
     * Значение в исходном виде, без "name:" и с исходными отступами строк продолжения
     */
    String rawValue;

    /**
     * Секция, в которой объявлена переменная ("" если до первой секции)
     */
    String section;

    /**
     * Подсекция ("" если переменная вне подсекции)
     */
    String subsection;

    /**
     * Комментарий, собранный из предшествующих строк
     */
    String comment;

    /**
     * Занимает ли значение несколько строк
     */
    boolean multiline;

    /**
     * Строки значения; первая строка - часть после двоеточия
     */
    List<String> valueLines;

    /**
     * Номер строки с объявлением (начиная с 1)
     */
    int lineNumber;
}
