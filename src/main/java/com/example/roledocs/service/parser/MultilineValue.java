package com.example.roledocs.service.parser;

import lombok.Value;

import java.util.List;

/**
 * Значение переменной, собранное из строки объявления и строк продолжения.
 */
@Value
public class MultilineValue {
    /**
     * Строки значения; строки продолжения сохраняют исходные отступы
     */
    List<String> lines;

    /**
     * Индекс первой строки после значения
     */
    int nextLine;

    public String joined() {
        return String.join("\n", lines);
    }
}
