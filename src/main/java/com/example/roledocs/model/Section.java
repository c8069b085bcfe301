package com.example.roledocs.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Секция defaults-файла, ограниченная строками из '#'.
 */
@Value
@Builder
public class Section {
    String name;

    /**
     * Переменные вне подсекций, в порядке объявления
     */
    List<Variable> variables;

    /**
     * Имя подсекции -> переменные подсекции
     */
    Map<String, List<Variable>> subsections;

    /**
     * Имена подсекций в порядке первого появления
     */
    List<String> subsectionOrder;
}
