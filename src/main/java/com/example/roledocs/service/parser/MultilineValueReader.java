package com.example.roledocs.service.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Собирает многострочные значения: блочные скаляры, flow-коллекции и переносы выражений.
 *
 * Отступы строк продолжения не меняются; пересчёт отступов при переименовании
 * переменной выполняет {@link VariableFilters#adjustMultilineIndent}.
 */
public final class MultilineValueReader {

    private static final Set<String> BLOCK_INDICATORS = Set.of("|", ">", "|-", ">-");

    private MultilineValueReader() {
    }

    /**
     * Читает значение переменной начиная со строки объявления.
     *
     * @param lines        все строки документа
     * @param definitionIndex индекс строки с "name: value"
     * @param initialValue часть строки объявления после двоеточия
     * @return строки значения и индекс следующей необработанной строки
     */
    public static MultilineValue read(List<String> lines, int definitionIndex, String initialValue) {
        List<String> valueLines = new ArrayList<>();
        valueLines.add(initialValue);

        String trimmedInitial = initialValue.strip();
        int next;
        if (trimmedInitial.isEmpty() || BLOCK_INDICATORS.contains(trimmedInitial)) {
            next = readBlockScalar(lines, definitionIndex + 1, valueLines);
        } else if (trimmedInitial.endsWith("[")) {
            next = readFlowCollection(lines, definitionIndex + 1, "]", valueLines);
        } else if (trimmedInitial.endsWith("{")) {
            next = readFlowCollection(lines, definitionIndex + 1, "}", valueLines);
        } else {
            next = readContinuation(lines, definitionIndex, valueLines);
        }
        return new MultilineValue(List.copyOf(valueLines), next);
    }

    private static int readBlockScalar(List<String> lines, int start, List<String> valueLines) {
        int current = start;
        while (current < lines.size()) {
            String line = lines.get(current);
            if (line.isEmpty()) {
                // пустая строка остаётся в блоке, только если блок продолжается после неё
                int nextNonEmpty = current + 1;
                while (nextNonEmpty < lines.size() && lines.get(nextNonEmpty).isEmpty()) {
                    nextNonEmpty++;
                }
                if (nextNonEmpty >= lines.size() || !startsWithWhitespace(lines.get(nextNonEmpty))) {
                    break;
                }
                valueLines.add(line);
                current++;
            } else if (startsWithWhitespace(line)) {
                valueLines.add(line);
                current++;
            } else {
                break;
            }
        }
        return current;
    }

    private static int readFlowCollection(List<String> lines, int start, String closer, List<String> valueLines) {
        int current = start;
        while (current < lines.size()) {
            String line = lines.get(current);
            String trimmed = line.strip();
            if (trimmed.isEmpty() || !startsWithWhitespace(line)) {
                break;
            }
            valueLines.add(line);
            current++;
            if (trimmed.endsWith(closer)) {
                break;
            }
        }
        return current;
    }

    private static int readContinuation(List<String> lines, int definitionIndex, List<String> valueLines) {
        String definitionLine = lines.get(definitionIndex);
        int current = definitionIndex + 1;
        while (current < lines.size()) {
            String line = lines.get(current);
            if (!startsWithWhitespace(line)) {
                break;
            }
            String trimmed = line.strip();
            if (trimmed.startsWith("#")) {
                break;
            }
            if (trimmed.contains(":") && !trimmed.startsWith("-")
                    && !trimmed.startsWith("\"") && !trimmed.startsWith("'")
                    && !isIndentedDeeper(line, definitionLine)) {
                // похоже на следующий ключ, а не на вложенную структуру
                break;
            }
            valueLines.add(line);
            current++;
        }
        return current;
    }

    private static boolean isIndentedDeeper(String line, String baseLine) {
        return indentOf(line) > indentOf(baseLine);
    }

    static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }

    private static boolean startsWithWhitespace(String line) {
        return !line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t');
    }
}
