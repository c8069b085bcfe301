package com.example.roledocs.service.parser;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Состояние разбора одного документа: курсор по строкам и текущий контекст.
 */
@Getter
@Setter
class ParserState {

    private final List<String> lines;
    private int cursor;

    private String currentSection = "";
    private String currentSubsection = "";
    private boolean inSubsection;

    /**
     * Комментарий, который будет привязан к следующей переменной
     */
    private String pendingComment = "";

    /**
     * Комментарии с префиксом [GLOBAL], общие для переменных подсекции
     */
    private String globalComment = "";

    ParserState(List<String> lines) {
        this.lines = lines;
    }

    boolean hasNext() {
        return cursor < lines.size();
    }

    String next() {
        return lines.get(cursor++);
    }

    String peek() {
        return lines.get(cursor);
    }

    void skip() {
        cursor++;
    }

    void enterSection(String sectionName) {
        currentSection = sectionName;
        currentSubsection = "";
        inSubsection = false;
        pendingComment = "";
        globalComment = "";
    }

    void enterSubsection(String subsectionName) {
        currentSubsection = subsectionName;
        inSubsection = true;
        pendingComment = "";
    }

    void leaveSubsection() {
        currentSubsection = "";
        inSubsection = false;
        pendingComment = "";
        globalComment = "";
    }

    void appendPendingComment(String text) {
        pendingComment = pendingComment.isEmpty() ? text : pendingComment + "\n" + text;
    }

    void appendGlobalComment(String text) {
        globalComment = globalComment.isEmpty() ? text : globalComment + "\n" + text;
    }
}
