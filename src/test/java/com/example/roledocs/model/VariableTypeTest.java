package com.example.roledocs.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariableTypeTest {

    @Test
    void shouldFormatTypeComments() {
        assertEquals("# Type: bool (true/false)", VariableType.BOOL.comment());
        assertEquals("# Type: string (\"true\"/\"false\")", VariableType.STRING_TRUE_FALSE.comment());
        assertEquals("# Type: string (quoted number)", VariableType.STRING_NUMBER.comment());
        assertEquals("# Type: string (\"http\"/\"https\")", VariableType.STRING_HTTP_HTTPS.comment());
        assertEquals("# Type: list", VariableType.LIST.comment());
        assertEquals("# Type: dict/omit", VariableType.DICT_OMIT.comment());
    }

    @Test
    void shouldExtractKeyword() {
        assertEquals("string", VariableType.STRING_NUMBER.keyword());
        assertEquals("string", VariableType.STRING_HTTP_HTTPS.keyword());
        assertEquals("bool", VariableType.BOOL.keyword());
        assertEquals("dict/omit", VariableType.DICT_OMIT.keyword());
    }

    @Test
    void shouldParseLabelsFromConfiguration() {
        assertEquals(VariableType.BOOL, VariableType.fromLabel("bool"));
        assertEquals(VariableType.BOOL, VariableType.fromLabel("bool (true/false)"));
        assertEquals(VariableType.BOOL, VariableType.fromLabel("Boolean"));
        assertEquals(VariableType.STRING_NUMBER, VariableType.fromLabel("string (number)"));
        assertEquals(VariableType.DICT_OMIT, VariableType.fromLabel("DICT_OMIT"));
        assertEquals(VariableType.INT, VariableType.fromLabel(" int "));
    }

    @Test
    void shouldRejectUnknownLabel() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> VariableType.fromLabel("tuple"));
        assertTrue(e.getMessage().contains("tuple"));
        assertThrows(IllegalArgumentException.class, () -> VariableType.fromLabel(" "));
    }

    @Test
    void shouldResolveRepoTypeByTag() {
        assertEquals(RepoType.SANDBOX, RepoType.fromTag("Sandbox"));
        assertEquals("saltbox", RepoType.SALTBOX.getTag());
        assertThrows(IllegalArgumentException.class, () -> RepoType.fromTag("community"));
    }
}
