package com.example.roledocs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Репозиторий, из которого взята роль.
 */
public enum RepoType {
    SALTBOX,
    SANDBOX;

    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RepoType fromTag(String tag) {
        if (tag != null) {
            for (RepoType type : values()) {
                if (type.getTag().equalsIgnoreCase(tag.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown repository type: " + tag);
    }
}
