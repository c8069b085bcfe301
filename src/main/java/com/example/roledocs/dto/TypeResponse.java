package com.example.roledocs.dto;

import com.example.roledocs.model.VariableType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Определённый тип с ключевым словом и комментарием для документации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeResponse {
    private VariableType type;
    private String keyword;
    private String comment;

    public static TypeResponse of(VariableType type) {
        return TypeResponse.builder()
                .type(type)
                .keyword(type.keyword())
                .comment(type.comment())
                .build();
    }
}
