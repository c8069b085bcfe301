package com.example.roledocs.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Запрос на определение типа переменной.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeInferenceRequest {
    /**
     * Имя переменной (например: plex_web_enabled)
     */
    @NotBlank(message = "Variable name is required")
    private String name;

    /**
     * Значение переменной в том виде, как оно записано в файле
     */
    @NotNull(message = "Variable value is required")
    private String value;
}
