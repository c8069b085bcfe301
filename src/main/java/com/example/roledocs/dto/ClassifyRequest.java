package com.example.roledocs.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Запрос на классификацию суффикса role_var.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {
    @NotBlank(message = "Suffix is required")
    private String suffix;

    /**
     * Строка, в которой встретился lookup (может быть пустой)
     */
    private String line;
}
