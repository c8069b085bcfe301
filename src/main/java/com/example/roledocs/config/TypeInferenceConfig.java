package com.example.roledocs.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Правила определения типов переменных, заданные оператором.
 *
 * Таблицы суффиксов заданы списками, а не словарями: при биндинге ключей Map
 * Spring удаляет символ '_', а порядок проверки правил важен.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "type-inference")
public class TypeInferenceConfig {

    /**
     * Точные суффиксы имени, проверяются первыми
     */
    private List<SuffixRule> exact = new ArrayList<>();

    /**
     * Переопределения по суффиксу, проверяются после exact
     */
    private List<SuffixRule> overrides = new ArrayList<>();

    /**
     * Подстроки имени, проверяются после анализа значения
     */
    private List<PatternRule> patterns = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SuffixRule {
        private String suffix;
        private String type;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatternRule {
        private String suffixContains;
        private String type;
    }
}
