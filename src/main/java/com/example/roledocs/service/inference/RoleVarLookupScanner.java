package com.example.roledocs.service.inference;

import com.example.roledocs.model.VariableType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Ищет вызовы lookup('role_var', ...) во внешних файлах (инвентарь),
 * чтобы показать переопределения, которые роль сама не объявляет.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleVarLookupScanner {

    private final RoleVarTypeClassifier classifier;

    /**
     * Сканирует файл. Отсутствующий файл - пустой результат.
     *
     * @param file           путь к файлу
     * @param ignoreSuffixes суффиксы, которые нужно пропустить
     * @return суффикс -> тип, в порядке первого появления
     * @throws IOException если файл существует, но не читается
     */
    public Map<String, VariableType> scanFile(Path file, Collection<String> ignoreSuffixes) throws IOException {
        if (!Files.exists(file)) {
            log.debug("Lookup source not found, skipping: {}", file);
            return new LinkedHashMap<>();
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        Map<String, VariableType> lookups = scan(content, ignoreSuffixes);
        log.debug("Found {} role_var lookups in {}", lookups.size(), file);
        return lookups;
    }

    /**
     * Сканирует текст построчно. Для каждого суффикса сохраняется самый точный тип:
     * string заменяется любым более конкретным, остальные типы не перезаписываются.
     *
     * @param text           текст для сканирования
     * @param ignoreSuffixes суффиксы, которые нужно пропустить
     * @return суффикс -> тип, в порядке первого появления
     */
    public Map<String, VariableType> scan(String text, Collection<String> ignoreSuffixes) {
        Set<String> ignored = ignoreSuffixes == null ? Set.of() : new HashSet<>(ignoreSuffixes);
        Map<String, VariableType> lookups = new LinkedHashMap<>();

        text.lines().forEach(line -> {
            Matcher matcher = RoleVarTypeClassifier.ROLE_VAR_LOOKUP.matcher(line);
            while (matcher.find()) {
                String suffix = matcher.group(1);
                if (ignored.contains(suffix)) {
                    continue;
                }
                VariableType type = classifier.classify(suffix, line);
                VariableType existing = lookups.get(suffix);
                if (existing == null || existing == VariableType.STRING) {
                    lookups.put(suffix, type);
                }
            }
        });
        return lookups;
    }
}
