package com.example.roledocs.service;

import com.example.roledocs.metrics.ParserMetrics;
import com.example.roledocs.model.RepoType;
import com.example.roledocs.model.RoleDocumentation;
import com.example.roledocs.model.RoleInfo;
import com.example.roledocs.service.parser.DefaultsParser;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Разбор defaults-файлов ролей и подготовка документации.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleDocsService {

    private final DefaultsParser parser;
    private final RoleRepositoryResolver repositoryResolver;
    private final RoleDataBuilder dataBuilder;
    private final RoleDocumentGenerator documentGenerator;
    private final ParserMetrics metrics;

    /**
     * Разбирает текст defaults-файла.
     */
    public RoleInfo parse(String content, String roleName, RepoType repoType) {
        Timer.Sample sample = metrics.startTimer();
        RoleInfo role = parser.parse(content, roleName, repoType);
        metrics.recordParseDuration(sample);
        metrics.recordParsed(role.getAllVariables().size());

        log.info("Parsed role {} ({}): {} sections, {} variables",
                roleName, repoType.getTag(), role.getSectionOrder().size(), role.getAllVariables().size());
        return role;
    }

    /**
     * Разбирает defaults-файл роли. Если путь не задан, файл ищется в репозитории.
     *
     * @param roleName     имя роли
     * @param repoType     репозиторий роли
     * @param defaultsFile явный путь к defaults-файлу или null
     * @return информация о роли
     */
    public RoleInfo parseRole(String roleName, RepoType repoType, Path defaultsFile) {
        Path file = defaultsFile != null ? defaultsFile : repositoryResolver.resolveDefaults(roleName, repoType);

        Timer.Sample sample = metrics.startTimer();
        try {
            RoleInfo role = parser.parseFile(file, roleName, repoType);
            metrics.recordParseDuration(sample);
            metrics.recordParsed(role.getAllVariables().size());
            log.info("Parsed role {} from {}: {} sections, {} variables",
                    roleName, file, role.getSectionOrder().size(), role.getAllVariables().size());
            return role;
        } catch (IOException e) {
            metrics.recordFailed();
            throw new UncheckedIOException("Failed to read defaults file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Строит документацию роли и возвращает Markdown.
     */
    public String generateMarkdown(RoleInfo role) {
        RoleDocumentation doc = dataBuilder.build(role);
        return documentGenerator.generate(doc);
    }

    /**
     * Строит документацию роли и сохраняет её: в outputFile, если он задан,
     * иначе в каталог вывода из конфигурации.
     */
    public Path generateAndSave(RoleInfo role, Path outputFile) {
        RoleDocumentation doc = dataBuilder.build(role);
        if (outputFile != null) {
            return documentGenerator.save(documentGenerator.generate(doc), outputFile);
        }
        return documentGenerator.generateAndSave(doc);
    }
}
