package com.example.roledocs.service;

import com.example.roledocs.config.OutputConfig;
import com.example.roledocs.model.RoleDocumentation;
import com.example.roledocs.model.RoleDocumentation.DockerOption;
import com.example.roledocs.model.RoleDocumentation.GlobalOverride;
import com.example.roledocs.model.RoleDocumentation.SectionView;
import com.example.roledocs.model.RoleDocumentation.VariableView;
import com.example.roledocs.model.VariableType;
import com.example.roledocs.service.parser.VariableFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Сервис для генерации Markdown документации переменных роли.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleDocumentGenerator {

    private final OutputConfig outputConfig;

    /**
     * Генерирует Markdown документацию и сохраняет в файл.
     *
     * @param doc данные документации роли
     * @return путь к сохранённому файлу
     */
    public Path generateAndSave(RoleDocumentation doc) {
        Path outputDir = Path.of(outputConfig.getMarkdown().getPath());
        String filename = doc.getRoleName() + "_" + outputConfig.getMarkdown().getDefaultFilename();
        return save(generate(doc), outputDir.resolve(filename));
    }

    /**
     * Сохраняет готовый Markdown в указанный файл, создавая каталоги.
     */
    public Path save(String markdown, Path outputFile) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, markdown);
            log.info("Documentation saved to: {}", outputFile);
            return outputFile;
        } catch (IOException e) {
            log.error("Error saving documentation", e);
            throw new UncheckedIOException("Failed to save documentation: " + e.getMessage(), e);
        }
    }

    /**
     * Генерирует Markdown документацию.
     *
     * @param doc данные документации роли
     * @return Markdown строка
     */
    public String generate(RoleDocumentation doc) {
        StringBuilder md = new StringBuilder();

        md.append("# ").append(doc.getRoleName()).append(" role variables\n\n");
        md.append("> Generated from `roles/").append(doc.getRoleName()).append("/defaults/main.yml`\n");
        md.append("> \n");
        md.append("> - **Repository:** ").append(doc.getRepoType().getTag()).append("\n");
        md.append("> - **Variables:** ").append(doc.getTotalVariables()).append("\n");
        if (doc.isHasInstances()) {
            md.append("> - **Instances variable:** `").append(doc.getInstancesVar()).append("`\n");
        }
        md.append("\n");

        appendUsage(md, doc);

        for (SectionView section : doc.getSections()) {
            if (!section.hasContent()) {
                continue;
            }
            md.append("## ").append(section.getName()).append("\n\n");
            appendVariables(md, doc, section.getVariables());

            for (Map.Entry<String, List<VariableView>> sub : section.getSubsections().entrySet()) {
                if (sub.getValue().isEmpty()) {
                    continue;
                }
                md.append("### ").append(sub.getKey()).append("\n\n");
                appendVariables(md, doc, sub.getValue());
            }
        }

        appendGlobalOverrides(md, doc);
        appendDockerOptions(md, doc);

        return md.toString();
    }

    private void appendUsage(StringBuilder md, RoleDocumentation doc) {
        if (doc.isHasInstances()) {
            md.append("Variables prefixed with `").append(doc.getRoleName())
              .append("_role_` apply to every instance. Instance-level overrides replace the role name ")
              .append("with the instance name, for example `").append(doc.getInstanceName()).append("_`.\n\n");
        } else if (doc.getExampleVar() != null) {
            md.append("Override any variable below in the inventory, for example:\n\n");
            md.append("```yaml\n")
              .append(doc.getExampleVar()).append(": ").append(doc.getExampleValue()).append("\n")
              .append("```\n\n");
        }
        if (doc.isHasDefaultVars()) {
            md.append("Variables ending in `_default` hold the built-in value; ")
              .append("use the matching `_custom` variable to extend it.\n\n");
        }
    }

    private void appendVariables(StringBuilder md, RoleDocumentation doc, List<VariableView> variables) {
        if (variables.isEmpty()) {
            return;
        }
        md.append("```yaml\n");
        for (VariableView var : variables) {
            appendComment(md, var.getComment());
            md.append(var.getType().comment()).append("\n");
            renderLines(var).forEach(line -> md.append(line).append("\n"));
            md.append("\n");
        }
        md.append("```\n\n");

        if (!doc.isHasInstances()) {
            return;
        }
        List<VariableView> renamed = variables.stream()
                .filter(var -> !var.getInstanceName().equals(var.getName()))
                .toList();
        if (renamed.isEmpty()) {
            return;
        }
        md.append("Instance-level (`").append(doc.getInstanceName()).append("`):\n\n");
        md.append("```yaml\n");
        for (VariableView var : renamed) {
            md.append(var.getType().comment()).append("\n");
            VariableFilters.adjustMultilineIndent(renderLines(var), var.getName(), var.getInstanceName())
                    .forEach(line -> md.append(line).append("\n"));
            md.append("\n");
        }
        md.append("```\n\n");
    }

    /**
     * Восстанавливает строки объявления переменной: "name: value" и строки продолжения.
     */
    static List<String> renderLines(VariableView var) {
        List<String> lines = new ArrayList<>();
        List<String> valueLines = var.getValueLines();
        String first = valueLines == null || valueLines.isEmpty() ? "" : valueLines.get(0);
        lines.add(first.isEmpty() ? var.getName() + ":" : var.getName() + ": " + first);
        if (valueLines != null && valueLines.size() > 1) {
            lines.addAll(valueLines.subList(1, valueLines.size()));
        }
        return lines;
    }

    private void appendGlobalOverrides(StringBuilder md, RoleDocumentation doc) {
        if (doc.getGlobalOverrides().isEmpty()) {
            return;
        }
        md.append("## Global Override Options\n\n");
        md.append("```yaml\n");
        for (GlobalOverride override : doc.getGlobalOverrides().values()) {
            String description = override.getDescription();
            if (description != null && !description.isBlank()) {
                if (!doc.isHasInstances()) {
                    description = description.replace("containers", "the container");
                }
                appendComment(md, description.replace("{role}", doc.getRoleName()));
            }
            md.append(override.getType().comment()).append("\n");

            String suffix = override.getSuffix();
            String name = doc.getRoleName() + "_role" + (suffix.startsWith("_") ? suffix : "_" + suffix);
            if (hasOverrideDefault(override)) {
                md.append(name).append(": ")
                  .append(formatOverrideDefault(override.getDefaultValue(), override.getType()))
                  .append("\n");
            } else {
                md.append(name).append(":\n");
            }
            if (override.getExample() != null && !override.getExample().isBlank()) {
                appendComment(md, "Example: " + override.getExample().replace("{variable}", name));
            }
            md.append("\n");
        }
        md.append("```\n\n");
    }

    private void appendDockerOptions(StringBuilder md, RoleDocumentation doc) {
        if (doc.getDockerOptions().isEmpty()) {
            return;
        }
        md.append("## Additional Docker Options\n\n");
        for (Map.Entry<String, List<DockerOption>> category : doc.getDockerOptions().entrySet()) {
            md.append("### ").append(category.getKey()).append("\n\n");
            md.append("```yaml\n");
            for (DockerOption option : category.getValue()) {
                md.append(option.getType().comment()).append("\n");
                md.append(doc.getRoleName()).append("_role_docker_").append(option.getSuffix()).append(":\n\n");
            }
            md.append("```\n\n");
        }
    }

    private void appendComment(StringBuilder md, String comment) {
        if (comment == null || comment.isBlank()) {
            return;
        }
        for (String line : comment.split("\n")) {
            md.append(line.isBlank() ? "#" : "# " + line).append("\n");
        }
    }

    static boolean hasOverrideDefault(GlobalOverride override) {
        return override.isHasDefault()
                || (override.getDefaultValue() != null && !override.getDefaultValue().isEmpty());
    }

    /**
     * Форматирует значение по умолчанию глобального переопределения:
     * строковые типы заключаются в кавычки, если их ещё нет.
     */
    static String formatOverrideDefault(String defaultValue, VariableType type) {
        if (defaultValue == null || defaultValue.isEmpty()) {
            return "\"\"";
        }
        if (type.getLabel().startsWith("string")) {
            boolean quoted = (defaultValue.startsWith("\"") && defaultValue.endsWith("\"") && defaultValue.length() > 1)
                    || (defaultValue.startsWith("'") && defaultValue.endsWith("'") && defaultValue.length() > 1);
            return quoted ? defaultValue : "\"" + defaultValue + "\"";
        }
        return defaultValue;
    }
}
