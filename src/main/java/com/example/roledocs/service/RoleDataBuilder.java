package com.example.roledocs.service;

import com.example.roledocs.config.DockerOverridesConfig;
import com.example.roledocs.config.GlobalOverridesConfig;
import com.example.roledocs.config.RepositoriesConfig;
import com.example.roledocs.model.RoleDocumentation;
import com.example.roledocs.model.RoleDocumentation.DockerOption;
import com.example.roledocs.model.RoleDocumentation.GlobalOverride;
import com.example.roledocs.model.RoleDocumentation.SectionView;
import com.example.roledocs.model.RoleDocumentation.VariableView;
import com.example.roledocs.model.RoleInfo;
import com.example.roledocs.model.Section;
import com.example.roledocs.model.Variable;
import com.example.roledocs.model.VariableType;
import com.example.roledocs.service.docker.DockerVarCategory;
import com.example.roledocs.service.docker.DockerVarScanner;
import com.example.roledocs.service.docker.DockerVarTypes;
import com.example.roledocs.service.inference.RoleVarLookupScanner;
import com.example.roledocs.service.inference.RoleVarTypeClassifier;
import com.example.roledocs.service.inference.TypeInferrer;
import com.example.roledocs.service.parser.VariableFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Собирает данные для документации роли из результата разбора defaults-файла.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleDataBuilder {

    private final TypeInferrer typeInferrer;
    private final RoleVarTypeClassifier roleVarClassifier;
    private final RoleVarLookupScanner lookupScanner;
    private final DockerVarTypes dockerVarTypes;
    private final DockerVarScanner dockerVarScanner;
    private final RepositoriesConfig repositoriesConfig;
    private final GlobalOverridesConfig globalOverridesConfig;
    private final DockerOverridesConfig dockerOverridesConfig;

    /**
     * Строит данные документации роли.
     *
     * @param role результат разбора defaults-файла
     * @return данные для генерации документации
     */
    public RoleDocumentation build(RoleInfo role) {
        String instanceName = role.getName() + "2";
        RoleDocumentation doc = RoleDocumentation.builder()
                .roleName(role.getName())
                .repoType(role.getRepoType())
                .hasInstances(role.isHasInstances())
                .instancesVar(role.getInstancesVar())
                .instanceName(instanceName)
                .hasDefaultVars(role.isHasDefaultVars())
                .build();

        Set<String> hideBase = VariableFilters.buildHideBaseSet(role.getAllVariables());
        Map<String, GlobalOverride> overrides = new LinkedHashMap<>();

        for (String sectionName : role.getSectionOrder()) {
            Section section = role.getSection(sectionName);
            SectionView view = SectionView.builder().name(sectionName).build();

            for (Variable variable : section.getVariables()) {
                if (!hideBase.contains(variable.getName())) {
                    view.getVariables().add(toView(variable, role.getName(), instanceName));
                    collectLookups(variable, overrides);
                }
            }
            for (String subsection : section.getSubsectionOrder()) {
                List<VariableView> views = new ArrayList<>();
                for (Variable variable : section.getSubsections().get(subsection)) {
                    if (!hideBase.contains(variable.getName())) {
                        views.add(toView(variable, role.getName(), instanceName));
                        collectLookups(variable, overrides);
                    }
                }
                view.getSubsections().put(subsection, views);
            }
            doc.getSections().add(view);
        }

        collectInventoryLookups(overrides);
        enrichOverrides(overrides);
        doc.setGlobalOverrides(filterOverrides(overrides, role));
        doc.setDockerOptions(buildDockerOptions(role));

        if (!role.isHasInstances()) {
            selectExample(doc);
        }

        log.debug("Built documentation data for role {}: {} variables, {} global overrides",
                role.getName(), doc.getTotalVariables(), doc.getGlobalOverrides().size());
        return doc;
    }

    private VariableView toView(Variable variable, String roleName, String instanceName) {
        return VariableView.builder()
                .name(variable.getName())
                .rawValue(variable.getRawValue())
                .type(typeInferrer.inferType(variable.getName(), variable.getRawValue()))
                .comment(variable.getComment())
                .multiline(variable.isMultiline())
                .valueLines(variable.getValueLines())
                .instanceName(VariableFilters.generateInstanceName(variable.getName(), roleName, instanceName))
                .lineNumber(variable.getLineNumber())
                .build();
    }

    private void collectLookups(Variable variable, Map<String, GlobalOverride> overrides) {
        for (String suffix : RoleVarTypeClassifier.extractLookups(variable.getRawValue())) {
            overrides.computeIfAbsent(suffix, key -> GlobalOverride.builder()
                    .suffix(key)
                    .type(roleVarClassifier.classify(key, variable.getRawValue()))
                    .build());
        }
    }

    private void collectInventoryLookups(Map<String, GlobalOverride> overrides) {
        try {
            Map<String, VariableType> inventory = lookupScanner.scanFile(
                    repositoriesConfig.inventoryPath(), globalOverridesConfig.getIgnoreSuffixes());
            inventory.forEach((suffix, type) -> overrides.computeIfAbsent(suffix,
                    key -> GlobalOverride.builder().suffix(key).type(type).build()));
        } catch (IOException e) {
            log.warn("Failed to scan inventory {}: {}", repositoriesConfig.inventoryPath(), e.getMessage());
        }
    }

    private void enrichOverrides(Map<String, GlobalOverride> overrides) {
        overrides.forEach((suffix, override) -> globalOverridesConfig.findVariable(suffix).ifPresent(def -> {
            override.setDescription(def.getDescription());
            if (def.getDefaultValue() != null) {
                override.setDefaultValue(def.getDefaultValue());
                override.setHasDefault(true);
            }
            override.setExample(def.getExample());
            if (def.getType() != null && !def.getType().isBlank()) {
                override.setType(VariableType.fromLabel(def.getType()));
            }
        }));
    }

    /**
     * Убирает переопределения, которые не относятся к роли: например, _web_ без секции Web.
     */
    Map<String, GlobalOverride> filterOverrides(Map<String, GlobalOverride> overrides, RoleInfo role) {
        Map<String, GlobalOverride> filtered = new LinkedHashMap<>();
        overrides.forEach((suffix, override) -> {
            String lower = suffix.toLowerCase(Locale.ROOT);
            if (lower.contains("_web_") && !role.isHasWeb()) {
                return;
            }
            if ((lower.contains("_traefik_") || lower.contains("_themepark_")) && !role.isHasTraefik()) {
                return;
            }
            if (!role.isHasDocker() && (lower.contains("_docker_") || lower.contains("_autoheal_")
                    || lower.contains("_depends_on") || lower.contains("_diun_"))) {
                return;
            }
            if (lower.contains("_dns_") && !role.isHasDns()) {
                return;
            }
            filtered.put(suffix, override);
        });
        return filtered;
    }

    private Map<String, List<DockerOption>> buildDockerOptions(RoleInfo role) {
        List<String> roleDockerVars = role.getAllVariables().stream()
                .map(Variable::getName)
                .filter(name -> name.contains("_docker_"))
                .toList();
        Map<String, List<DockerOption>> options = new LinkedHashMap<>();
        if (roleDockerVars.isEmpty()) {
            return options;
        }

        try {
            List<String> additional = dockerVarScanner.getDockerVarSuffixes(
                    role.getName(), roleDockerVars, dockerOverridesConfig.getIgnoreSuffixes());
            Map<DockerVarCategory, List<String>> categories = DockerVarScanner.categorize(additional);
            categories.forEach((category, suffixes) -> options.put(category.getTitle(), suffixes.stream()
                    .map(suffix -> new DockerOption(suffix, dockerVarTypes.typeOf(suffix)))
                    .toList()));
        } catch (IOException e) {
            log.warn("Failed to scan docker options for role {}: {}", role.getName(), e.getMessage());
        }
        return options;
    }

    private void selectExample(RoleDocumentation doc) {
        for (SectionView section : doc.getSections()) {
            VariableView first = section.getVariables().isEmpty()
                    ? section.getSubsections().values().stream()
                            .filter(vars -> !vars.isEmpty())
                            .map(vars -> vars.get(0))
                            .findFirst()
                            .orElse(null)
                    : section.getVariables().get(0);
            if (first != null) {
                doc.setExampleVar(first.getName());
                doc.setExampleValue(exampleValue(first.getType()));
                return;
            }
        }
    }

    static String exampleValue(VariableType type) {
        return switch (type) {
            case BOOL -> "true";
            case INT -> "42";
            case LIST -> "[\"item1\", \"item2\"]";
            case DICT -> "{}";
            default -> "\"custom_value\"";
        };
    }
}
