package com.example.roledocs.service.docker;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Находит опции docker-контейнера, доступные через lookup('docker_var', ...)
 * в resources/tasks/docker/*.yml.
 *
 * Результат сканирования кэшируется в экземпляре при первом обращении.
 */
@Slf4j
public class DockerVarScanner {

    private static final Pattern DOCKER_VAR_LOOKUP =
            Pattern.compile("lookup\\s*\\(\\s*['\"]docker_var['\"]\\s*,\\s*['\"]([^'\"]+)['\"]");

    private static final String SPECS_KEY = "_docker_var_specs";
    private static final String DOCKER_PREFIX = "_docker_";

    private final Path resourcesPath;
    private Set<String> cache;

    public DockerVarScanner(Path resourcesPath) {
        this.resourcesPath = resourcesPath;
    }

    /**
     * Возвращает все суффиксы docker_var без префикса _docker_.
     * Отсутствующий каталог задач - пустой результат.
     *
     * @throws IOException если каталог не удалось прочитать
     */
    public synchronized Set<String> findDockerVarLookups() throws IOException {
        if (cache != null) {
            return cache;
        }

        Path dockerTasks = resourcesPath.resolve("tasks").resolve("docker");
        if (!Files.isDirectory(dockerTasks)) {
            log.debug("Docker tasks directory not found: {}", dockerTasks);
            cache = Collections.emptySet();
            return cache;
        }

        Set<String> suffixes = new TreeSet<>();
        List<Path> taskFiles;
        try (Stream<Path> paths = Files.list(dockerTasks)) {
            taskFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".yml"))
                    .sorted()
                    .toList();
        }

        for (Path taskFile : taskFiles) {
            String content = new String(Files.readAllBytes(taskFile), StandardCharsets.UTF_8);
            Matcher matcher = DOCKER_VAR_LOOKUP.matcher(content);
            while (matcher.find()) {
                addSuffix(suffixes, matcher.group(1));
            }
            collectVarSpecs(taskFile, content, suffixes);
        }

        log.info("Found {} docker_var options in {}", suffixes.size(), dockerTasks);
        cache = Collections.unmodifiableSet(suffixes);
        return cache;
    }

    /**
     * Опции docker, которые роль не объявляет сама ({role}_role_docker_{suffix})
     * и которые не исключены настройками.
     *
     * @param roleName       имя роли
     * @param roleDockerVars имена docker-переменных роли
     * @param ignoreSuffixes исключённые суффиксы, с префиксом _docker_ или без
     * @return отсортированный список суффиксов
     * @throws IOException если каталог задач не удалось прочитать
     */
    public List<String> getDockerVarSuffixes(String roleName,
                                             Collection<String> roleDockerVars,
                                             Collection<String> ignoreSuffixes) throws IOException {
        String prefix = roleName + "_role_docker_";
        Set<String> excluded = new HashSet<>();
        for (String varName : roleDockerVars) {
            if (varName.startsWith(prefix)) {
                excluded.add(varName.substring(prefix.length()));
            }
        }
        if (ignoreSuffixes != null) {
            ignoreSuffixes.forEach(suffix -> excluded.add(normalizeSuffix(suffix)));
        }

        List<String> additional = new ArrayList<>();
        for (String suffix : findDockerVarLookups()) {
            if (!excluded.contains(suffix)) {
                additional.add(suffix);
            }
        }
        return additional;
    }

    /**
     * Группирует суффиксы по категориям; пустые категории не включаются.
     */
    public static Map<DockerVarCategory, List<String>> categorize(Collection<String> suffixes) {
        Map<DockerVarCategory, List<String>> grouped = new EnumMap<>(DockerVarCategory.class);
        for (String suffix : suffixes) {
            grouped.computeIfAbsent(DockerVarCategory.of(suffix), key -> new ArrayList<>()).add(suffix);
        }
        Map<DockerVarCategory, List<String>> ordered = new LinkedHashMap<>();
        grouped.forEach((category, values) -> ordered.put(category, values.stream().sorted().toList()));
        return ordered;
    }

    /**
     * _docker_dev_dri -> dev_dri, _dev_dri -> dev_dri.
     */
    public static String normalizeSuffix(String suffix) {
        String trimmed = suffix.strip();
        if (trimmed.startsWith(DOCKER_PREFIX)) {
            return trimmed.substring(DOCKER_PREFIX.length());
        }
        if (trimmed.startsWith("_")) {
            return trimmed.substring(1);
        }
        return trimmed;
    }

    private static void addSuffix(Set<String> suffixes, String rawSuffix) {
        String suffix = normalizeSuffix(rawSuffix);
        if (!suffix.isEmpty()) {
            suffixes.add(suffix);
        }
    }

    /**
     * Ключи _docker_var_specs ищутся в дереве узлов YAML; теги Ansible
     * (!unsafe, !vault) не раскрываются.
     */
    private void collectVarSpecs(Path taskFile, String content, Set<String> suffixes) {
        try {
            Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Node document : new Yaml().composeAll(new StringReader(content))) {
                walk(document, suffixes, visited);
            }
        } catch (YAMLException e) {
            log.warn("Failed to read {} from {}: {}", SPECS_KEY, taskFile, e.getMessage());
        }
    }

    private void walk(Node node, Set<String> suffixes, Set<Node> visited) {
        if (node == null || !visited.add(node)) {
            return;
        }
        if (node instanceof MappingNode mapping) {
            for (NodeTuple tuple : mapping.getValue()) {
                Node value = tuple.getValueNode();
                if (tuple.getKeyNode() instanceof ScalarNode key && SPECS_KEY.equals(key.getValue())
                        && value instanceof MappingNode specs) {
                    for (NodeTuple spec : specs.getValue()) {
                        if (spec.getKeyNode() instanceof ScalarNode specKey
                                && specKey.getValue().startsWith(DOCKER_PREFIX)) {
                            addSuffix(suffixes, specKey.getValue());
                        }
                    }
                }
                walk(value, suffixes, visited);
            }
        } else if (node instanceof SequenceNode sequence) {
            for (Node item : sequence.getValue()) {
                walk(item, suffixes, visited);
            }
        }
    }
}
