package com.example.roledocs.service.docker;

import com.example.roledocs.config.DockerOverridesConfig;
import com.example.roledocs.model.VariableType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DockerVarScannerTest {

    private static final String CREATE_TASK = """
            - name: test
              ansible.builtin.set_fact:
                _docker_dev_dri: "{{ lookup('docker_var', '_docker_dev_dri', default=false) }}"
                _docker_network_mode: "{{ lookup('docker_var', '_docker_network_mode', default='bridge') }}"
                _docker_var_specs:
                  _docker_extra_hosts:
                    type: list
            """;

    @TempDir
    Path tempDir;

    @Test
    void shouldNormalizeSuffixes() {
        assertEquals("dev_dri", DockerVarScanner.normalizeSuffix("_docker_dev_dri"));
        assertEquals("dev_dri", DockerVarScanner.normalizeSuffix("dev_dri"));
        assertEquals("dev_dri", DockerVarScanner.normalizeSuffix("_dev_dri"));
        assertEquals("memory", DockerVarScanner.normalizeSuffix("  _docker_memory  "));
        assertEquals("", DockerVarScanner.normalizeSuffix(""));
    }

    @Test
    void shouldFindLookupsAndSpecKeys() throws Exception {
        // Given
        writeTask("create.yml", CREATE_TASK);
        DockerVarScanner scanner = new DockerVarScanner(tempDir);

        // When
        Set<String> suffixes = scanner.findDockerVarLookups();

        // Then
        assertEquals(List.of("dev_dri", "extra_hosts", "network_mode"), List.copyOf(suffixes));
    }

    @Test
    void shouldApplyRoleVarsAndIgnoreList() throws Exception {
        // Given
        writeTask("create.yml", CREATE_TASK);
        DockerVarScanner scanner = new DockerVarScanner(tempDir);
        List<String> roleDockerVars = List.of("myrole_role_docker_network_mode");
        // полный и короткий вариант суффикса
        List<String> ignore = List.of("_docker_dev_dri", "extra_hosts");

        // When
        List<String> additional = scanner.getDockerVarSuffixes("myrole", roleDockerVars, ignore);

        // Then
        assertTrue(additional.isEmpty(), "unexpected options: " + additional);
    }

    @Test
    void shouldReturnOptionsNotDefinedByRole() throws Exception {
        writeTask("create.yml", CREATE_TASK);
        DockerVarScanner scanner = new DockerVarScanner(tempDir);

        List<String> additional = scanner.getDockerVarSuffixes("myrole",
                List.of("myrole_role_docker_network_mode"), List.of());

        assertEquals(List.of("dev_dri", "extra_hosts"), additional);
    }

    @Test
    void shouldCacheFirstScan() throws Exception {
        // Given
        writeTask("create.yml", CREATE_TASK);
        DockerVarScanner scanner = new DockerVarScanner(tempDir);
        Set<String> first = scanner.findDockerVarLookups();

        // When
        writeTask("extra.yml", "x: \"{{ lookup('docker_var', '_docker_memory') }}\"\n");

        // Then
        assertSame(first, scanner.findDockerVarLookups());
        assertFalse(scanner.findDockerVarLookups().contains("memory"));
    }

    @Test
    void shouldReturnEmptyForMissingDirectory() throws Exception {
        DockerVarScanner scanner = new DockerVarScanner(tempDir.resolve("absent"));

        assertTrue(scanner.findDockerVarLookups().isEmpty());
    }

    @Test
    void shouldTolerateInvalidYamlInTaskFile() throws Exception {
        // Given
        writeTask("broken.yml", "x: \"{{ lookup('docker_var', '_docker_shm_size') }}\"\n  bad: [unclosed\n");
        DockerVarScanner scanner = new DockerVarScanner(tempDir);

        // When
        Set<String> suffixes = scanner.findDockerVarLookups();

        // Then
        assertEquals(Set.of("shm_size"), suffixes);
    }

    @Test
    void shouldReadSpecKeysNextToAnsibleTags() throws Exception {
        // Given
        writeTask("tags.yml", """
                - name: specs
                  ansible.builtin.set_fact:
                    _docker_var_specs: {_docker_shm_size: {}, _docker_sysctls: {}}
                    raw_cmd: !unsafe "{{ x }}"
                    secret: !vault |
                      $ANSIBLE_VAULT;1.1;AES256
                      6162
                """);
        DockerVarScanner scanner = new DockerVarScanner(tempDir);

        // When
        Set<String> suffixes = scanner.findDockerVarLookups();

        // Then
        assertEquals(Set.of("shm_size", "sysctls"), suffixes);
    }

    @Test
    void shouldCategorizeInFixedOrder() {
        Map<DockerVarCategory, List<String>> categories = DockerVarScanner.categorize(
                List.of("volumes", "memory", "dns_servers", "privileged", "restart_policy", "cpus", "comparisons"));

        assertEquals(List.of(DockerVarCategory.RESOURCE_LIMITS, DockerVarCategory.SECURITY_AND_DEVICES,
                DockerVarCategory.NETWORKING, DockerVarCategory.STORAGE,
                DockerVarCategory.MONITORING_AND_LIFECYCLE, DockerVarCategory.OTHER),
                List.copyOf(categories.keySet()));
        assertEquals(List.of("cpus", "memory"), categories.get(DockerVarCategory.RESOURCE_LIMITS));
        assertEquals(List.of("comparisons"), categories.get(DockerVarCategory.OTHER));
        assertEquals("Monitoring & Lifecycle", DockerVarCategory.MONITORING_AND_LIFECYCLE.getTitle());
    }

    @Test
    void shouldResolveOptionTypes() {
        // Given
        DockerOverridesConfig config = new DockerOverridesConfig();
        config.getTypes().setInteger(List.of("_docker_shm_size_mb"));
        DockerVarTypes types = new DockerVarTypes(config);

        // Then
        assertEquals(VariableType.BOOL, types.typeOf("privileged"));
        assertEquals(VariableType.INT, types.typeOf("_docker_stop_timeout"));
        assertEquals(VariableType.LIST, types.typeOf("volumes"));
        assertEquals(VariableType.DICT, types.typeOf("labels"));
        assertEquals(VariableType.INT, types.typeOf("shm_size_mb"));
        assertEquals(VariableType.STRING, types.typeOf("network_mode"));
        assertEquals("# Type: bool (true/false)", types.typeOf("init").comment());
        assertEquals(VariableType.STRING, new DockerVarTypes(null).typeOf("shm_size_mb"));
    }

    private void writeTask(String name, String content) throws Exception {
        Path dir = tempDir.resolve("tasks").resolve("docker");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(name), content);
    }
}
