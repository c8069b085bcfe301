package com.example.roledocs.service.docker;

import com.example.roledocs.config.DockerOverridesConfig;
import com.example.roledocs.model.VariableType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Типы опций модуля docker_container по суффиксу docker_var.
 */
@Component
public class DockerVarTypes {

    private static final Map<String, VariableType> BUILT_IN = new HashMap<>();

    static {
        register(VariableType.BOOL, List.of("auto_remove", "cleanup", "detach", "init", "keep_volumes",
                "oom_killer", "output_logs", "paused", "privileged", "read_only", "recreate", "image_pull",
                "hosts_use_common", "labels_use_common", "volumes_global"), BUILT_IN);
        register(VariableType.INT, List.of("blkio_weight", "cpu_period", "cpu_quota", "cpu_shares",
                "healthy_wait_timeout", "memory_swappiness", "oom_score_adj", "restart_retries",
                "stop_timeout", "create_timeout"), BUILT_IN);
        register(VariableType.LIST, List.of("capabilities", "cap_drop", "commands", "device_cgroup_rules",
                "device_read_bps", "device_read_iops", "device_requests", "device_write_bps",
                "device_write_iops", "devices", "dns_opts", "dns_search_domains", "dns_servers",
                "exposed_ports", "groups", "links", "mounts", "networks", "ports", "security_opts",
                "sysctls", "tmpfs", "ulimits", "volumes", "volumes_from"), BUILT_IN);
        register(VariableType.DICT, List.of("envs", "healthcheck", "hosts", "labels", "log_options",
                "storage_opts"), BUILT_IN);
    }

    private final Map<String, VariableType> types = new HashMap<>(BUILT_IN);

    public DockerVarTypes(@Nullable DockerOverridesConfig config) {
        if (config != null) {
            DockerOverridesConfig.Types configured = config.getTypes();
            register(VariableType.BOOL, configured.getBool(), types);
            register(VariableType.INT, configured.getInteger(), types);
            register(VariableType.LIST, configured.getList(), types);
            register(VariableType.DICT, configured.getDict(), types);
        }
    }

    /**
     * Тип опции; всё, что не указано в таблице, - string.
     *
     * @param suffix нормализованный суффикс (без _docker_)
     */
    public VariableType typeOf(String suffix) {
        return types.getOrDefault(DockerVarScanner.normalizeSuffix(suffix), VariableType.STRING);
    }

    private static void register(VariableType type, List<String> suffixes, Map<String, VariableType> target) {
        for (String suffix : suffixes) {
            target.put(DockerVarScanner.normalizeSuffix(suffix), type);
        }
    }
}
