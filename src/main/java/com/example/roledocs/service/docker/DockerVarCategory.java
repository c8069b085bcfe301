package com.example.roledocs.service.docker;

import java.util.List;

/**
 * Группы дополнительных опций docker-контейнера, в порядке вывода.
 */
public enum DockerVarCategory {
    RESOURCE_LIMITS("Resource Limits", "cpu", "memory", "blkio", "kernel", "shm"),
    SECURITY_AND_DEVICES("Security & Devices", "device", "cap_", "privileged", "security", "user",
            "groups", "userns", "cgroupns"),
    NETWORKING("Networking", "network", "dns", "hostname", "hosts", "domainname", "ports", "exposed",
            "links", "ipc", "pid", "uts"),
    STORAGE("Storage", "volume", "mount", "working_dir", "tmpfs", "storage"),
    MONITORING_AND_LIFECYCLE("Monitoring & Lifecycle", "log", "healthcheck", "init", "restart", "stop",
            "kill", "recreate", "cleanup", "keep", "oom", "paused", "detach", "output", "auto_remove",
            "healthy"),
    OTHER("Other Options");

    private final String title;
    private final List<String> keywords;

    DockerVarCategory(String title, String... keywords) {
        this.title = title;
        this.keywords = List.of(keywords);
    }

    public String getTitle() {
        return title;
    }

    /**
     * Первая группа, ключевое слово которой входит в суффикс; иначе {@link #OTHER}.
     */
    public static DockerVarCategory of(String suffix) {
        for (DockerVarCategory category : values()) {
            if (category.keywords.stream().anyMatch(suffix::contains)) {
                return category;
            }
        }
        return OTHER;
    }
}
