package com.example.roledocs.cli;

import com.example.roledocs.model.RepoType;
import com.example.roledocs.model.RoleInfo;
import com.example.roledocs.model.Section;
import com.example.roledocs.service.RoleDocsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI интерфейс для генерации документации роли из командной строки.
 *
 * Примеры использования:
 *
 * java -jar role-docs.jar --role=plex
 *
 * java -jar role-docs.jar --role=jellyfin --repo-type=sandbox --output=./docs/jellyfin.md
 *
 * java -jar role-docs.jar --role=plex --defaults=./plex/defaults/main.yml
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    private final RoleDocsService roleDocsService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        // без --role запускается REST API
        if (!args.containsOption("role")) {
            log.info("Starting in REST API mode. Use --role=<name> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");

        try {
            runCli(args);
            System.exit(0);
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    private void runCli(ApplicationArguments args) {
        String roleName = getRequiredOption(args, "role");
        RepoType repoType = RepoType.fromTag(getOption(args, "repo-type", "saltbox"));
        String defaults = getOption(args, "defaults", null);
        String output = getOption(args, "output", null);

        printBanner();

        System.out.println("Role: " + roleName);
        System.out.println("Repository: " + repoType.getTag());
        System.out.println("Defaults: " + (defaults != null ? defaults : "(resolved from repository)"));
        System.out.println();

        RoleInfo role = roleDocsService.parseRole(roleName, repoType, defaults != null ? Path.of(defaults) : null);
        Path saved = roleDocsService.generateAndSave(role, output != null ? Path.of(output) : null);
        System.out.println("Documentation saved to: " + saved.toAbsolutePath());

        printSummary(role);
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════════════════════════╗");
        System.out.println("║              Role Docs - Ansible Role Defaults            ║");
        System.out.println("║               Variables Documentation Generator           ║");
        System.out.println("╚═══════════════════════════════════════════════════════════╝");
        System.out.println();
    }

    private void printSummary(RoleInfo role) {
        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("                        ROLE SUMMARY                        ");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println();
        System.out.println("  Role:                 " + role.getName());
        System.out.println("  Sections:             " + role.getSectionOrder().size());
        System.out.println("  Total variables:      " + role.getAllVariables().size());
        System.out.println("  Instances:            " + (role.isHasInstances() ? role.getInstancesVar() : "no"));
        System.out.println();

        for (String sectionName : role.getSectionOrder()) {
            Section section = role.getSection(sectionName);
            int count = section.getVariables().size()
                    + section.getSubsections().values().stream().mapToInt(List::size).sum();
            System.out.println("    - " + sectionName + " (" + count + ")");
        }

        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("                    GENERATION COMPLETED                    ");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println();
    }

    private String getRequiredOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name) || args.getOptionValues(name).isEmpty()) {
            throw new IllegalArgumentException("Required option --" + name + " is missing");
        }
        return args.getOptionValues(name).get(0);
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name) && !args.getOptionValues(name).isEmpty()) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
