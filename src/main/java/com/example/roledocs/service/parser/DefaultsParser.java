package com.example.roledocs.service.parser;

import com.example.roledocs.model.RepoType;
import com.example.roledocs.model.RoleInfo;
import com.example.roledocs.model.Section;
import com.example.roledocs.model.Variable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбирает defaults/main.yml роли: секции, подсекции, комментарии и переменные.
 *
 * Файл читается построчно; строки, которые не удалось распознать, пропускаются.
 * Типы переменных здесь не определяются.
 */
@Slf4j
@Service
public class DefaultsParser {

    // ################################ + "# Name" на следующей строке
    private static final Pattern SECTION_DELIMITER = Pattern.compile("^#{10,}$");
    private static final Pattern SECTION_NAME = Pattern.compile("^#\\s*(.+?)\\s*$");

    private static final Pattern SUBSECTION_START =
            Pattern.compile("^#\\s*(.+?)\\s*-\\s*Sub-section Start\\s*$");
    private static final Pattern SUBSECTION_END =
            Pattern.compile("^#\\s*(.+?)\\s*-\\s*Sub-section End\\s*$");

    private static final Pattern VARIABLE = Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_]*)\\s*:\\s*(.*)$");

    private static final Pattern SKIP_DOCS = Pattern.compile("^Skip docs", Pattern.CASE_INSENSITIVE);
    private static final Pattern SKIP_INVENTORY =
            Pattern.compile("^Do not edit or override using the inventory", Pattern.CASE_INSENSITIVE);

    private static final Pattern GLOBAL_PREFIX = Pattern.compile("^\\[GLOBAL\\]\\s*");
    private static final Pattern NO_GLOBAL_PREFIX = Pattern.compile("^\\[NOGLOBAL\\]\\s*");

    private static final List<String> META_SECTION_MARKERS =
            List.of("title:", "author", "url:", "gnu general public license", "copyright");

    private static final String FOLDERS_LIST_MARKER = "_paths_folders_list";

    /**
     * Обработчики строк в порядке приоритета; первый вернувший true поглощает строку.
     */
    private final List<LineHandler> lineHandlers = List.of(
            this::handleBlankLine,
            this::handleSectionHeader,
            this::handleSubsectionStart,
            this::handleSubsectionEnd,
            this::handleComment,
            this::handleVariable
    );

    /**
     * Разбирает defaults-файл с диска.
     *
     * @param defaultsFile путь к defaults/main.yml
     * @param roleName     имя роли
     * @param repoType     репозиторий роли
     * @return информация о роли
     * @throws IOException если файл не удалось прочитать
     */
    public RoleInfo parseFile(Path defaultsFile, String roleName, RepoType repoType) throws IOException {
        log.debug("Reading defaults file: {}", defaultsFile);
        String content = new String(Files.readAllBytes(defaultsFile), StandardCharsets.UTF_8);
        return parse(content, roleName, repoType);
    }

    /**
     * Разбирает содержимое defaults-файла.
     *
     * @param content  полный текст документа
     * @param roleName имя роли
     * @param repoType репозиторий роли
     * @return информация о роли
     */
    public RoleInfo parse(String content, String roleName, RepoType repoType) {
        ParserState state = new ParserState(content.lines().toList());
        RoleAccumulator role = new RoleAccumulator();

        while (state.hasNext()) {
            String line = state.next();
            for (LineHandler handler : lineHandlers) {
                if (handler.handle(state, role, line)) {
                    break;
                }
            }
        }

        RoleInfo roleInfo = role.build(roleName, repoType);
        log.debug("Parsed role {}: {} sections, {} variables",
                roleName, roleInfo.getSectionOrder().size(), roleInfo.getAllVariables().size());
        return roleInfo;
    }

    // ===== Обработчики строк =====

    private boolean handleBlankLine(ParserState state, RoleAccumulator role, String line) {
        // пустые строки не разрывают связь комментария со следующей переменной
        return line.isBlank();
    }

    private boolean handleSectionHeader(ParserState state, RoleAccumulator role, String line) {
        if (!isDelimiter(line)) {
            return false;
        }
        if (!state.hasNext()) {
            return true;
        }

        Matcher nameMatcher = SECTION_NAME.matcher(state.peek().strip());
        if (!nameMatcher.matches()) {
            return true;
        }

        String sectionName = nameMatcher.group(1);
        if (isMetaSection(sectionName)) {
            log.debug("Skipping metadata banner: {}", sectionName);
        } else {
            state.enterSection(sectionName);
            role.openSection(sectionName);
        }

        state.skip();
        if (state.hasNext() && isDelimiter(state.peek())) {
            state.skip();
        }
        return true;
    }

    private boolean handleSubsectionStart(ParserState state, RoleAccumulator role, String line) {
        Matcher matcher = SUBSECTION_START.matcher(line.strip());
        if (!matcher.matches()) {
            return false;
        }
        state.enterSubsection(matcher.group(1));
        return true;
    }

    private boolean handleSubsectionEnd(ParserState state, RoleAccumulator role, String line) {
        if (!SUBSECTION_END.matcher(line.strip()).matches()) {
            return false;
        }
        state.leaveSubsection();
        return true;
    }

    private boolean handleComment(ParserState state, RoleAccumulator role, String line) {
        String trimmed = line.strip();
        if (!trimmed.startsWith("#") || isDelimiter(trimmed)) {
            return false;
        }

        String text = trimmed.substring(1).strip();
        Matcher global = GLOBAL_PREFIX.matcher(text);
        if (global.find()) {
            state.appendGlobalComment(global.replaceFirst(""));
        } else {
            state.appendPendingComment(text);
        }
        return true;
    }

    private boolean handleVariable(ParserState state, RoleAccumulator role, String line) {
        Matcher matcher = VARIABLE.matcher(line);
        if (!matcher.matches()) {
            return false;
        }

        String name = matcher.group(1);
        int definitionIndex = state.getCursor() - 1;

        // значение читается и для пропускаемых переменных, чтобы не потерять позицию
        MultilineValue value = MultilineValueReader.read(state.getLines(), definitionIndex, matcher.group(2));
        state.setCursor(value.getNextLine());

        if (shouldSkipVariable(name, state.getPendingComment())) {
            log.debug("Excluding variable {} (line {})", name, definitionIndex + 1);
            state.setPendingComment("");
            return true;
        }

        Variable variable = Variable.builder()
                .name(name)
                .rawValue(value.joined())
                .section(state.getCurrentSection())
                .subsection(state.getCurrentSubsection())
                .comment(effectiveComment(state))
                .multiline(value.getLines().size() > 1)
                .valueLines(value.getLines())
                .lineNumber(definitionIndex + 1)
                .build();

        role.addVariable(variable, state.isInSubsection());
        state.setPendingComment("");
        return true;
    }

    // ===== Вспомогательные методы =====

    private String effectiveComment(ParserState state) {
        String pending = state.getPendingComment();
        String global = state.getGlobalComment();

        Matcher noGlobal = NO_GLOBAL_PREFIX.matcher(pending);
        if (noGlobal.find()) {
            return noGlobal.replaceFirst("");
        }
        if (!pending.isEmpty() && !global.isEmpty()) {
            return global + "\n" + pending;
        }
        return pending.isEmpty() ? global : pending;
    }

    private static boolean isDelimiter(String line) {
        return SECTION_DELIMITER.matcher(line.strip()).matches();
    }

    static boolean isMetaSection(String sectionName) {
        String lower = sectionName.toLowerCase(Locale.ROOT);
        return META_SECTION_MARKERS.stream().anyMatch(lower::contains);
    }

    static boolean shouldSkipVariable(String name, String pendingComment) {
        return name.contains(FOLDERS_LIST_MARKER)
                || SKIP_DOCS.matcher(pendingComment).find()
                || SKIP_INVENTORY.matcher(pendingComment).find();
    }

    @FunctionalInterface
    private interface LineHandler {
        boolean handle(ParserState state, RoleAccumulator role, String line);
    }

    /**
     * Накапливает секции, переменные и признаки роли во время разбора.
     */
    private static final class RoleAccumulator {

        private final Map<String, SectionAccumulator> sections = new LinkedHashMap<>();
        private final List<Variable> allVariables = new ArrayList<>();

        private boolean hasInstances;
        private String instancesVar = "";
        private boolean hasDefaultVars;
        private boolean ssoEnabled;
        private boolean hasDns;
        private boolean hasTraefik;
        private boolean hasDocker;
        private boolean hasWeb;
        private boolean hasThemePark;

        void openSection(String sectionName) {
            if (sections.containsKey(sectionName)) {
                return;
            }
            sections.put(sectionName, new SectionAccumulator(sectionName));

            switch (sectionName.toLowerCase(Locale.ROOT)) {
                case "dns" -> hasDns = true;
                case "traefik" -> hasTraefik = true;
                case "docker" -> hasDocker = true;
                case "web" -> hasWeb = true;
                default -> {
                }
            }
        }

        void addVariable(Variable variable, boolean inSubsection) {
            allVariables.add(variable);

            SectionAccumulator section = sections.get(variable.getSection());
            if (section != null) {
                if (inSubsection && !variable.getSubsection().isEmpty()) {
                    section.subsections
                            .computeIfAbsent(variable.getSubsection(), key -> new ArrayList<>())
                            .add(variable);
                } else {
                    section.variables.add(variable);
                }
            }

            String name = variable.getName();
            if (name.endsWith("_instances")) {
                hasInstances = true;
                instancesVar = name;
            }
            if (name.endsWith("_default") || name.endsWith("_custom")) {
                hasDefaultVars = true;
            }
            if (name.endsWith("_traefik_sso_middleware")
                    && variable.getRawValue().contains("traefik_default_sso_middleware")) {
                ssoEnabled = true;
            }
            if (name.contains("_themepark_")) {
                hasThemePark = true;
            }
        }

        RoleInfo build(String roleName, RepoType repoType) {
            Map<String, Section> builtSections = new LinkedHashMap<>();
            sections.forEach((name, section) -> builtSections.put(name, section.build()));

            return RoleInfo.builder()
                    .name(roleName)
                    .repoType(repoType)
                    .sections(Collections.unmodifiableMap(builtSections))
                    .sectionOrder(List.copyOf(sections.keySet()))
                    .allVariables(List.copyOf(allVariables))
                    .hasInstances(hasInstances)
                    .instancesVar(instancesVar)
                    .hasDefaultVars(hasDefaultVars)
                    .ssoEnabled(ssoEnabled)
                    .hasDns(hasDns)
                    .hasTraefik(hasTraefik)
                    .hasDocker(hasDocker)
                    .hasWeb(hasWeb)
                    .hasThemePark(hasThemePark)
                    .build();
        }
    }

    private static final class SectionAccumulator {

        private final String name;
        private final List<Variable> variables = new ArrayList<>();
        private final Map<String, List<Variable>> subsections = new LinkedHashMap<>();

        SectionAccumulator(String name) {
            this.name = name;
        }

        Section build() {
            Map<String, List<Variable>> builtSubsections = new LinkedHashMap<>();
            subsections.forEach((subName, vars) -> builtSubsections.put(subName, List.copyOf(vars)));

            return Section.builder()
                    .name(name)
                    .variables(List.copyOf(variables))
                    .subsections(Collections.unmodifiableMap(builtSubsections))
                    .subsectionOrder(List.copyOf(subsections.keySet()))
                    .build();
        }
    }
}
