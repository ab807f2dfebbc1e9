package com.deepansh.explorer.agent;

import com.deepansh.explorer.core.LoopState;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.Observation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps a repository's architecture: layers, components, frameworks, design patterns
 * and data flows.
 *
 * Plan: scan the tree (layers from directories, components from file paths), read the
 * build/config files to detect frameworks, search for entry points, run one
 * goal-specific layer search, read up to {@value #MAX_COMPONENT_FILES} component files
 * (entry points first), then summarize.
 *
 * Path matching works on lower-cased path tokens, so "requirements.txt" is not a UI file.
 */
@Slf4j
public class ArchitectureAgent extends RepositoryAgent {

    static final int MAX_CONFIG_FILES = 3;
    static final int MAX_COMPONENT_FILES = 3;

    private static final String SCAN = "Scan repository structure for architectural analysis";
    private static final String ENTRY_SEARCH = "Search for main application entry points";
    private static final String SUMMARY = "Summarize architecture findings";
    private static final String READ_CONFIG = "Read configuration file";
    private static final String READ_COMPONENT = "Read component file";

    private static final List<String> SOURCE_TYPES = List.of(".py", ".js", ".ts", ".java", ".go");

    private static final Map<String, List<String>> LAYER_KEYWORDS = orderedKeywords(
            "presentation", List.of("ui", "view", "views", "frontend", "client", "web", "gui"),
            "business", List.of("business", "service", "services", "logic", "core", "domain"),
            "data", List.of("data", "dal", "repository", "storage", "database", "db"),
            "infrastructure", List.of("infrastructure", "infra", "external", "adapters"),
            "api", List.of("api", "rest", "graphql", "endpoint", "routes"),
            "test", List.of("test", "tests", "testing", "spec", "e2e"),
            "config", List.of("config", "configuration", "settings", "env"));

    private static final Map<String, List<String>> COMPONENT_KEYWORDS = orderedKeywords(
            "api", List.of("api", "rest", "graphql", "endpoint", "route", "routes", "controller"),
            "service", List.of("service", "manager", "handler", "processor", "worker"),
            "model", List.of("model", "models", "entity", "dto", "schema"),
            "database", List.of("db", "database", "repository", "dao", "orm", "storage"),
            "ui", List.of("ui", "view", "component", "page", "template", "frontend"),
            "middleware", List.of("middleware", "filter", "interceptor", "guard"),
            "util", List.of("util", "utils", "helper", "helpers", "common", "shared"));

    private static final Set<String> CONFIG_FILE_NAMES = Set.of(
            "pom.xml", "build.gradle", "build.gradle.kts", "package.json", "pyproject.toml", "setup.py",
            "setup.cfg", "requirements.txt", "go.mod", "cargo.toml", "gemfile", "dockerfile",
            "docker-compose.yml", "docker-compose.yaml");

    private static final Map<String, String> FRAMEWORK_MARKERS = orderedMarkers(
            "spring-boot", "Spring Boot",
            "org.springframework", "Spring",
            "django", "Django",
            "flask", "Flask",
            "fastapi", "FastAPI",
            "sqlalchemy", "SQLAlchemy",
            "\"express\"", "Express",
            "\"react\"", "React",
            "@angular/core", "Angular",
            "gin-gonic", "Gin",
            "rails", "Rails",
            "actix", "Actix");

    private final Map<String, String> layers = new TreeMap<>();
    private final Map<String, List<String>> components = new LinkedHashMap<>();
    private final List<String> configFiles = new ArrayList<>();
    private final Set<String> entryPoints = new LinkedHashSet<>();
    private final Set<String> frameworks = new LinkedHashSet<>();
    private final Map<String, Set<String>> patterns = new TreeMap<>();
    private final Set<String> dataFlows = new LinkedHashSet<>();
    private final Set<String> attempted = new LinkedHashSet<>();
    private int filesSeen;
    private boolean finished;

    @Override
    public String getName() {
        return "ArchitectureAgent";
    }

    @Override
    public String reason(LoopState state) {
        if (!attempted.contains(SCAN)) {
            return "Start with the overall repository structure to identify architectural layers and components.";
        }
        if (nextConfigFile() != null) {
            return "Found " + configFiles.size() + " build/config files. Read them to learn the frameworks in use.";
        }
        if (!attempted.contains(ENTRY_SEARCH)) {
            return "Locate the application entry points.";
        }
        String layerSearch = goalLayerSearch(state.getGoal());
        if (layerSearch != null && !attempted.contains(layerSearchDescription(layerSearch))) {
            return "The goal mentions the " + layerSearch + " layer. Search for it explicitly.";
        }
        if (nextComponentFile() != null) {
            return "Identified " + components.size() + " component types. Read component files to detect design patterns.";
        }
        return "Components, layers and patterns are mapped. Synthesize the architecture.";
    }

    @Override
    public AgentAction planAction(LoopState state, String reasoning) {
        if (!attempted.contains(SCAN)) {
            return AgentAction.builder()
                    .type(ActionType.SCAN_DIRECTORY)
                    .description(SCAN)
                    .parameter("directory", ".")
                    .parameter("max_depth", 4)
                    .expectedOutcome("Architectural layers and main components")
                    .build();
        }

        String config = nextConfigFile();
        if (config != null) {
            return readFile(READ_CONFIG, config, 200);
        }

        if (!attempted.contains(ENTRY_SEARCH)) {
            return search(ENTRY_SEARCH, "main", SOURCE_TYPES, 10);
        }

        String layerSearch = goalLayerSearch(state.getGoal());
        if (layerSearch != null && !attempted.contains(layerSearchDescription(layerSearch))) {
            return search(layerSearchDescription(layerSearch), layerSearch, SOURCE_TYPES, 20);
        }

        String component = nextComponentFile();
        if (component != null) {
            return readFile(READ_COMPONENT, component, 200);
        }

        if (!attempted.contains(SUMMARY)) {
            return summarize(SUMMARY, String.join("\n", state.getObservations()), "architecture");
        }

        return askLlm("Ask LLM for architectural insights", state.getCurrentContext(),
                "What architectural insights follow from the current analysis of: " + state.getGoal() + "?");
    }

    @Override
    public void observe(LoopState state, Observation observation) {
        super.observe(state, observation);

        String actionTaken = observation.getActionTaken() != null ? observation.getActionTaken() : "";
        // a step is never repeated, whether it worked or not
        attempted.add(actionTaken);

        Object result = observation.getResult();
        if (observation.isSuccess() && result != null) {
            if (hasKey(result, "contents")) {
                mapStructure(listOf(result, "contents"));
            } else if (hasKey(result, "results")) {
                for (Map<String, Object> hit : listOf(result, "results")) {
                    String path = String.valueOf(hit.get("file_path"));
                    if (ENTRY_SEARCH.equals(actionTaken)) {
                        entryPoints.add(path);
                    }
                    listOf(hit, "matches").forEach(match -> detectPatterns(path, String.valueOf(match.get("content"))));
                }
            } else if (hasKey(result, "content") && stringOf(result, "file_path") != null) {
                String path = stringOf(result, "file_path");
                String content = stringOf(result, "content");
                if (actionTaken.startsWith(READ_CONFIG)) {
                    frameworks.addAll(detectFrameworks(content));
                } else {
                    detectPatterns(path, content);
                    detectDataFlows(path, content);
                }
            } else if (hasKey(result, "summary")) {
                state.getCurrentContext().put("architecture_summary", stringOf(result, "summary"));
                markFinished(state, "Architecture mapping " + COMPLETION_MARKER + ": " + components.size()
                        + " component types, " + patterns.size() + " patterns");
            }
        }

        if (attempted.contains(SCAN) && filesSeen == 0) {
            markFinished(state, "No files found, architecture mapping " + COMPLETION_MARKER);
        }
        state.getCurrentContext().put("architecture_layers", new TreeMap<>(layers));
        state.getCurrentContext().put("components_found", components.size());
        state.getCurrentContext().put("patterns_detected", new ArrayList<>(patterns.keySet()));
        state.getCurrentContext().put("frameworks", new ArrayList<>(frameworks));
    }

    @Override
    public String generateSummary(LoopState state) {
        if (filesSeen == 0) {
            return "No files found in the repository; nothing to map.";
        }

        StringBuilder summary = new StringBuilder("Architecture analysis summary:\n");
        summary.append("- Identified ").append(components.size()).append(" system components\n");
        summary.append("- Detected ").append(patterns.size()).append(" architectural patterns\n");
        summary.append("- Mapped ").append(dataFlows.size()).append(" data flows\n");
        summary.append("- Found ").append(layers.size()).append(" architectural layers\n");

        if (!components.isEmpty()) {
            List<String> types = new ArrayList<>();
            components.forEach((type, files) -> types.add(type + "(" + files.size() + ")"));
            summary.append("- Component types: ").append(String.join(", ", types)).append('\n');
        }
        if (!patterns.isEmpty()) {
            summary.append("- Patterns found: ").append(String.join(", ", patterns.keySet())).append('\n');
        }
        if (!layers.isEmpty()) {
            summary.append("- Architectural layers: ").append(String.join(", ", new TreeSet<>(layers.values())))
                    .append('\n');
        }
        if (!frameworks.isEmpty()) {
            summary.append("- Frameworks: ").append(String.join(", ", frameworks)).append('\n');
        }
        if (!entryPoints.isEmpty()) {
            summary.append("- Entry points: ").append(String.join(", ", entryPoints)).append('\n');
        }
        if (state.getCacheHits() > 0) {
            summary.append("- Cache hits: ").append(state.getCacheHits()).append('\n');
        }
        if (state.getErrorCount() > 0) {
            summary.append("- Errors encountered: ").append(state.getErrorCount()).append('\n');
        }
        return summary.toString().trim();
    }

    Map<String, String> getLayers() {
        return layers;
    }

    Map<String, List<String>> getComponents() {
        return components;
    }

    Map<String, Set<String>> getPatterns() {
        return patterns;
    }

    Set<String> getFrameworks() {
        return frameworks;
    }

    Set<String> getDataFlows() {
        return dataFlows;
    }

    private void mapStructure(List<Map<String, Object>> contents) {
        for (Map<String, Object> item : contents) {
            String path = String.valueOf(item.get("path"));
            if (Boolean.TRUE.equals(item.get("is_directory"))) {
                String layer = layerOf(path);
                if (layer != null) {
                    layers.put(path, layer);
                    log.info("Identified layer: {} -> {}", path, layer);
                }
                continue;
            }

            filesSeen++;
            if (isConfigFile(path)) {
                configFiles.add(path);
                continue;
            }
            String component = componentOf(path);
            if (component != null) {
                components.computeIfAbsent(component, c -> new ArrayList<>()).add(path);
                log.debug("Identified component file: {} -> {}", path, component);
            }
        }
    }

    private String nextConfigFile() {
        return configFiles.stream()
                .limit(MAX_CONFIG_FILES)
                .filter(path -> !attempted.contains(READ_CONFIG + ": " + path))
                .findFirst()
                .orElse(null);
    }

    private String nextComponentFile() {
        List<String> candidates = new ArrayList<>(entryPoints);
        components.values().forEach(candidates::addAll);
        return candidates.stream()
                .distinct()
                .limit(MAX_COMPONENT_FILES)
                .filter(path -> !attempted.contains(READ_COMPONENT + ": " + path))
                .findFirst()
                .orElse(null);
    }

    private void detectPatterns(String path, String content) {
        for (String pattern : patternsIn(content)) {
            if (patterns.computeIfAbsent(pattern, p -> new LinkedHashSet<>()).add(path)) {
                log.info("Detected pattern: {} in {}", pattern, path);
            }
        }
    }

    private void detectDataFlows(String path, String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        if (lower.contains("request") && lower.contains("response")) {
            dataFlows.add(path + " -> external_api (HTTP)");
        }
        if (containsWord(lower, "select") || containsWord(lower, "insert")
                || containsWord(lower, "update") || containsWord(lower, "delete")) {
            dataFlows.add(path + " -> database (SQL)");
        }
    }

    private void markFinished(LoopState state, String insight) {
        if (!finished) {
            finished = true;
            state.getObservations().add(insight);
        }
    }

    static String layerOf(String directory) {
        int slash = directory.lastIndexOf('/');
        return classify(directory.substring(slash + 1), LAYER_KEYWORDS);
    }

    static String componentOf(String path) {
        return classify(path, COMPONENT_KEYWORDS);
    }

    static boolean isConfigFile(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        return CONFIG_FILE_NAMES.contains(name)
                || (name.startsWith("application.")
                && (name.endsWith(".yml") || name.endsWith(".yaml") || name.endsWith(".properties")));
    }

    static Set<String> detectFrameworks(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        Set<String> found = new LinkedHashSet<>();
        FRAMEWORK_MARKERS.forEach((marker, framework) -> {
            if (lower.contains(marker)) {
                found.add(framework);
            }
        });
        return found;
    }

    static Set<String> patternsIn(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        Set<String> found = new TreeSet<>();
        if (countOf(lower, "model", "view", "controller") >= 2) {
            found.add("mvc");
        }
        if (countOf(lower, "service", "api", "endpoint", "docker", "kubernetes") >= 2) {
            found.add("microservices");
        }
        if (countOf(lower, "layer", "tier", "business", "presentation", "data") >= 2) {
            found.add("layered");
        }
        if (countOf(lower, "repository", "dao", "data access") >= 1) {
            found.add("repository");
        }
        if (countOf(lower, "factory", "builder") >= 1 && lower.contains("class")) {
            found.add("factory");
        }
        if (countOf(lower, "observer", "notify", "subscribe", "listener", "event") >= 2) {
            found.add("observer");
        }
        if (countOf(lower, "adapter", "wrapper") >= 1) {
            found.add("adapter");
        }
        if (countOf(lower, "strategy", "policy") >= 1) {
            found.add("strategy");
        }
        return found;
    }

    static String goalLayerSearch(String goal) {
        String lower = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        if (lower.contains("api")) return "api";
        if (lower.contains("service")) return "service";
        if (lower.contains("database") || lower.contains("data")) return "model";
        return null;
    }

    private static String layerSearchDescription(String pattern) {
        return "Search for " + pattern + "-related patterns";
    }

    private static String classify(String path, Map<String, List<String>> keywords) {
        String[] tokens = path.toLowerCase(Locale.ROOT).split("[^a-z0-9]+");
        for (Map.Entry<String, List<String>> entry : keywords.entrySet()) {
            for (String token : tokens) {
                if (!token.isEmpty() && entry.getValue().stream().anyMatch(k -> token.equals(k)
                        || token.startsWith(k) && k.length() > 3
                        || token.endsWith(k) && k.length() > 3)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private static int countOf(String content, String... keywords) {
        int count = 0;
        for (String keyword : keywords) {
            if (content.contains(keyword)) {
                count++;
            }
        }
        return count;
    }

    private static boolean containsWord(String content, String word) {
        return content.matches("(?s).*\\b" + word + "\\b.*");
    }

    private static Map<String, List<String>> orderedKeywords(Object... pairs) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> keywords = (List<String>) pairs[i + 1];
            map.put((String) pairs[i], keywords);
        }
        return map;
    }

    private static Map<String, String> orderedMarkers(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
