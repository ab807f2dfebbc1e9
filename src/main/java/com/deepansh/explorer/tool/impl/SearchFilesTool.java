package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.repo.CodeRepository;
import com.deepansh.explorer.repo.RepositoryFile;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive substring search across repository files.
 *
 * Parameters: pattern (required), file_types (suffixes such as ".py"), max_results (default 50).
 * Each hit lists at most {@value #MAX_MATCHES_PER_FILE} matching lines; unreadable files are skipped.
 */
@Slf4j
public class SearchFilesTool implements AgentTool {

    static final int MAX_MATCHES_PER_FILE = 10;

    private final CodeRepository repository;

    public SearchFilesTool(CodeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.SEARCH_FILES;
    }

    @Override
    public String getDescription() {
        return "Search file contents for a pattern (case-insensitive)";
    }

    @Override
    public Object execute(Map<String, Object> params) throws IOException {
        String pattern = ToolParams.string(params, "pattern", "");
        List<String> fileTypes = ToolParams.stringList(params, "file_types");
        int maxResults = ToolParams.integer(params, "max_results", 50);
        String needle = pattern.toLowerCase(Locale.ROOT);

        List<Map<String, Object>> results = new ArrayList<>();
        for (RepositoryFile entry : repository.walk()) {
            if (results.size() >= maxResults) {
                break;
            }
            if (entry.directory() || !matchesType(entry, fileTypes)) {
                continue;
            }

            String content;
            try {
                content = repository.readFile(entry.path());
            } catch (IOException | SecurityException e) {
                log.debug("Skipping unreadable file {}: {}", entry.path(), e.getMessage());
                continue;
            }
            if (!content.toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }

            List<Map<String, Object>> matches = new ArrayList<>();
            String[] lines = content.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].toLowerCase(Locale.ROOT).contains(needle)) {
                    Map<String, Object> match = new LinkedHashMap<>();
                    match.put("line_num", i + 1);
                    match.put("content", lines[i].strip());
                    matches.add(match);
                }
            }

            Map<String, Object> hit = new LinkedHashMap<>();
            hit.put("file_path", entry.path());
            hit.put("matches", new ArrayList<>(matches.subList(0, Math.min(MAX_MATCHES_PER_FILE, matches.size()))));
            hit.put("total_matches", matches.size());
            results.add(hit);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("pattern", pattern);
        result.put("file_types", fileTypes);
        result.put("results", results);
        result.put("total_files_searched", results.size());
        return result;
    }

    private boolean matchesType(RepositoryFile entry, List<String> fileTypes) {
        return fileTypes.isEmpty() || fileTypes.stream().anyMatch(entry.path()::endsWith);
    }
}
