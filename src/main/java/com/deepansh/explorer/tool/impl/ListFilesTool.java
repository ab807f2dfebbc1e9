package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.repo.CodeRepository;
import com.deepansh.explorer.repo.RepositoryFile;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists files (no directories) whose path contains {@code pattern}. "*" matches everything.
 */
public class ListFilesTool implements AgentTool {

    private final CodeRepository repository;

    public ListFilesTool(CodeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.LIST_FILES;
    }

    @Override
    public String getDescription() {
        return "List files whose path contains a pattern, optionally under a directory";
    }

    @Override
    public Object execute(Map<String, Object> params) throws IOException {
        String pattern = ToolParams.string(params, "pattern", "*");
        String directory = ToolParams.string(params, "directory", ".");
        String prefix = RepositoryPaths.directoryPrefix(directory);

        List<Map<String, Object>> files = new ArrayList<>();
        for (RepositoryFile entry : repository.walk()) {
            if (entry.directory() || !entry.path().startsWith(prefix)) {
                continue;
            }
            if (pattern.equals("*") || entry.path().contains(pattern)) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("path", entry.path());
                item.put("size", entry.size());
                item.put("extension", entry.extension());
                files.add(item);
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("pattern", pattern);
        result.put("directory", directory);
        result.put("files", files);
        result.put("count", files.size());
        return result;
    }
}
