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
import java.util.Map;

/**
 * Lists the entries under a repository directory up to a maximum depth.
 *
 * Parameters: directory (default "." for the root), max_depth (default 2, 0 = direct children only).
 */
@Slf4j
public class ScanDirectoryTool implements AgentTool {

    private final CodeRepository repository;

    public ScanDirectoryTool(CodeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.SCAN_DIRECTORY;
    }

    @Override
    public String getDescription() {
        return "Scan a directory and return its files and sub-directories";
    }

    @Override
    public Object execute(Map<String, Object> params) throws IOException {
        String directory = ToolParams.string(params, "directory", ".");
        int maxDepth = ToolParams.integer(params, "max_depth", 2);
        String prefix = RepositoryPaths.directoryPrefix(directory);

        List<Map<String, Object>> contents = new ArrayList<>();
        int files = 0;
        int directories = 0;

        for (RepositoryFile entry : repository.walk()) {
            if (!entry.path().startsWith(prefix)) {
                continue;
            }
            int depth = RepositoryPaths.depth(entry.path().substring(prefix.length()));
            if (depth > maxDepth) {
                continue;
            }

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("path", entry.path());
            item.put("is_directory", entry.directory());
            item.put("size", entry.directory() ? 0L : entry.size());
            contents.add(item);

            if (entry.directory()) {
                directories++;
            } else {
                files++;
            }
        }

        log.debug("Scanned [{}] depth={} -> {} files, {} dirs", directory, maxDepth, files, directories);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("directory", directory);
        result.put("contents", contents);
        result.put("total_files", files);
        result.put("total_directories", directories);
        return result;
    }
}
