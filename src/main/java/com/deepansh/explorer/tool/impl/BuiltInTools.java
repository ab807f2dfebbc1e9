package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.cache.ResultCache;
import com.deepansh.explorer.llm.LlmClient;
import com.deepansh.explorer.repo.CodeRepository;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolRegistry;

import java.util.List;

/**
 * Builds the registry of all nine built-in tools for one agent.
 */
public final class BuiltInTools {

    private BuiltInTools() {
    }

    /**
     * @param cache     the agent's own cache, used by the explicit cache tools
     * @param llmClient may be null; the LLM tools then answer heuristically
     */
    public static ToolRegistry registry(CodeRepository repository, ResultCache cache,
                                        LlmClient llmClient, String agentName) {
        List<AgentTool> tools = List.of(
                new ScanDirectoryTool(repository),
                new ListFilesTool(repository),
                new ReadFileTool(repository),
                new SearchFilesTool(repository),
                new AnalyzeCodeTool(repository),
                new LlmReasoningTool(llmClient, agentName.toLowerCase()),
                new LlmSummaryTool(llmClient),
                new CacheLookupTool(cache),
                new CacheStoreTool(cache));
        return new ToolRegistry(tools);
    }
}
