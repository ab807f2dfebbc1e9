package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.cache.ResultCache;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores an arbitrary value in the agent's own cache under {@code key}.
 */
public class CacheStoreTool implements AgentTool {

    private final ResultCache cache;

    public CacheStoreTool(ResultCache cache) {
        this.cache = cache;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.CACHE_STORE;
    }

    @Override
    public String getDescription() {
        return "Store a value in the cache under a key";
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String key = ToolParams.string(params, "key", "");
        cache.set(key, params.get("value"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("key", key);
        result.put("stored", true);
        return result;
    }
}
