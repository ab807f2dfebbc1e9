package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.cache.ResultCache;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit lookup in the agent's own cache. A miss is a valid result ({@code found=false}).
 */
public class CacheLookupTool implements AgentTool {

    private final ResultCache cache;

    public CacheLookupTool(ResultCache cache) {
        this.cache = cache;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.CACHE_LOOKUP;
    }

    @Override
    public String getDescription() {
        return "Look up a previously stored value by key";
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String key = ToolParams.string(params, "key", "");
        Optional<Object> value = cache.get(key);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("key", key);
        result.put("found", value.isPresent());
        result.put("value", value.orElse(null));
        return result;
    }
}
