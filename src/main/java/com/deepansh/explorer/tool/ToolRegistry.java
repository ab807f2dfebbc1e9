package com.deepansh.explorer.tool;

import com.deepansh.explorer.model.ActionType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Strategy table from action kind to tool, populated at construction.
 *
 * One registry per agent: the cache tools are bound to the agent's own cache.
 */
@Slf4j
public class ToolRegistry {

    private final Map<ActionType, AgentTool> tools = new EnumMap<>(ActionType.class);

    public ToolRegistry(List<AgentTool> toolList) {
        toolList.forEach(this::register);
        log.debug("Total tools registered: {}", tools.size());
    }

    public void register(AgentTool tool) {
        AgentTool previous = tools.put(tool.getActionType(), tool);
        if (previous != null) {
            log.warn("Tool for [{}] replaced: {} -> {}", tool.getActionType().getValue(),
                    previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
        }
        log.debug("Registered tool: [{}] {}", tool.getActionType().getValue(), tool.getDescription());
    }

    public Optional<AgentTool> find(ActionType type) {
        return Optional.ofNullable(tools.get(type));
    }

    public Set<ActionType> availableTypes() {
        return Collections.unmodifiableSet(tools.keySet());
    }

    public int toolCount() {
        return tools.size();
    }
}
