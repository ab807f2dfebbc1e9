package com.deepansh.explorer.agent;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Agents the supervisor can run. Each run gets a fresh agent instance.
 */
public enum AgentType {

    DOCUMENTATION(DocumentationAgent::new),
    CODEBASE(CodebaseAgent::new),
    ARCHITECTURE(ArchitectureAgent::new);

    private final Supplier<RepositoryAgent> factory;

    AgentType(Supplier<RepositoryAgent> factory) {
        this.factory = factory;
    }

    public RepositoryAgent newAgent() {
        return factory.get();
    }

    @JsonCreator
    public static AgentType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent type: " + value));
    }
}
