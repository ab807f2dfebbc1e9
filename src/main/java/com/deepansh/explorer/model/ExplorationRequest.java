package com.deepansh.explorer.model;

import com.deepansh.explorer.agent.AgentType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ExplorationRequest {

    @NotBlank(message = "repositoryPath must not be blank")
    private String repositoryPath;

    @NotBlank(message = "goal must not be blank")
    private String goal;

    /**
     * Agents to run. More than one runs them concurrently, each with its own cache.
     * Defaults to the documentation agent when empty.
     */
    private List<AgentType> agents = new ArrayList<>();

    /** Optional override of the configured iteration budget */
    @Min(value = 1, message = "maxIterations must be positive")
    private Integer maxIterations;
}
