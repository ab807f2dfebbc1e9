package com.deepansh.explorer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplorationResponse {

    private String repositoryPath;
    private String goal;

    /** One result per agent, in request order */
    @Builder.Default
    private List<LoopResult> results = new ArrayList<>();

    private boolean goalAchieved;
    private long elapsedMs;
}
