package com.deepansh.explorer.api;

import com.deepansh.explorer.exception.ExplorationException;
import com.deepansh.explorer.exception.GlobalExceptionHandler;
import com.deepansh.explorer.model.ExplorationRequest;
import com.deepansh.explorer.model.ExplorationResponse;
import com.deepansh.explorer.model.LoopResult;
import com.deepansh.explorer.model.TerminationReason;
import com.deepansh.explorer.service.ExplorationSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ExplorationControllerTest {

    private ExplorationSupervisor supervisor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        supervisor = mock(ExplorationSupervisor.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ExplorationController(supervisor))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void explore_returnsAgentResults() throws Exception {
        when(supervisor.explore(any(ExplorationRequest.class))).thenReturn(ExplorationResponse.builder()
                .repositoryPath("/repo")
                .goal("map it")
                .goalAchieved(true)
                .results(List.of(LoopResult.builder()
                        .agentName("CodebaseAgent")
                        .iterations(4)
                        .goalAchieved(true)
                        .terminationReason(TerminationReason.GOAL_ACHIEVED)
                        .build()))
                .build());

        mockMvc.perform(post("/api/v1/explorations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repositoryPath\":\"/repo\",\"goal\":\"map it\",\"agents\":[\"codebase\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.goalAchieved").value(true))
                .andExpect(jsonPath("$.results[0].agentName").value("CodebaseAgent"))
                .andExpect(jsonPath("$.results[0].terminationReason").value("GOAL_ACHIEVED"));
    }

    @Test
    void explore_blankGoal_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/explorations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repositoryPath\":\"/repo\",\"goal\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("goal: goal must not be blank"));

        verifyNoInteractions(supervisor);
    }

    @Test
    void explore_rejectedRepository_isBadRequest() throws Exception {
        when(supervisor.explore(any(ExplorationRequest.class)))
                .thenThrow(new ExplorationException("Repository path is not a directory: /nope"));

        mockMvc.perform(post("/api/v1/explorations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repositoryPath\":\"/nope\",\"goal\":\"g\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Repository path is not a directory: /nope"));
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/v1/explorations/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
