package com.oracle.optmcts.controller;

import com.oracle.optmcts.config.OptMctsConfig;
import com.oracle.optmcts.model.SolveRequest;
import com.oracle.optmcts.model.SolveResponse;
import com.oracle.optmcts.search.SolveStatus;
import com.oracle.optmcts.service.OptMctsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class OptMctsControllerTest {

    static class StubService extends OptMctsService {
        RuntimeException failure;

        StubService() {
            super(null, new OptMctsConfig());
        }

        @Override
        public SolveResponse solve(SolveRequest request) {
            if (failure != null) {
                throw failure;
            }
            return SolveResponse.builder()
                    .problem(request.getProblem())
                    .status(SolveStatus.BEST_EFFORT)
                    .bestFormulation(Map.of("type", "Linear program"))
                    .bestReward(0.74)
                    .iterationsRun(request.getIterationBudget() == null ? 20 : request.getIterationBudget())
                    .build();
        }
    }

    private StubService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = new StubService();
        mockMvc = MockMvcBuilders.standaloneSetup(new OptMctsController(service)).build();
    }

    @Test
    void solveReturnsTheSearchResult() throws Exception {
        mockMvc.perform(post("/api/v1/optmcts/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\": \"Maximize profit\", \"iterationBudget\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("BEST_EFFORT"))
                .andExpect(jsonPath("$.bestFormulation.type").value("Linear program"))
                .andExpect(jsonPath("$.iterationsRun").value(5));
    }

    @Test
    void blankProblemIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/optmcts/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problem").value("Problem statement cannot be blank"));
    }

    @Test
    void outOfRangeOverridesAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/optmcts/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\": \"p\", \"iterationBudget\": 500, \"reexpansionThreshold\": 1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.iterationBudget").exists())
                .andExpect(jsonPath("$.reexpansionThreshold").exists());
    }

    @Test
    void unexpectedFailuresAreServerErrors() throws Exception {
        service.failure = new IllegalStateException("No ChatModel bean available");

        mockMvc.perform(post("/api/v1/optmcts/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\": \"p\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("IllegalStateException"));
    }

    @Test
    void internalArgumentErrorsAreNotBlamedOnTheClient() throws Exception {
        service.failure = new IllegalArgumentException("Cannot expand a complete formulation");

        mockMvc.perform(post("/api/v1/optmcts/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\": \"p\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("IllegalArgumentException"));
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/optmcts/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void healthIsUp() throws Exception {
        mockMvc.perform(get("/api/v1/optmcts/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
