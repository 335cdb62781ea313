package com.buildmender.controller;

import com.buildmender.service.BuildRepairService;
import com.buildmender.service.RepairRequest;
import com.buildmender.service.RepairResponse;
import com.buildmender.source.SourceFetchException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RepairController.class)
class RepairControllerTest {

    private static final String BODY = """
            {"projectUrl": "https://github.com/example/demo.git",
             "dependencyName": "guavaVersion",
             "dependencyValue": "33.0.0-jre"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BuildRepairService repairService;

    @Test
    void testSuccessfulRepair() throws Exception {
        when(repairService.updateAndBuild(any(RepairRequest.class))).thenReturn(new RepairResponse(
                "success", 1, "BUILD SUCCESSFUL", "replace /guavaVersion=.*/ in gradle.properties with: guavaVersion=33.0.0-jre",
                "SUCCESS", null));

        mockMvc.perform(post("/repair/update-and-build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.attempts").value(1))
                .andExpect(jsonPath("$.finalBuildOutput").value("BUILD SUCCESSFUL"))
                .andExpect(jsonPath("$.lastAppliedFix").exists())
                .andExpect(jsonPath("$.terminalState").value("SUCCESS"))
                .andExpect(jsonPath("$.failureReason").doesNotExist());
    }

    @Test
    void testFailedRepairIsStillOk() throws Exception {
        when(repairService.updateAndBuild(any(RepairRequest.class))).thenReturn(new RepairResponse(
                "failed", 3, "BUILD FAILED", null, "MAX_ATTEMPTS_EXHAUSTED", null));

        mockMvc.perform(post("/repair/update-and-build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.attempts").value(3))
                .andExpect(jsonPath("$.lastAppliedFix").doesNotExist());
    }

    @Test
    void testBlankFieldRejected() throws Exception {
        mockMvc.perform(post("/repair/update-and-build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectUrl\": \"https://github.com/example/demo.git\","
                                + " \"dependencyName\": \" \", \"dependencyValue\": \"1.0\"}"))
                .andExpect(status().isBadRequest());

        verify(repairService, never()).updateAndBuild(any());
    }

    @Test
    void testMissingFieldRejected() throws Exception {
        mockMvc.perform(post("/repair/update-and-build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectUrl\": \"https://github.com/example/demo.git\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUnusableUrlRejected() throws Exception {
        when(repairService.updateAndBuild(any(RepairRequest.class)))
                .thenThrow(new IllegalArgumentException("Cannot derive a project name"));

        mockMvc.perform(post("/repair/update-and-build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSourceFetchFailureIsBadGateway() throws Exception {
        when(repairService.updateAndBuild(any(RepairRequest.class)))
                .thenThrow(new SourceFetchException("git clone failed with exit code 128"));

        mockMvc.perform(post("/repair/update-and-build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.failureReason").value("source-fetch"));
    }
}
