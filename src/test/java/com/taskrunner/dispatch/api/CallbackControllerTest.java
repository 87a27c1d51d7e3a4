package com.taskrunner.dispatch.api;

import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.orchestrator.AgentStatusReport;
import com.taskrunner.core.orchestrator.CallbackResult;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import com.taskrunner.core.security.InvalidCallbackTokenException;
import com.taskrunner.core.security.JwtTokenService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CallbackController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class CallbackControllerTest {

    private static final String AUTH = "Bearer callback-token";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskOrchestrator orchestrator;

    @MockitoBean
    private JwtTokenService tokenService;

    @Test
    @DisplayName("ready routes to the task named by the token and reports the disposition")
    void ready() throws Exception {
        when(tokenService.verifyCallback(AUTH, "ws-1")).thenReturn("t-1");
        when(orchestrator.onWorkspaceReady("t-1", "ws-1")).thenReturn(new CallbackResult(
                "t-1", CallbackDisposition.ACCEPTED, TaskStatus.IN_PROGRESS, ExecutionStep.RUNNING));

        mockMvc.perform(post("/api/v1/callbacks/workspaces/ws-1/ready")
                        .header(HttpHeaders.AUTHORIZATION, AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("t-1"))
                .andExpect(jsonPath("$.disposition").value("ACCEPTED"))
                .andExpect(jsonPath("$.status").value("in_progress"))
                .andExpect(jsonPath("$.executionStep").value("running"));
    }

    @Test
    @DisplayName("duplicate callbacks are still answered with 200")
    void duplicate() throws Exception {
        when(tokenService.verifyCallback(AUTH, "ws-1")).thenReturn("t-1");
        when(orchestrator.onWorkspaceReady("t-1", "ws-1")).thenReturn(new CallbackResult(
                "t-1", CallbackDisposition.DUPLICATE, TaskStatus.IN_PROGRESS, ExecutionStep.RUNNING));

        mockMvc.perform(post("/api/v1/callbacks/workspaces/ws-1/ready")
                        .header(HttpHeaders.AUTHORIZATION, AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.disposition").value("DUPLICATE"));
    }

    @Test
    @DisplayName("a missing or foreign token is rejected with 401 before reaching the task")
    void unauthorized() throws Exception {
        when(tokenService.verifyCallback(any(), eq("ws-1")))
                .thenThrow(new InvalidCallbackTokenException("Missing bearer token"));

        mockMvc.perform(post("/api/v1/callbacks/workspaces/ws-1/ready"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Missing bearer token"));

        verify(orchestrator, never()).onWorkspaceReady(anyString(), anyString());
    }

    @Test
    @DisplayName("provisioning-failed accepts an optional reason")
    void provisioningFailed() throws Exception {
        when(tokenService.verifyCallback(AUTH, "ws-1")).thenReturn("t-1");
        when(orchestrator.onProvisioningFailed(eq("t-1"), eq("ws-1"), any())).thenReturn(new CallbackResult(
                "t-1", CallbackDisposition.ACCEPTED, TaskStatus.FAILED, ExecutionStep.WORKSPACE_READY));

        mockMvc.perform(post("/api/v1/callbacks/workspaces/ws-1/provisioning-failed")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"clone failed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"));
        verify(orchestrator).onProvisioningFailed("t-1", "ws-1", "clone failed");

        mockMvc.perform(post("/api/v1/callbacks/workspaces/ws-1/provisioning-failed")
                        .header(HttpHeaders.AUTHORIZATION, AUTH))
                .andExpect(status().isOk());
        verify(orchestrator).onProvisioningFailed(eq("t-1"), eq("ws-1"), isNull());
    }

    @Test
    @DisplayName("agent-status maps the snake_case body onto a report")
    void agentStatus() throws Exception {
        when(tokenService.verifyCallback(AUTH, "ws-1")).thenReturn("t-1");
        var report = new AgentStatusReport("completed", "task/t-1", "https://github.com/acme/shop/pull/7", null);
        when(orchestrator.onAgentStatus("t-1", "ws-1", report)).thenReturn(new CallbackResult(
                "t-1", CallbackDisposition.ACCEPTED, TaskStatus.COMPLETED, ExecutionStep.RUNNING));

        mockMvc.perform(post("/api/v1/callbacks/workspaces/ws-1/agent-status")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "completed", "output_branch": "task/t-1",
                                 "pr_url": "https://github.com/acme/shop/pull/7"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));
    }
}
