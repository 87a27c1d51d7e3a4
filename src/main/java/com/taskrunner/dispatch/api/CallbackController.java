package com.taskrunner.dispatch.api;

import com.taskrunner.core.orchestrator.CallbackResult;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import com.taskrunner.core.security.JwtTokenService;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound callbacks from the remote execution agent. Each call carries the callback token
 * issued for its workspace; the token names the task the callback is routed to.
 * <p>
 * Delivery is at-least-once, so every authenticated callback is answered with 200 and its
 * disposition, including duplicates and stale ones.
 */
@RestController
@RequestMapping("/api/v1/callbacks/workspaces/{workspaceId}")
public class CallbackController {

    private final TaskOrchestrator orchestrator;
    private final JwtTokenService tokenService;

    public CallbackController(TaskOrchestrator orchestrator, JwtTokenService tokenService) {
        this.orchestrator = orchestrator;
        this.tokenService = tokenService;
    }

    @PostMapping("/ready")
    public CallbackResult ready(@PathVariable String workspaceId,
                                @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth) {
        String taskId = tokenService.verifyCallback(auth, workspaceId);
        return orchestrator.onWorkspaceReady(taskId, workspaceId);
    }

    @PostMapping("/provisioning-failed")
    public CallbackResult provisioningFailed(@PathVariable String workspaceId,
                                             @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false)
                                             String auth,
                                             @RequestBody(required = false) ProvisioningFailedRequest request) {
        String taskId = tokenService.verifyCallback(auth, workspaceId);
        return orchestrator.onProvisioningFailed(taskId, workspaceId, request == null ? null : request.reason());
    }

    @PostMapping("/agent-status")
    public CallbackResult agentStatus(@PathVariable String workspaceId,
                                      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                      @RequestBody AgentStatusRequest request) {
        String taskId = tokenService.verifyCallback(auth, workspaceId);
        return orchestrator.onAgentStatus(taskId, workspaceId, request.toReport());
    }
}
