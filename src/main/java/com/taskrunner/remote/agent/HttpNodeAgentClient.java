package com.taskrunner.remote.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.security.JwtTokenService;
import com.taskrunner.remote.NodeAgentClient;
import com.taskrunner.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP/JSON client for the node agent listening on {@code http://<node ip>:<agent port>}.
 * Every request carries a Bearer node token scoped to the target node.
 */
public class HttpNodeAgentClient implements NodeAgentClient {

    private static final Logger log = LoggerFactory.getLogger(HttpNodeAgentClient.class);

    private final TaskRunnerProperties.Agent settings;
    private final JwtTokenService tokenService;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpNodeAgentClient(TaskRunnerProperties.Agent settings, JwtTokenService tokenService) {
        this(settings, tokenService, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    HttpNodeAgentClient(TaskRunnerProperties.Agent settings, JwtTokenService tokenService, HttpClient httpClient) {
        this.settings = settings;
        this.tokenService = tokenService;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean reachable(Node node) {
        if (node.ipAddress() == null) {
            return false;
        }
        try {
            var request = authorized(node, "/health")
                    .timeout(settings.getProbeTimeout())
                    .GET()
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Node {} agent not reachable yet: {}", node.id(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void createWorkspace(Node node, WorkspaceRequest workspace) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workspaceId", workspace.workspaceId());
        body.put("taskId", workspace.taskId());
        body.put("repository", workspace.repository());
        body.put("branch", workspace.branch());
        body.put("outputBranch", workspace.outputBranch());
        body.put("callbackToken", workspace.callbackToken());
        body.put("callbackUrl", workspace.callbackUrl());
        post(node, "/workspaces", body, workspace.workspaceId(), "Create workspace");
    }

    @Override
    public void createAgentSession(Node node, String workspaceId, String sessionId, String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("sessionId", sessionId);
        body.put("prompt", prompt);
        post(node, "/workspaces/" + workspaceId + "/agent-sessions", body, sessionId, "Create agent session");
    }

    @Override
    public void stopWorkspace(Node node, String workspaceId) {
        post(node, "/workspaces/" + workspaceId + "/stop", objectMapper.createObjectNode(), null, "Stop workspace");
    }

    private void post(Node node, String path, ObjectNode body, String idempotencyKey, String operation) {
        if (node.ipAddress() == null) {
            throw new RemoteCallException(operation + ": node " + node.id() + " has no address", false);
        }
        try {
            var builder = authorized(node, path)
                    .timeout(settings.getRequestTimeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
            if (idempotencyKey != null) {
                builder.header("Idempotency-Key", idempotencyKey);
            }
            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw RemoteCallException.forStatus(operation, response.statusCode(), response.body());
            }
            log.debug("{} on node {} accepted (HTTP {})", operation, node.id(), response.statusCode());
        } catch (IOException e) {
            throw new RemoteCallException(operation + " on node " + node.id() + " failed: " + e.getMessage(),
                    true, -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(operation + " interrupted", false, -1, e);
        }
    }

    private HttpRequest.Builder authorized(Node node, String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create("http://" + node.ipAddress() + ":" + settings.getPort() + path))
                .header("Authorization", "Bearer " + tokenService.generateNodeToken(node.id(), node.userId()))
                .header("Accept", "application/json");
    }
}
