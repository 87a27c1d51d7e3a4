package com.taskrunner.dispatch.api;

import com.taskrunner.core.node.NodeLifecycleManager;
import com.taskrunner.core.node.NodeNotFoundException;
import com.taskrunner.core.security.JwtTokenService;
import com.taskrunner.core.store.NodeStore;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to a user's nodes, plus the heartbeat endpoint node agents report to.
 */
@RestController
@RequestMapping("/api/v1/nodes")
public class NodeController {

    private final NodeStore nodeStore;
    private final NodeLifecycleManager lifecycle;
    private final JwtTokenService tokenService;

    public NodeController(NodeStore nodeStore, NodeLifecycleManager lifecycle, JwtTokenService tokenService) {
        this.nodeStore = nodeStore;
        this.lifecycle = lifecycle;
        this.tokenService = tokenService;
    }

    @GetMapping
    public List<NodeResponse> list(@RequestParam("userId") String userId) {
        return nodeStore.findByUser(userId).stream().map(NodeResponse::from).toList();
    }

    @GetMapping("/{nodeId}")
    public NodeResponse get(@PathVariable String nodeId) {
        return nodeStore.findById(nodeId).map(NodeResponse::from)
                .orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    /** POST /api/v1/nodes/{id}/heartbeat: authenticated with the node's own token. */
    @PostMapping("/{nodeId}/heartbeat")
    public NodeResponse heartbeat(@PathVariable String nodeId,
                                  @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                  @RequestBody HeartbeatRequest request) {
        tokenService.verifyNode(auth, nodeId);
        return NodeResponse.from(lifecycle.recordHeartbeat(nodeId, request.cpuPercent(), request.memoryPercent()));
    }
}
