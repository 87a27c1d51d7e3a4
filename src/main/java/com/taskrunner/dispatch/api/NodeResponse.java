package com.taskrunner.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskrunner.core.model.Node;

public record NodeResponse(
    String id,
    @JsonProperty("user_id") String userId,
    String status,
    String size,
    String location,
    @JsonProperty("ip_address") String ipAddress,
    String health,
    @JsonProperty("cpu_percent") Double cpuPercent,
    @JsonProperty("memory_percent") Double memoryPercent,
    @JsonProperty("last_heartbeat_at") String lastHeartbeatAt,
    @JsonProperty("warm_since") String warmSince,
    @JsonProperty("auto_provisioned") boolean autoProvisioned,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("created_at") String createdAt
) {
    public static NodeResponse from(Node node) {
        return new NodeResponse(node.id(), node.userId(), node.status().wireName(),
                node.size() == null ? null : node.size().wireName(), node.location(), node.ipAddress(),
                node.health().wireName(), node.cpuPercent(), node.memoryPercent(),
                node.lastHeartbeatAt() == null ? null : node.lastHeartbeatAt().toString(),
                node.warmSince() == null ? null : node.warmSince().toString(),
                node.autoProvisioned(), node.errorMessage(), String.valueOf(node.createdAt()));
    }
}
