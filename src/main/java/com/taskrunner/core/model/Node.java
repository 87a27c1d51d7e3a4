package com.taskrunner.core.model;

import java.time.Instant;

/**
 * A provisioned virtual machine that hosts workspaces.
 *
 * @param providerId      handle returned by the provisioner, {@code null} until provisioned
 * @param cpuPercent      last reported CPU load, {@code null} if never reported
 * @param memoryPercent   last reported memory load, {@code null} if never reported
 * @param warmSince       set only while {@code status == WARM}
 * @param autoProvisioned whether the engine created the node (and may therefore recycle it)
 */
public record Node(
        String id,
        String userId,
        NodeStatus status,
        NodeSize size,
        String location,
        String providerId,
        String ipAddress,
        NodeHealth health,
        Double cpuPercent,
        Double memoryPercent,
        Instant lastHeartbeatAt,
        Instant warmSince,
        boolean autoProvisioned,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {
    public boolean hasMetrics() {
        return cpuPercent != null && memoryPercent != null;
    }
}
