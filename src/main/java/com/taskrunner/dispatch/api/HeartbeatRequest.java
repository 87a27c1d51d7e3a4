package com.taskrunner.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Inbound JSON body for POST /api/v1/nodes/{id}/heartbeat. */
public record HeartbeatRequest(
    @JsonProperty("cpu_percent") @JsonAlias("cpuPercent") Double cpuPercent,
    @JsonProperty("memory_percent") @JsonAlias("memoryPercent") Double memoryPercent
) {}
