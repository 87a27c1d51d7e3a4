package com.taskrunner.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskrunner.core.orchestrator.AgentStatusReport;

/**
 * Inbound JSON body for POST /api/v1/callbacks/workspaces/{id}/agent-status.
 *
 * @param status awaiting_followup, completed or failed
 */
public record AgentStatusRequest(
    String status,
    @JsonProperty("output_branch") String outputBranch,
    @JsonProperty("pr_url") String prUrl,
    String reason
) {
    AgentStatusReport toReport() {
        return new AgentStatusReport(status, outputBranch, prUrl, reason);
    }
}
