package com.taskrunner.core.orchestrator;

import com.taskrunner.core.model.CallbackKind;

import java.util.Locale;

/**
 * Status report posted by the remote agent once a session produced a result.
 *
 * @param status       {@code awaiting_followup}, {@code completed} or {@code failed}
 * @param outputBranch branch the agent pushed to, if any
 * @param prUrl        pull request opened by the agent, if any
 * @param reason       failure reason, kept verbatim
 */
public record AgentStatusReport(String status, String outputBranch, String prUrl, String reason) {

    public CallbackKind kind() {
        if (status == null) {
            throw new TaskValidationException("Agent status is required");
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "awaiting_followup" -> CallbackKind.AGENT_AWAITING_FOLLOWUP;
            case "completed" -> CallbackKind.AGENT_COMPLETED;
            case "failed" -> CallbackKind.AGENT_FAILED;
            default -> throw new TaskValidationException("Unknown agent status: " + status);
        };
    }
}
