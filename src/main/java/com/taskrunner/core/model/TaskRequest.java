package com.taskrunner.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * What a user submits. Optional fields may be {@code null}; the orchestrator
 * applies defaults when the task is created.
 *
 * @param userId          owner of the task and of any node provisioned for it
 * @param title           short human-readable title
 * @param prompt          instructions handed to the coding agent
 * @param repository      repository the workspace is created from
 * @param branch          base branch to check out
 * @param vmSize          preferred node size
 * @param vmLocation      preferred node location
 * @param preferredNodeId explicit node to run on, bypassing selection
 * @param priority        higher runs first when ordering is relevant
 * @param dependsOn       ids of tasks that must complete first; repeated ids collapse to one
 * @param draft           create the task as a draft instead of queueing it
 */
public record TaskRequest(
        String userId,
        String title,
        String prompt,
        String repository,
        String branch,
        NodeSize vmSize,
        String vmLocation,
        String preferredNodeId,
        int priority,
        List<String> dependsOn,
        boolean draft
) {
    public TaskRequest {
        // null entries survive here and are rejected by submit validation
        dependsOn = dependsOn == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(dependsOn)));
    }

    public static TaskRequest of(String userId, String repository, String prompt) {
        return new TaskRequest(userId, null, prompt, repository, null, null, null, null, 0, List.of(), false);
    }
}
