package com.taskrunner.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param prompt          instructions for the agent; {@code description} is accepted as an alias
 * @param vmSize          small, medium or large; nullable, defaults to medium
 * @param preferredNodeId run on this node instead of selecting one; nullable
 * @param dependsOn       ids of tasks that must complete first; nullable
 * @param draft           keep the task as a draft instead of queueing it
 */
public record SubmitTaskRequest(
    @JsonProperty("user_id") String userId,
    String title,
    @JsonAlias("description") String prompt,
    String repository,
    String branch,
    @JsonProperty("vm_size") String vmSize,
    @JsonProperty("vm_location") String vmLocation,
    @JsonProperty("preferred_node_id") String preferredNodeId,
    Integer priority,
    @JsonProperty("depends_on") List<String> dependsOn,
    Boolean draft
) {}
