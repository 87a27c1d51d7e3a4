package com.taskrunner.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskStatusEvent;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for task endpoints. {@code events} is only present on single-task reads.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
    String id,
    @JsonProperty("user_id") String userId,
    String title,
    String repository,
    String branch,
    @JsonProperty("vm_size") String vmSize,
    @JsonProperty("vm_location") String vmLocation,
    int priority,
    String status,
    @JsonProperty("execution_step") String executionStep,
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("auto_provisioned_node_id") String autoProvisionedNodeId,
    @JsonProperty("output_branch") String outputBranch,
    @JsonProperty("output_pr_url") String outputPrUrl,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("depends_on") List<String> dependsOn,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("completed_at") String completedAt,
    List<EventResponse> events
) {

    public record EventResponse(
        String from,
        String to,
        String actor,
        String reason,
        @JsonProperty("created_at") String createdAt
    ) {
        static EventResponse from(TaskStatusEvent event) {
            return new EventResponse(
                    event.fromStatus() == null ? null : event.fromStatus().wireName(),
                    event.toStatus().wireName(), event.actor(), event.reason(), String.valueOf(event.createdAt()));
        }
    }

    public static TaskResponse from(Task task) {
        return from(task, null);
    }

    public static TaskResponse from(Task task, List<TaskStatusEvent> events) {
        return new TaskResponse(
                task.id(), task.userId(), task.title(), task.repository(), task.branch(),
                task.vmSize() == null ? null : task.vmSize().wireName(), task.vmLocation(), task.priority(),
                task.status().wireName(), task.executionStep().wireName(),
                task.nodeId(), task.workspaceId(), task.sessionId(), task.autoProvisionedNodeId(),
                task.outputBranch(), task.outputPrUrl(), task.errorMessage(), task.dependencies(),
                stamp(task.createdAt()), stamp(task.updatedAt()), stamp(task.startedAt()), stamp(task.completedAt()),
                events == null ? null : events.stream().map(EventResponse::from).toList());
    }

    private static String stamp(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
