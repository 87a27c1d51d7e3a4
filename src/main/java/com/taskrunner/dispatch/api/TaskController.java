package com.taskrunner.dispatch.api;

import com.taskrunner.core.model.CallbackReceipt;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.RecoveryRecord;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskRequest;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import com.taskrunner.core.orchestrator.TaskValidationException;
import com.taskrunner.core.store.RecoveryRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for task submission, inspection and user commands.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskOrchestrator orchestrator;
    private final RecoveryRecordStore recoveryRecords;

    public TaskController(TaskOrchestrator orchestrator, RecoveryRecordStore recoveryRecords) {
        this.orchestrator = orchestrator;
        this.recoveryRecords = recoveryRecords;
    }

    /**
     * POST /api/v1/tasks: Submit a task. Execution continues asynchronously.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> submit(@RequestBody SubmitTaskRequest request) {
        Task task = orchestrator.submit(new TaskRequest(
                request.userId(), request.title(), request.prompt(), request.repository(), request.branch(),
                parseSize(request.vmSize()), request.vmLocation(), request.preferredNodeId(),
                request.priority() == null ? 0 : request.priority(), request.dependsOn(),
                Boolean.TRUE.equals(request.draft())));
        log.info("Accepted task {} ({})", task.id(), task.status().wireName());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskResponse.from(task));
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam("userId") String userId) {
        return orchestrator.listTasks(userId).stream().map(TaskResponse::from).toList();
    }

    /** GET /api/v1/tasks/{id}: the task with its status history. */
    @GetMapping("/{taskId}")
    public TaskResponse get(@PathVariable String taskId) {
        Task task = orchestrator.getTask(taskId);
        return TaskResponse.from(task, orchestrator.getEvents(taskId));
    }

    @PostMapping("/{taskId}/cancel")
    public TaskResponse cancel(@PathVariable String taskId) {
        return TaskResponse.from(orchestrator.cancel(taskId));
    }

    @PostMapping("/{taskId}/retry")
    public TaskResponse retry(@PathVariable String taskId) {
        return TaskResponse.from(orchestrator.retry(taskId));
    }

    @PostMapping("/{taskId}/enqueue")
    public TaskResponse enqueue(@PathVariable String taskId) {
        return TaskResponse.from(orchestrator.enqueue(taskId));
    }

    @PostMapping("/{taskId}/complete")
    public TaskResponse complete(@PathVariable String taskId) {
        return TaskResponse.from(orchestrator.complete(taskId));
    }

    @PostMapping("/{taskId}/dependencies")
    public TaskResponse addDependency(@PathVariable String taskId, @RequestBody DependencyRequest request) {
        if (request.dependsOn() == null || request.dependsOn().isBlank()) {
            throw new TaskValidationException("depends_on is required");
        }
        return TaskResponse.from(orchestrator.addDependency(taskId, request.dependsOn()));
    }

    /** GET /api/v1/tasks/{id}/recovery: snapshots taken by the recovery sweeper. */
    @GetMapping("/{taskId}/recovery")
    public List<RecoveryRecord> recovery(@PathVariable String taskId) {
        orchestrator.getTask(taskId);
        return recoveryRecords.findByTask(taskId);
    }

    @GetMapping("/{taskId}/callbacks")
    public List<CallbackReceipt> callbacks(@PathVariable String taskId) {
        orchestrator.getTask(taskId);
        return orchestrator.getCallbacks(taskId);
    }

    private static NodeSize parseSize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return NodeSize.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new TaskValidationException("Unknown vm_size: " + value);
        }
    }
}
