package com.taskrunner.core.metrics;

import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.CallbackKind;
import com.taskrunner.core.model.ExecutionStep;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task orchestration and the node pool.
 */
@Service
public class TaskRunnerMetrics {

    private final MeterRegistry registry;

    public TaskRunnerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskSubmitted(boolean draft) {
        Counter.builder("taskrunner.tasks.submitted")
                .tag("initial", draft ? "draft" : "queued")
                .register(registry)
                .increment();
    }

    public void recordTaskResult(String status) {
        Counter.builder("taskrunner.tasks.finished")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStepDuration(ExecutionStep step, Duration duration) {
        Timer.builder("taskrunner.step.duration")
                .tag("step", step.wireName())
                .register(registry)
                .record(duration);
    }

    /**
     * Counts conditional updates that affected zero rows. A steady trickle is expected
     * while the sweeper and orchestrators overlap; a spike points at clock or threshold trouble.
     *
     * @param writer "orchestrator" or "sweeper"
     */
    public void recordRaceLost(String writer) {
        Counter.builder("taskrunner.races.lost")
                .tag("writer", writer)
                .register(registry)
                .increment();
    }

    public void recordStepRetry(ExecutionStep step) {
        Counter.builder("taskrunner.step.retries")
                .tag("step", step.wireName())
                .register(registry)
                .increment();
    }

    public void recordCallback(CallbackKind kind, CallbackDisposition disposition) {
        Counter.builder("taskrunner.callbacks")
                .tag("kind", kind.name().toLowerCase())
                .tag("disposition", disposition.name().toLowerCase())
                .register(registry)
                .increment();
    }

    // --- Node pool ---

    public void recordNodeProvisioned(String size) {
        Counter.builder("taskrunner.nodes.provisioned")
                .tag("size", size)
                .register(registry)
                .increment();
    }

    public void recordWarmClaim() {
        Counter.builder("taskrunner.nodes.warm_claims")
                .register(registry)
                .increment();
    }

    /**
     * @param trigger which leak-defense layer caused the teardown
     */
    public void recordNodeDestroyed(String trigger) {
        Counter.builder("taskrunner.nodes.destroyed")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void recordNodeDestroyFailure() {
        Counter.builder("taskrunner.nodes.destroy_failures")
                .register(registry)
                .increment();
    }

    // --- Recovery ---

    public void recordRecovery(String outcome) {
        Counter.builder("taskrunner.recovery.actions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSweepDuration(String sweeper, long ms) {
        Timer.builder("taskrunner.sweep.duration")
                .tag("sweeper", sweeper)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
