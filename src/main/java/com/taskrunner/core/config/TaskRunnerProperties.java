package com.taskrunner.core.config;

import com.taskrunner.core.model.NodeSize;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All tunables of the engine, bound from {@code taskrunner.*}.
 * Every value has a default so an empty configuration runs.
 */
@Component
@ConfigurationProperties(prefix = "taskrunner")
public class TaskRunnerProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Retry retry = new Retry();
    private Nodes nodes = new Nodes();
    private Recovery recovery = new Recovery();
    private Scheduler scheduler = new Scheduler();
    private Provisioner provisioner = new Provisioner();
    private Agent agent = new Agent();
    private Callback callback = new Callback();

    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Nodes getNodes() { return nodes; }
    public void setNodes(Nodes nodes) { this.nodes = nodes; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Provisioner getProvisioner() { return provisioner; }
    public void setProvisioner(Provisioner provisioner) { this.provisioner = provisioner; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Callback getCallback() { return callback; }
    public void setCallback(Callback callback) { this.callback = callback; }

    public static class Orchestrator {
        private Duration nodeAgentReadyTimeout = Duration.ofSeconds(120);
        private Duration nodeAgentPollInterval = Duration.ofSeconds(5);
        private Duration workspaceReadyTimeout = Duration.ofMinutes(10);
        private Duration workspaceReadyPollInterval = Duration.ofSeconds(15);
        private Duration callbackGracePeriod = Duration.ofSeconds(30);
        private int maxDependenciesPerTask = 20;
        private String defaultBranch = "main";
        private NodeSize defaultSize = NodeSize.MEDIUM;
        private String defaultLocation = "nbg1";
        private String outputBranchPrefix = "task/";

        public Duration getNodeAgentReadyTimeout() { return nodeAgentReadyTimeout; }
        public void setNodeAgentReadyTimeout(Duration nodeAgentReadyTimeout) { this.nodeAgentReadyTimeout = nodeAgentReadyTimeout; }
        public Duration getNodeAgentPollInterval() { return nodeAgentPollInterval; }
        public void setNodeAgentPollInterval(Duration nodeAgentPollInterval) { this.nodeAgentPollInterval = nodeAgentPollInterval; }
        public Duration getWorkspaceReadyTimeout() { return workspaceReadyTimeout; }
        public void setWorkspaceReadyTimeout(Duration workspaceReadyTimeout) { this.workspaceReadyTimeout = workspaceReadyTimeout; }
        public Duration getWorkspaceReadyPollInterval() { return workspaceReadyPollInterval; }
        public void setWorkspaceReadyPollInterval(Duration workspaceReadyPollInterval) { this.workspaceReadyPollInterval = workspaceReadyPollInterval; }
        public Duration getCallbackGracePeriod() { return callbackGracePeriod; }
        public void setCallbackGracePeriod(Duration callbackGracePeriod) { this.callbackGracePeriod = callbackGracePeriod; }
        public int getMaxDependenciesPerTask() { return maxDependenciesPerTask; }
        public void setMaxDependenciesPerTask(int maxDependenciesPerTask) { this.maxDependenciesPerTask = maxDependenciesPerTask; }
        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
        public NodeSize getDefaultSize() { return defaultSize; }
        public void setDefaultSize(NodeSize defaultSize) { this.defaultSize = defaultSize; }
        public String getDefaultLocation() { return defaultLocation; }
        public void setDefaultLocation(String defaultLocation) { this.defaultLocation = defaultLocation; }
        public String getOutputBranchPrefix() { return outputBranchPrefix; }
        public void setOutputBranchPrefix(String outputBranchPrefix) { this.outputBranchPrefix = outputBranchPrefix; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        // one delay per retry: maxAttempts - 1 entries
        private List<Duration> backoff = new ArrayList<>(List.of(Duration.ofSeconds(2), Duration.ofSeconds(5)));

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public List<Duration> getBackoff() { return backoff; }
        public void setBackoff(List<Duration> backoff) { this.backoff = backoff; }
    }

    public static class Nodes {
        private Duration warmTimeout = Duration.ofMinutes(30);
        private Duration maxLifetime = Duration.ofHours(4);
        private Duration warmSweepGrace = Duration.ofMinutes(5);
        private Duration destroyRetryDelay = Duration.ofSeconds(60);
        private Duration heartbeatStaleAfter = Duration.ofMinutes(2);
        private int maxNodesPerUser = 10;
        private int maxWorkspacesPerNode = 10;
        private double cpuThresholdPercent = 80;
        private double memoryThresholdPercent = 85;
        private double cpuWeight = 0.4;
        private double memoryWeight = 0.6;
        private boolean sweepEnabled = true;
        private Duration sweepInterval = Duration.ofMinutes(5);
        private int workerThreads = 4;

        public Duration getWarmTimeout() { return warmTimeout; }
        public void setWarmTimeout(Duration warmTimeout) { this.warmTimeout = warmTimeout; }
        public Duration getMaxLifetime() { return maxLifetime; }
        public void setMaxLifetime(Duration maxLifetime) { this.maxLifetime = maxLifetime; }
        public Duration getWarmSweepGrace() { return warmSweepGrace; }
        public void setWarmSweepGrace(Duration warmSweepGrace) { this.warmSweepGrace = warmSweepGrace; }
        public Duration getDestroyRetryDelay() { return destroyRetryDelay; }
        public void setDestroyRetryDelay(Duration destroyRetryDelay) { this.destroyRetryDelay = destroyRetryDelay; }
        public Duration getHeartbeatStaleAfter() { return heartbeatStaleAfter; }
        public void setHeartbeatStaleAfter(Duration heartbeatStaleAfter) { this.heartbeatStaleAfter = heartbeatStaleAfter; }
        public int getMaxNodesPerUser() { return maxNodesPerUser; }
        public void setMaxNodesPerUser(int maxNodesPerUser) { this.maxNodesPerUser = maxNodesPerUser; }
        public int getMaxWorkspacesPerNode() { return maxWorkspacesPerNode; }
        public void setMaxWorkspacesPerNode(int maxWorkspacesPerNode) { this.maxWorkspacesPerNode = maxWorkspacesPerNode; }
        public double getCpuThresholdPercent() { return cpuThresholdPercent; }
        public void setCpuThresholdPercent(double cpuThresholdPercent) { this.cpuThresholdPercent = cpuThresholdPercent; }
        public double getMemoryThresholdPercent() { return memoryThresholdPercent; }
        public void setMemoryThresholdPercent(double memoryThresholdPercent) { this.memoryThresholdPercent = memoryThresholdPercent; }
        public double getCpuWeight() { return cpuWeight; }
        public void setCpuWeight(double cpuWeight) { this.cpuWeight = cpuWeight; }
        public double getMemoryWeight() { return memoryWeight; }
        public void setMemoryWeight(double memoryWeight) { this.memoryWeight = memoryWeight; }
        public boolean isSweepEnabled() { return sweepEnabled; }
        public void setSweepEnabled(boolean sweepEnabled) { this.sweepEnabled = sweepEnabled; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private Duration queuedTimeout = Duration.ofMinutes(5);
        private Duration delegatedTimeout = Duration.ofMinutes(5);
        private Duration inProgressTimeout = Duration.ofHours(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getQueuedTimeout() { return queuedTimeout; }
        public void setQueuedTimeout(Duration queuedTimeout) { this.queuedTimeout = queuedTimeout; }
        public Duration getDelegatedTimeout() { return delegatedTimeout; }
        public void setDelegatedTimeout(Duration delegatedTimeout) { this.delegatedTimeout = delegatedTimeout; }
        public Duration getInProgressTimeout() { return inProgressTimeout; }
        public void setInProgressTimeout(Duration inProgressTimeout) { this.inProgressTimeout = inProgressTimeout; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration lease = Duration.ofSeconds(60);
        private int batchSize = 100;
        private int workerThreads = 8;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getLease() { return lease; }
        public void setLease(Duration lease) { this.lease = lease; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Provisioner {
        private String type = "hetzner";
        private String hetznerBaseUrl = "https://api.hetzner.cloud/v1";
        private String hetznerApiToken = "";
        private String image = "ubuntu-24.04";
        private String userDataTemplate = "";
        private String localAddress = "127.0.0.1";
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getHetznerBaseUrl() { return hetznerBaseUrl; }
        public void setHetznerBaseUrl(String hetznerBaseUrl) { this.hetznerBaseUrl = hetznerBaseUrl; }
        public String getHetznerApiToken() { return hetznerApiToken; }
        public void setHetznerApiToken(String hetznerApiToken) { this.hetznerApiToken = hetznerApiToken; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getUserDataTemplate() { return userDataTemplate; }
        public void setUserDataTemplate(String userDataTemplate) { this.userDataTemplate = userDataTemplate; }
        public String getLocalAddress() { return localAddress; }
        public void setLocalAddress(String localAddress) { this.localAddress = localAddress; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class Agent {
        private int port = 8080;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(5);

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    }

    public static class Callback {
        private String baseUrl = "http://localhost:8080";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }
}
