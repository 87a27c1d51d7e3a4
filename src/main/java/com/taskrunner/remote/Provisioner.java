package com.taskrunner.remote;

/**
 * Cloud VM lifecycle. Implementations are plain blocking clients; callers decide how
 * to retry through {@link com.taskrunner.core.retry.RetryPolicy}.
 */
public interface Provisioner {

    /**
     * Requests a new VM.
     *
     * @return the provider's handle and address for the new machine
     * @throws RemoteCallException when the provider rejects or cannot be reached
     */
    ProvisionedNode provision(ProvisionRequest request);

    /**
     * Tears the VM down. Destroying a machine the provider no longer knows succeeds.
     */
    void destroy(String providerId);

    /** Short name for logs and health output. */
    String name();

    /**
     * @param nodeId    engine-side node id, used for the VM name and labels
     * @param nodeToken credential the node agent presents when it calls back
     */
    record ProvisionRequest(String nodeId, String userId, String size, String location, String nodeToken) {}

    record ProvisionedNode(String providerId, String ipAddress) {}
}
