package com.taskrunner.dispatch.api;

/** Inbound JSON body for POST /api/v1/callbacks/workspaces/{id}/provisioning-failed. */
public record ProvisioningFailedRequest(String reason) {}
