package com.taskrunner.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Inbound JSON body for POST /api/v1/tasks/{id}/dependencies. */
public record DependencyRequest(@JsonProperty("depends_on") String dependsOn) {}
