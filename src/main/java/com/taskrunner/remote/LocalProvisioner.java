package com.taskrunner.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provisioner for development: every "VM" is the local host, where a node agent is
 * expected to listen. Selected with {@code taskrunner.provisioner.type=local}.
 */
public class LocalProvisioner implements Provisioner {

    private static final Logger log = LoggerFactory.getLogger(LocalProvisioner.class);

    private final String hostAddress;
    private final Set<String> machines = ConcurrentHashMap.newKeySet();

    public LocalProvisioner(String hostAddress) {
        this.hostAddress = hostAddress;
    }

    @Override
    public ProvisionedNode provision(ProvisionRequest request) {
        String providerId = "local-" + request.nodeId();
        machines.add(providerId);
        log.info("Local node {} registered as {} ({})", request.nodeId(), providerId, hostAddress);
        return new ProvisionedNode(providerId, hostAddress);
    }

    @Override
    public void destroy(String providerId) {
        if (machines.remove(providerId)) {
            log.info("Local node {} released", providerId);
        }
    }

    @Override
    public String name() {
        return "local";
    }
}
