package com.taskrunner.remote;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.security.JwtTokenService;
import com.taskrunner.remote.agent.HttpNodeAgentClient;
import com.taskrunner.remote.hetzner.HetznerProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the provisioner and node agent client. The provisioner is chosen by
 * {@code taskrunner.provisioner.type}: {@code hetzner} (default) or {@code local}.
 */
@Configuration
public class RemoteConfig {

    private static final Logger log = LoggerFactory.getLogger(RemoteConfig.class);

    @Bean
    @ConditionalOnProperty(name = "taskrunner.provisioner.type", havingValue = "hetzner", matchIfMissing = true)
    public Provisioner hetznerProvisioner(TaskRunnerProperties properties) {
        var settings = properties.getProvisioner();
        if (settings.getHetznerApiToken() == null || settings.getHetznerApiToken().isBlank()) {
            log.warn("Hetzner API token is not set; provisioning calls will be rejected");
        }
        log.info("Provisioner: hetzner ({})", settings.getHetznerBaseUrl());
        return new HetznerProvisioner(settings);
    }

    @Bean
    @ConditionalOnProperty(name = "taskrunner.provisioner.type", havingValue = "local")
    public Provisioner localProvisioner(TaskRunnerProperties properties) {
        log.info("Provisioner: local ({})", properties.getProvisioner().getLocalAddress());
        return new LocalProvisioner(properties.getProvisioner().getLocalAddress());
    }

    @Bean
    public NodeAgentClient nodeAgentClient(TaskRunnerProperties properties, JwtTokenService tokenService) {
        return new HttpNodeAgentClient(properties.getAgent(), tokenService);
    }
}
