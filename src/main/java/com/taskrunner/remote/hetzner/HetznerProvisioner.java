package com.taskrunner.remote.hetzner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.remote.Provisioner;
import com.taskrunner.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * {@link Provisioner} backed by the Hetzner Cloud API.
 *
 * <p>Servers are named {@code node-<nodeId>} and labelled with the engine's node and user
 * ids so orphans can be traced back. Cloud-init user data is rendered from
 * {@code taskrunner.provisioner.user-data-template}, substituting {@code {{NODE_ID}}} and
 * {@code {{NODE_TOKEN}}}.
 */
public class HetznerProvisioner implements Provisioner {

    private static final Logger log = LoggerFactory.getLogger(HetznerProvisioner.class);

    private static final Map<String, String> SERVER_TYPES = Map.of(
            "small", "cx23",
            "medium", "cx33",
            "large", "cx43");

    private final TaskRunnerProperties.Provisioner settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HetznerProvisioner(TaskRunnerProperties.Provisioner settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    HetznerProvisioner(TaskRunnerProperties.Provisioner settings, HttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ProvisionedNode provision(ProvisionRequest request) {
        String serverType = serverTypeFor(request.size());

        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", "node-" + request.nodeId());
        body.put("server_type", serverType);
        body.put("location", request.location());
        body.put("image", settings.getImage());
        body.put("user_data", renderUserData(request));
        body.put("start_after_create", true);
        ObjectNode labels = body.putObject("labels");
        labels.put("managed-by", "taskrunner");
        labels.put("node-id", request.nodeId());
        labels.put("user-id", sanitizeLabel(request.userId()));

        JsonNode response = send("POST", "/servers", body.toString(), "Create server");
        JsonNode server = response.path("server");
        if (server.isMissingNode() || !server.hasNonNull("id")) {
            throw new RemoteCallException("Create server returned no server id", false);
        }
        String providerId = server.get("id").asText();
        String ip = server.path("public_net").path("ipv4").path("ip").asText(null);
        log.info("Hetzner server {} ({}) created for node {} in {}", providerId, serverType, request.nodeId(),
                request.location());
        return new ProvisionedNode(providerId, ip);
    }

    @Override
    public void destroy(String providerId) {
        try {
            send("DELETE", "/servers/" + providerId, null, "Delete server");
            log.info("Hetzner server {} deleted", providerId);
        } catch (RemoteCallException e) {
            if (e.getStatusCode() == 404) {
                log.info("Hetzner server {} already gone", providerId);
                return;
            }
            throw e;
        }
    }

    @Override
    public String name() {
        return "hetzner";
    }

    static String serverTypeFor(String size) {
        String type = SERVER_TYPES.get(size.toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new IllegalArgumentException("Unknown VM size: " + size);
        }
        return type;
    }

    private String renderUserData(ProvisionRequest request) {
        return settings.getUserDataTemplate()
                .replace("{{NODE_ID}}", request.nodeId())
                .replace("{{NODE_TOKEN}}", request.nodeToken() == null ? "" : request.nodeToken());
    }

    /** Hetzner label values allow only alphanumerics, dash, underscore and dot. */
    private static String sanitizeLabel(String value) {
        String cleaned = value.replaceAll("[^A-Za-z0-9._-]", "-");
        return cleaned.length() > 63 ? cleaned.substring(0, 63) : cleaned;
    }

    private JsonNode send(String method, String path, String body, String operation) {
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(settings.getHetznerBaseUrl() + path))
                    .timeout(settings.getRequestTimeout())
                    .header("Authorization", "Bearer " + settings.getHetznerApiToken())
                    .header("Accept", "application/json");
            if (body != null) {
                builder.header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(body));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw RemoteCallException.forStatus(operation, response.statusCode(), response.body());
            }
            String responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new RemoteCallException(operation + " request failed: " + e.getMessage(), true, -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(operation + " interrupted", false, -1, e);
        }
    }
}
