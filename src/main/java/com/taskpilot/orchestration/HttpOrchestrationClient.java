package com.taskpilot.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.core.persistence.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@link OrchestrationClient} over the service's JSON HTTP API.
 *
 * <p>Every request carries the API key as a bearer token and, when configured, the acting
 * user id. Responses with status 400 and above raise {@link OrchestrationException}; on the
 * spawn check, 404/405/501 mean the endpoint is not offered and raise
 * {@link SpawnGuardUnsupportedException} instead.
 */
public class HttpOrchestrationClient implements OrchestrationClient {

    private static final Logger log = LoggerFactory.getLogger(HttpOrchestrationClient.class);

    private static final Set<Integer> UNSUPPORTED_STATUSES = Set.of(404, 405, 501);

    private final OrchestrationProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpOrchestrationClient(OrchestrationProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpOrchestrationClient(OrchestrationProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = JsonSupport.newMapper();
    }

    @Override
    public List<JsonNode> listEntities(String type, Map<String, String> filters) {
        StringJoiner query = new StringJoiner("&", "?", "");
        query.add("type=" + encode(type));
        filters.forEach((key, value) -> query.add(encode(key) + "=" + encode(value)));

        JsonNode response = send("GET", "/api/entities" + query, null);
        JsonNode data = response.has("data") ? response.get("data") : response;
        List<JsonNode> rows = new ArrayList<>();
        if (data != null && data.isArray()) {
            data.forEach(rows::add);
        }
        log.debug("Listed {} {} entities", rows.size(), type);
        return rows;
    }

    @Override
    public JsonNode updateEntity(String type, String id, ObjectNode patch) {
        return send("PATCH", "/api/entities/" + encode(type) + "/" + encode(id), patch.toString());
    }

    @Override
    public JsonNode applyChangeset(ObjectNode payload) {
        return send("POST", "/api/client/live/changesets/apply", payload.toString());
    }

    @Override
    public JsonNode emitActivity(ObjectNode payload) {
        return send("POST", "/api/client/live/activity", payload.toString());
    }

    @Override
    public SpawnGuardResult checkSpawnGuard(String domain, String taskId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("domain", domain);
        body.put("taskId", taskId);
        JsonNode response;
        try {
            response = send("POST", "/api/client/spawn-check", body.toString());
        } catch (OrchestrationException e) {
            if (UNSUPPORTED_STATUSES.contains(e.statusCode())) {
                throw new SpawnGuardUnsupportedException(e.getMessage(), e.statusCode());
            }
            throw e;
        }
        JsonNode result = response.has("data") && response.get("data").isObject() ? response.get("data") : response;
        try {
            return objectMapper.treeToValue(result, SpawnGuardResult.class);
        } catch (IOException e) {
            throw new OrchestrationException("Unreadable spawn-check response", e);
        }
    }

    JsonNode send(String method, String path, String body) {
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + path))
                    .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                    .header("Authorization", "Bearer " + properties.getApiKey())
                    .header("Accept", "application/json");
            if (properties.getUserId() != null && !properties.getUserId().isBlank()) {
                builder.header("X-User-Id", properties.getUserId());
            }
            if (body == null) {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            } else {
                builder.header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(body));
            }

            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new OrchestrationException("%s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()), response.statusCode());
            }
            String text = response.body();
            if (text == null || text.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new OrchestrationException("Request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Interrupted: " + method + " " + path, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
