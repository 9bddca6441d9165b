package com.pricesync.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricesync.orchestrator.config.OrchestratorProperties;
import com.pricesync.orchestrator.model.CallResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin client over the external business API.
 *
 * Every call is a single attempt. Whatever happens on the wire is folded into a
 * {@link CallResult}; nothing is thrown to the caller.
 *
 * Endpoints used:
 *   GET {base}/start_parser?parser=NAME
 *   GET {base}/start_table_process?method=NAME[&args=["a","b"]]
 *   GET {base}/get_logs/parser=NAME
 */
@Service
@Slf4j
public class ApiGateway {

    private final ObjectMapper objectMapper;
    private final OrchestratorProperties properties;
    private final HttpClient httpClient;

    public ApiGateway(ObjectMapper objectMapper, OrchestratorProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getApi().getConnectTimeoutSeconds()))
                .build();
    }

    // ── Logical endpoints ─────────────────────────────────────────────────────

    public CallResult startParser(String parserName) {
        log.info("Requesting parser start: {}", parserName);
        return call("start_parser", "GET", Map.of("parser", parserName), defaultTimeout());
    }

    public CallResult startTableProcess(String method, List<String> args) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("method", method);
        if (args != null && !args.isEmpty()) {
            params.put("args", args);
        }
        log.info("Requesting table process: {} {}", method, args == null ? List.of() : args);
        return call("start_table_process", "GET", params, defaultTimeout());
    }

    /**
     * Fetches the raw log text the API keeps for a parser.
     * The text travels in the {@code message} field of the JSON body.
     */
    public CallResult getParserLogs(String parserName) {
        String encoded = URLEncoder.encode(parserName, StandardCharsets.UTF_8).replace("+", "%20");
        URI uri = URI.create(baseUrl() + "/get_logs/parser=" + encoded);
        log.info("Requesting logs for parser {} from {}", parserName, uri);

        Exchange exchange;
        try {
            exchange = send(uri, "GET", defaultTimeout());
        } catch (TransportFailure e) {
            return CallResult.transportFailure(e.getMessage());
        }
        if (!exchange.is2xx()) {
            return CallResult.failure(errorMessage(exchange), exchange.status());
        }

        JsonNode json = parseJson(exchange.body());
        if (json == null || !json.isObject()) {
            log.warn("Log response for '{}' is not a JSON object", parserName);
            return CallResult.success(exchange.body(), exchange.status());
        }
        JsonNode message = json.get("message");
        if (message == null || message.isNull()) {
            log.warn("Log response for '{}' has no message field: {}", parserName, exchange.body());
            return CallResult.success("Log for '" + parserName + "' was not found in the API response.",
                    exchange.status());
        }
        String text = message.isTextual() ? message.asText() : message.toString();
        log.info("Retrieved log for '{}' ({} chars)", parserName, text.length());
        return CallResult.success(text, exchange.status());
    }

    // ── Generic call ──────────────────────────────────────────────────────────

    /**
     * Issue one request and classify the response.
     *
     * @param endpoint       path below the base URL, e.g. "start_parser"
     * @param method         HTTP method
     * @param params         query parameters; collection and array values are sent JSON-encoded
     * @param timeoutSeconds response timeout for this call
     */
    public CallResult call(String endpoint, String method, Map<String, ?> params, int timeoutSeconds) {
        URI uri;
        try {
            uri = buildUri(endpoint, params);
        } catch (JsonProcessingException e) {
            log.error("Could not encode parameters {} for {}: {}", params, endpoint, e.getMessage());
            return CallResult.transportFailure("Error encoding parameters for '" + endpoint + "'");
        }

        Exchange exchange;
        try {
            exchange = send(uri, method, timeoutSeconds);
        } catch (TransportFailure e) {
            return CallResult.transportFailure(e.getMessage());
        }

        if (!exchange.is2xx()) {
            log.error("API error {} from {}: {}", exchange.status(), uri, exchange.body());
            return CallResult.failure(errorMessage(exchange), exchange.status());
        }

        JsonNode json = parseJson(exchange.body());
        if (json == null) {
            log.warn("Response from {} is not valid JSON, using raw text", uri);
            String text = exchange.body().isEmpty() ? "OK" : exchange.body();
            return CallResult.success(text, exchange.status());
        }
        if (!json.isObject()) {
            return CallResult.success(json.toString(), exchange.status());
        }

        String message = json.hasNonNull("message") ? textOf(json.get("message")) : json.toString();
        if ("error".equals(json.path("status").asText(null))) {
            log.warn("API reported status=error in a {} response from {}: {}", exchange.status(), uri, message);
            return CallResult.failure(message, exchange.status());
        }
        return CallResult.success(message, exchange.status());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    URI buildUri(String endpoint, Map<String, ?> params) throws JsonProcessingException {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl() + "/" + endpoint);
        if (params != null) {
            for (Map.Entry<String, ?> param : params.entrySet()) {
                builder.queryParam(param.getKey(), encodeParam(param.getValue()));
            }
        }
        return builder.build().encode().toUri();
    }

    private String encodeParam(Object value) throws JsonProcessingException {
        if (value instanceof Collection<?> || value instanceof Object[]) {
            return objectMapper.writeValueAsString(value);
        }
        return String.valueOf(value);
    }

    private Exchange send(URI uri, String method, int timeoutSeconds) throws TransportFailure {
        log.info("Sending {} request to: {}", method, uri);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.info("Received status {} for {}", response.statusCode(), uri);
            return new Exchange(response.statusCode(), response.body() == null ? "" : response.body());

        } catch (HttpConnectTimeoutException e) {
            log.error("Connect timeout for {}", uri);
            throw new TransportFailure("Error: Connection timed out for " + uri);
        } catch (HttpTimeoutException e) {
            log.error("Request timeout ({}s) for {}", timeoutSeconds, uri);
            throw new TransportFailure("Error: Request timed out after " + timeoutSeconds + " seconds");
        } catch (ConnectException e) {
            log.error("Connection error for {}: {}", uri, e.getMessage());
            throw new TransportFailure("Error: Connection refused or DNS resolution failed for " + uri);
        } catch (IOException e) {
            log.error("Client error during request to {}: {}", uri, e.getMessage());
            throw new TransportFailure("Error: Client error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailure("Error: Request to " + uri + " was interrupted");
        } catch (RuntimeException e) {
            log.error("Unexpected error during request to {}", uri, e);
            throw new TransportFailure("Error: An unexpected error occurred: " + e.getMessage());
        }
    }

    private String errorMessage(Exchange exchange) {
        JsonNode json = parseJson(exchange.body());
        if (json != null && json.isObject() && json.hasNonNull("message")) {
            return textOf(json.get("message"));
        }
        return exchange.body().isBlank() ? "Unknown API error" : exchange.body();
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String textOf(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }

    private String baseUrl() {
        String base = properties.getApi().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private int defaultTimeout() {
        return properties.getApi().getTimeoutSeconds();
    }

    private record Exchange(int status, String body) {
        boolean is2xx() {
            return status >= 200 && status < 300;
        }
    }

    private static class TransportFailure extends Exception {
        TransportFailure(String message) {
            super(message);
        }
    }
}
