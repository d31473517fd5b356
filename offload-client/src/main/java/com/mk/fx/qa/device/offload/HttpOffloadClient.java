package com.mk.fx.qa.device.offload;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link OffloadClient} talking JSON over HTTP to the offload frontend.
 *
 * <p>{@code POST /v1/devices} registers a device with its requirements and
 * {@code POST /v1/devices/{id}/offload} executes a workload on its behalf. A non-2xx answer is a
 * FAILURE response carrying the status code and body; connection problems and timeouts surface as
 * {@link OffloadException}. An interrupted call is abandoned with {@link InterruptedException}.
 * This implementation does not include retry logic.
 */
@Slf4j
public class HttpOffloadClient implements OffloadClient {

    static final String DEVICES_PATH = "/v1/devices";
    static final String OFFLOAD_PATH = "/offload";

    /** Default request timeout in seconds. */
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    private final HttpClient httpClient;
    private final Map<String, String> headers;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpOffloadClient(String baseUrl, int connTimeOutSeconds, Map<String, String> headers) {
        this(baseUrl, connTimeOutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS, headers);
    }

    /**
     * Constructs a client for the given frontend.
     *
     * @param baseUrl frontend base URL
     * @param connTimeOutSeconds connection timeout in seconds
     * @param requestTimeoutSeconds default per-call timeout in seconds
     * @param headers headers added to every request, e.g. credentials
     */
    public HttpOffloadClient(
            String baseUrl,
            int connTimeOutSeconds,
            int requestTimeoutSeconds,
            Map<String, String> headers) {
        this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.httpClient =
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connTimeOutSeconds)).build();
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "HttpOffloadClient initialised - Base URL: {}, Connection timeout: {}s, Request timeout: {}s",
                this.baseUrl,
                connTimeOutSeconds,
                requestTimeoutSeconds);
    }

    @Override
    public OffloadSession open(Map<String, Object> requirements)
            throws OffloadException, InterruptedException {
        Objects.requireNonNull(requirements, "Requirements cannot be null");
        Object id = requirements.get("ID");
        if (id == null || id.toString().isBlank()) {
            throw new IllegalArgumentException("Requirements must contain a non-blank ID");
        }
        var deviceId = id.toString();

        var response = post(DEVICES_PATH, requirements, requestTimeout);
        if (!isSuccessful(response.statusCode())) {
            throw new OffloadException(
                    "Device " + deviceId + " registration failed with HTTP " + response.statusCode()
                            + ": " + response.body());
        }
        log.debug("Device {} registered with offload frontend", deviceId);
        return new HttpOffloadSession(deviceId);
    }

    private HttpResponse<String> post(String path, Object body, Duration timeout)
            throws OffloadException, InterruptedException {
        String json;
        try {
            json = JsonUtil.toJson(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request body: " + e.getMessage(), e);
        }

        var request =
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .timeout(timeout)
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json));
        headers.forEach(request::header);

        try {
            return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new OffloadException(
                    "Request to " + path + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new OffloadException("Error calling " + path + ": " + e.getMessage(), e);
        }
    }

    private static boolean isSuccessful(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private String validateAndNormalizeBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private final class HttpOffloadSession implements OffloadSession {

        private final String offloadPath;
        private final String deviceId;

        private HttpOffloadSession(String deviceId) {
            this.deviceId = deviceId;
            this.offloadPath =
                    DEVICES_PATH + "/" + URLEncoder.encode(deviceId, StandardCharsets.UTF_8) + OFFLOAD_PATH;
        }

        @Override
        public OffloadResponse call(OffloadRequest request)
                throws OffloadException, InterruptedException {
            Objects.requireNonNull(request, "Request cannot be null");
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("function", request.function());
            body.put("parameters", request.parameters());

            var timeout = request.timeout() != null ? request.timeout() : requestTimeout;
            var startTime = System.nanoTime();
            var response = post(offloadPath, body, timeout);
            var latency = Duration.ofNanos(System.nanoTime() - startTime);

            log.debug(
                    "Device {} offload of {} completed in {} ms with status {}",
                    deviceId,
                    request.function(),
                    latency.toMillis(),
                    response.statusCode());

            if (isSuccessful(response.statusCode())) {
                return OffloadResponse.success(latency, response.body());
            }
            return OffloadResponse.failure(
                    latency, "HTTP " + response.statusCode() + ": " + response.body());
        }

        @Override
        public void close() {
            log.debug("Device {} session closed", deviceId);
        }
    }
}
