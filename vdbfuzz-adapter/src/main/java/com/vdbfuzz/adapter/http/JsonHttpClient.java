package com.vdbfuzz.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.CallTimeoutException;
import com.vdbfuzz.adapter.ConnectionFailureException;
import com.vdbfuzz.adapter.ProtocolViolationException;
import com.vdbfuzz.adapter.ServiceErrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-over-HTTP transport owned by exactly one adapter. Request bodies are written so that NaN and
 * infinite floats go out as bare JSON tokens, letting the service decide what to do with them.
 * Transport failures are mapped to the adapter error taxonomy.
 */
public final class JsonHttpClient {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    private static final ObjectMapper READER = new ObjectMapper();
    private static final ObjectMapper WIRE = JsonMapper.builder()
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .build();

    private final String service;
    private final String baseUrl;
    private final Duration callTimeout;
    private final Map<String, String> headers;
    private final HttpClient httpClient;

    /**
     * @param service        service name used in error messages
     * @param baseUrl        e.g. {@code http://localhost:6333}; trailing slashes are dropped
     * @param connectTimeout TCP connect timeout
     * @param callTimeout    default per-request timeout
     * @param headers        headers added to every request (e.g. Authorization); may be empty
     */
    public JsonHttpClient(String service, String baseUrl, Duration connectTimeout, Duration callTimeout,
                          Map<String, String> headers) {
        this.service = Objects.requireNonNull(service, "service");
        String url = Objects.requireNonNull(baseUrl, "baseUrl").trim();
        while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpReply get(String path) throws AdapterException {
        return send("GET", path, null, callTimeout);
    }

    public HttpReply post(String path, Object body) throws AdapterException {
        return send("POST", path, body, callTimeout);
    }

    public HttpReply put(String path, Object body) throws AdapterException {
        return send("PUT", path, body, callTimeout);
    }

    /** DELETE, with a JSON body when {@code body} is non-null. */
    public HttpReply delete(String path, Object body) throws AdapterException {
        return send("DELETE", path, body, callTimeout);
    }

    /**
     * Sends one request. Any HTTP status is returned as a reply; only transport failures throw.
     *
     * @param body a String is sent as-is, anything else is serialised to JSON; null sends no body
     * @throws ConnectionFailureException on refusal, connect timeout or broken transport
     * @throws CallTimeoutException       when the response does not arrive in time or the thread is interrupted
     */
    public HttpReply send(String method, String path, Object body, Duration timeout) throws AdapterException {
        String json = body == null ? null : body instanceof String ? (String) body : toJson(body);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout != null ? timeout : callTimeout)
                .header("Accept", "application/json");
        headers.forEach(builder::header);
        if (json != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        try {
            HttpResponse<String> res = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("{} | {} {} | status={}", service, method, path, res.statusCode());
            return new HttpReply(method, path, res.statusCode(), res.body());
        } catch (HttpConnectTimeoutException e) {
            throw new ConnectionFailureException(service, service + " connect timed out: " + method + " " + path, e);
        } catch (HttpTimeoutException e) {
            throw new CallTimeoutException(service, service + " " + method + " " + path + " timed out after " + timeout, e);
        } catch (IOException e) {
            throw new ConnectionFailureException(service, service + " " + method + " " + path + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallTimeoutException(service, service + " " + method + " " + path + " interrupted", e);
        }
    }

    /**
     * Returns the reply when its status is 2xx.
     *
     * @throws ConnectionFailureException on 401/403
     * @throws ServiceErrorException      on any other non-2xx status, with the body verbatim
     */
    public HttpReply requireSuccess(HttpReply reply, String operation) throws AdapterException {
        if (reply.isSuccess()) return reply;
        String message = service + " " + operation + " failed: " + reply.getStatus() + " " + reply.getBody();
        if (reply.isAuthFailure()) {
            throw new ConnectionFailureException(service, message, reply.getStatus(), reply.getBody());
        }
        throw new ServiceErrorException(service, message, reply.getStatus(), reply.getBody());
    }

    /**
     * Parses the reply body as JSON.
     *
     * @throws ProtocolViolationException when the body is not JSON
     */
    public JsonNode parse(HttpReply reply, String operation) throws ProtocolViolationException {
        try {
            JsonNode node = READER.readTree(reply.getBody());
            if (node == null || node.isMissingNode()) {
                throw protocolViolation(reply, operation, "empty body");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.warn("{} | {} returned non-JSON body | status={} | body={}", service, operation, reply.getStatus(), reply.getBody());
            throw new ProtocolViolationException(service, service + " " + operation + " returned malformed JSON: "
                    + e.getOriginalMessage(), reply.getStatus(), reply.getBody(), e);
        }
    }

    /** Builds a protocol violation for a reply whose JSON lacks an expected field, logging the raw payload. */
    public ProtocolViolationException protocolViolation(HttpReply reply, String operation, String what) {
        log.warn("{} | {} response did not match expected shape ({}) | status={} | body={}",
                service, operation, what, reply.getStatus(), reply.getBody());
        return new ProtocolViolationException(service, service + " " + operation + " unexpected response: " + what,
                reply.getStatus(), reply.getBody());
    }

    public static String toJson(Object body) {
        try {
            return WIRE.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    /** Percent-encodes one path segment (spaces become %20). */
    public static String segment(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg != null ? ": " + msg : "");
    }
}
