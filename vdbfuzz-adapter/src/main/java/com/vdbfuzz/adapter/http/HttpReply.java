package com.vdbfuzz.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Status and raw body of one HTTP exchange, with the request line for diagnostics. */
public final class HttpReply {

    private static final Logger log = LoggerFactory.getLogger(HttpReply.class);
    private static final ObjectMapper READER = new ObjectMapper();

    private final String method;
    private final String path;
    private final int status;
    private final String body;

    public HttpReply(String method, String path, int status, String body) {
        this.method = method;
        this.path = path;
        this.status = status;
        this.body = body != null ? body : "";
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public int getStatus() {
        return status;
    }

    /** Body exactly as received; empty string when none. */
    public String getBody() {
        return body;
    }

    /**
     * Body as a JSON tree for lenient reads such as health checks. A body that is not JSON yields a
     * missing node; calls that need a protocol error use {@link JsonHttpClient#parse}.
     */
    public JsonNode bodyTree() {
        try {
            JsonNode node = READER.readTree(body);
            return node != null ? node : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            log.debug("Body is not JSON | request={} | error={}", this, e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isAuthFailure() {
        return status == 401 || status == 403;
    }

    @Override
    public String toString() {
        return method + " " + path + " -> " + status;
    }
}
