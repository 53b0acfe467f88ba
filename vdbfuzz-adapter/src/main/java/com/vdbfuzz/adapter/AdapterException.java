package com.vdbfuzz.adapter;

import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.ResultError;

/**
 * Failure of an adapter call. Each subclass fixes the {@link ErrorKind}; the engine turns the
 * exception into a {@link ResultError} so failures become data, never aborts.
 */
public abstract class AdapterException extends Exception {

    private final String service;
    private final Integer statusCode;
    private final String responseBody;

    protected AdapterException(String service, String message, Integer statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.service = service;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public abstract ErrorKind getKind();

    public String getService() {
        return service;
    }

    /** HTTP status when a response was received, else null. */
    public Integer getStatusCode() {
        return statusCode;
    }

    /** Native response payload exactly as received, else null. */
    public String getResponseBody() {
        return responseBody;
    }

    public ResultError toResultError() {
        return new ResultError(getKind(), getMessage(), statusCode, responseBody);
    }
}
