package com.vdbfuzz.adapter;

import com.vdbfuzz.model.ErrorKind;

/** The service answered, but not in the shape the adapter expects. The raw payload is kept. */
public class ProtocolViolationException extends AdapterException {

    public ProtocolViolationException(String service, String message, Integer statusCode, String responseBody) {
        super(service, message, statusCode, responseBody, null);
    }

    public ProtocolViolationException(String service, String message, Integer statusCode, String responseBody, Throwable cause) {
        super(service, message, statusCode, responseBody, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PROTOCOL;
    }
}
