package com.vdbfuzz.adapter;

import com.vdbfuzz.model.ErrorKind;

/** Network refusal, DNS or TLS failure, or authentication rejected by the service. */
public class ConnectionFailureException extends AdapterException {

    public ConnectionFailureException(String service, String message) {
        super(service, message, null, null, null);
    }

    public ConnectionFailureException(String service, String message, Throwable cause) {
        super(service, message, null, null, cause);
    }

    public ConnectionFailureException(String service, String message, int statusCode, String responseBody) {
        super(service, message, statusCode, responseBody, null);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONNECTION;
    }
}
