package com.vdbfuzz.adapter;

import com.vdbfuzz.model.ErrorKind;

/** The service rejected the request; its native error payload is preserved verbatim. */
public class ServiceErrorException extends AdapterException {

    public ServiceErrorException(String service, String message, Integer statusCode, String responseBody) {
        super(service, message, statusCode, responseBody, null);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.SERVICE;
    }
}
