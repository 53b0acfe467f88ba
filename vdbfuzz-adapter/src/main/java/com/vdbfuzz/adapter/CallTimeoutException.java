package com.vdbfuzz.adapter;

import com.vdbfuzz.model.ErrorKind;

/** The call did not complete before its deadline (or was interrupted while waiting). */
public class CallTimeoutException extends AdapterException {

    public CallTimeoutException(String service, String message) {
        super(service, message, null, null, null);
    }

    public CallTimeoutException(String service, String message, Throwable cause) {
        super(service, message, null, null, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TIMEOUT;
    }
}
