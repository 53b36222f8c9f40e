package com.numaansystems.obo.exception;

import org.springframework.http.HttpStatus;

/**
 * A network-level failure, a timeout, or an unreadable answer from the
 * identity provider or a downstream service.
 */
public class TransportException extends OboGatewayException {

    public TransportException(String details) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "Transport failure", details);
    }

    public TransportException(String details, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Transport failure", details, cause);
    }
}
