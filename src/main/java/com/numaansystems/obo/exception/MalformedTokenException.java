package com.numaansystems.obo.exception;

import org.springframework.http.HttpStatus;

/**
 * A bearer token was present but could not be decoded as a JWT.
 */
public class MalformedTokenException extends OboGatewayException {

    public MalformedTokenException(String details) {
        super(HttpStatus.BAD_REQUEST, "Malformed access token", details);
    }

    public MalformedTokenException(String details, Throwable cause) {
        super(HttpStatus.BAD_REQUEST.value(), "Malformed access token", details, cause);
    }
}
