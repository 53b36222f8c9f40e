package com.numaansystems.obo.exception;

import org.springframework.http.HttpStatus;

/**
 * The request carried no usable {@code Authorization: Bearer} header.
 */
public class MissingBearerTokenException extends OboGatewayException {

    public MissingBearerTokenException() {
        super(HttpStatus.UNAUTHORIZED, "No authorization token provided",
                "Send the user's access token as 'Authorization: Bearer <token>'");
    }
}
