package com.numaansystems.obo.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for request-scoped failures of the gateway.
 *
 * <p>Every subclass knows the HTTP status it maps to, the short {@code error}
 * text shown to the caller and any extra keys that belong in the JSON error
 * body. {@link com.numaansystems.obo.controller.GlobalExceptionHandler}
 * renders them.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public abstract class OboGatewayException extends RuntimeException {

    private final int status;
    private final String error;

    protected OboGatewayException(int status, String error, String details) {
        super(details);
        this.status = status;
        this.error = error;
    }

    protected OboGatewayException(int status, String error, String details, Throwable cause) {
        super(details, cause);
        this.status = status;
        this.error = error;
    }

    protected OboGatewayException(HttpStatus status, String error, String details) {
        this(status.value(), error, details);
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getDetails() {
        return getMessage();
    }

    /**
     * Extra keys merged into the error body after {@code error} and {@code details}.
     */
    public Map<String, Object> getAttributes() {
        return Collections.emptyMap();
    }

    protected static Map<String, Object> attributes() {
        return new LinkedHashMap<>();
    }
}
