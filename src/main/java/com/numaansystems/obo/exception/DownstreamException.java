package com.numaansystems.obo.exception;

import java.util.Map;

/**
 * A downstream API answered with a non-200 status.
 *
 * <p>The gateway mirrors the downstream status to its caller. The response
 * body is passed through as {@code details}.</p>
 */
public class DownstreamException extends OboGatewayException {

    private final int downstreamStatus;
    private final String body;
    private final String suggestion;
    private final String authMethod;

    public DownstreamException(String error, int downstreamStatus, String body, String suggestion) {
        this(error, downstreamStatus, body, suggestion, null);
    }

    private DownstreamException(String error, int downstreamStatus, String body, String suggestion, String authMethod) {
        super(downstreamStatus, error, body);
        this.downstreamStatus = downstreamStatus;
        this.body = body;
        this.suggestion = suggestion;
        this.authMethod = authMethod;
    }

    /**
     * Returns a copy that also reports which credential was used for the call.
     */
    public DownstreamException withAuthMethod(String authMethod) {
        return new DownstreamException(getError(), downstreamStatus, body, suggestion, authMethod);
    }

    public int getDownstreamStatus() {
        return downstreamStatus;
    }

    public String getBody() {
        return body;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public Map<String, Object> getAttributes() {
        Map<String, Object> attributes = attributes();
        attributes.put("status", downstreamStatus);
        if (authMethod != null) {
            attributes.put("auth_method", authMethod);
        }
        if (suggestion != null) {
            attributes.put("suggestion", suggestion);
        }
        return attributes;
    }
}
