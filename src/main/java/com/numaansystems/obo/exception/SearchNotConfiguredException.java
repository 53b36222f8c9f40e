package com.numaansystems.obo.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * An API-key search was requested but no key is configured.
 */
public class SearchNotConfiguredException extends OboGatewayException {

    private final String instruction;

    public SearchNotConfiguredException(String instruction) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "SEARCH_API_KEY not configured",
                "The search API key is empty, API-key search is unavailable");
        this.instruction = instruction;
    }

    public String getInstruction() {
        return instruction;
    }

    @Override
    public Map<String, Object> getAttributes() {
        Map<String, Object> attributes = attributes();
        attributes.put("instruction", instruction);
        return attributes;
    }
}
