package com.numaansystems.obo.exception;

import com.numaansystems.obo.model.ExchangeResult;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * The identity provider rejected an On-Behalf-Of exchange.
 */
public class TokenExchangeException extends OboGatewayException {

    private final ExchangeResult.Failure failure;
    private final List<String> scopesRequested;
    private final String suggestion;

    public TokenExchangeException(String error, ExchangeResult.Failure failure,
                                  List<String> scopesRequested, String suggestion) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, error,
                failure.errorDescription() != null ? failure.errorDescription() : "Unknown error");
        this.failure = failure;
        this.scopesRequested = List.copyOf(scopesRequested);
        this.suggestion = suggestion;
    }

    public ExchangeResult.Failure getFailure() {
        return failure;
    }

    public List<String> getScopesRequested() {
        return scopesRequested;
    }

    @Override
    public Map<String, Object> getAttributes() {
        Map<String, Object> attributes = attributes();
        attributes.put("error_code", failure.errorCode());
        attributes.put("correlation_id", failure.correlationId() != null ? failure.correlationId() : "N/A");
        attributes.put("scopes_requested", scopesRequested);
        if (suggestion != null) {
            attributes.put("suggestion", suggestion);
        }
        return attributes;
    }
}
