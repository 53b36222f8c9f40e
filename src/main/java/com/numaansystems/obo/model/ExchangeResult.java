package com.numaansystems.obo.model;

/**
 * Outcome of one On-Behalf-Of token exchange.
 *
 * <p>Errors reported by the identity provider are a {@link Failure}, not an
 * exception. Transport problems are thrown as
 * {@link com.numaansystems.obo.exception.TransportException} instead.</p>
 */
public sealed interface ExchangeResult permits ExchangeResult.Success, ExchangeResult.Failure {

    boolean isSuccess();

    /**
     * The identity provider issued a token for the requested scopes.
     *
     * @param accessToken the downstream access token
     */
    record Success(String accessToken) implements ExchangeResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toString() {
            return "Success[accessToken=***]";
        }
    }

    /**
     * The identity provider rejected the exchange.
     *
     * @param errorCode OAuth2 error code, e.g. {@code invalid_grant}
     * @param errorDescription provider supplied description
     * @param correlationId provider correlation id, may be null
     */
    record Failure(String errorCode, String errorDescription, String correlationId) implements ExchangeResult {

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
