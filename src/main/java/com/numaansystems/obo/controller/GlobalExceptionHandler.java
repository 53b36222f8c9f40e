package com.numaansystems.obo.controller;

import com.numaansystems.obo.exception.MissingBearerTokenException;
import com.numaansystems.obo.exception.OboGatewayException;
import com.numaansystems.obo.security.BearerTokenExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns every request failure into a JSON body with {@code error} and
 * {@code details} keys.
 *
 * <pre>
 * {
 *   "error": "OBO token acquisition failed for AI Search",
 *   "details": "AADSTS65001: The user or administrator has not consented ...",
 *   "error_code": "invalid_grant",
 *   "correlation_id": "6f0c...",
 *   "scopes_requested": ["https://search.azure.com/.default"],
 *   "suggestion": "..."
 * }
 * </pre>
 *
 * <p>Gateway exceptions keep their own status; downstream errors mirror the
 * downstream status. Spring MVC failures (unknown path, wrong method,
 * unsupported media type and the like) keep the status Spring assigns them.
 * Anything unexpected becomes a 500 without a stack trace.</p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(OboGatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGatewayException(OboGatewayException ex) {
        if (ex.getStatus() >= 500) {
            logger.error("{}: {}", ex.getError(), ex.getDetails());
        } else {
            logger.warn("{}: {}", ex.getError(), ex.getDetails());
        }
        return ResponseEntity.status(ex.getStatus()).body(gatewayErrorBody(ex));
    }

    /**
     * The body is read before the controller runs, so a request without a
     * bearer token and with a broken body is still answered with 401.
     */
    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers, HttpStatusCode status,
                                                                  WebRequest request) {
        if (BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION)).isEmpty()) {
            MissingBearerTokenException missingToken = new MissingBearerTokenException();
            logger.warn("{}: {}", missingToken.getError(), missingToken.getDetails());
            return ResponseEntity.status(missingToken.getStatus()).body(gatewayErrorBody(missingToken));
        }
        logger.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody("Invalid request body", "Expected a JSON object such as {\"query\": \"contracts\"}"));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String error = status != null ? status.getReasonPhrase() : "HTTP " + statusCode.value();
        if (statusCode.is5xxServerError()) {
            logger.error("{}: {}", error, ex.getMessage());
        } else {
            logger.warn("{}: {}", error, ex.getMessage());
        }
        return ResponseEntity.status(statusCode).headers(headers).body(errorBody(error, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("Exception occurred", ex.getMessage()));
    }

    private static Map<String, Object> gatewayErrorBody(OboGatewayException ex) {
        Map<String, Object> body = errorBody(ex.getError(), ex.getDetails());
        body.putAll(ex.getAttributes());
        return body;
    }

    private static Map<String, Object> errorBody(String error, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details);
        return body;
    }
}
