package com.numaansystems.obo.controller;

import com.numaansystems.obo.exception.MissingBearerTokenException;
import com.numaansystems.obo.security.BearerTokenExtractor;
import com.numaansystems.obo.service.OboOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints of the OBO gateway.
 *
 * <p>Every route except {@code /health} requires the caller's access token in
 * {@code Authorization: Bearer}. Without one the request is rejected with 401
 * before any downstream call.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/api")
public class OboController {

    private static final Logger logger = LoggerFactory.getLogger(OboController.class);

    private final OboOrchestrator orchestrator;

    public OboController(OboOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping({"/profile", "/hello"})
    public ResponseEntity<Map<String, Object>> profile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        logger.info("Profile endpoint called");
        return ResponseEntity.ok(orchestrator.profile(requireToken(authorization)));
    }

    @PostMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SearchRequest request) {
        logger.info("Search endpoint called");
        return ResponseEntity.ok(orchestrator.search(requireToken(authorization), query(request)));
    }

    @PostMapping("/search-simple")
    public ResponseEntity<Map<String, Object>> searchSimple(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SearchRequest request) {
        logger.info("Simple search endpoint called");
        return ResponseEntity.ok(orchestrator.searchSimple(requireToken(authorization), query(request)));
    }

    @PostMapping("/search-unified")
    public ResponseEntity<Map<String, Object>> searchUnified(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SearchRequest request) {
        logger.info("Unified search endpoint called");
        return ResponseEntity.ok(orchestrator.searchUnified(requireToken(authorization), query(request)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new LinkedHashMap<>();
        healthInfo.put("status", "healthy");
        healthInfo.put("message", "OBO API is running");
        return ResponseEntity.ok(healthInfo);
    }

    private static String requireToken(String authorization) {
        return BearerTokenExtractor.extract(authorization)
                .orElseThrow(MissingBearerTokenException::new);
    }

    private static String query(SearchRequest request) {
        return request != null ? request.query() : null;
    }
}
