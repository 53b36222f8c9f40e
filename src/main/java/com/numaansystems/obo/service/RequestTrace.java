package com.numaansystems.obo.service;

import com.numaansystems.obo.model.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks the state of one gateway request from token receipt to response.
 *
 * <p>Instances are created per request and never shared between threads.
 * Once a terminal state is reached further transitions are rejected.</p>
 */
public class RequestTrace {

    private static final Logger logger = LoggerFactory.getLogger(RequestTrace.class);

    private final String route;
    private final List<RequestState> states = new ArrayList<>();

    public RequestTrace(String route) {
        this.route = route;
        states.add(RequestState.AWAITING_TOKEN);
    }

    public void moveTo(RequestState next) {
        RequestState current = current();
        if (current.isTerminal()) {
            throw new IllegalStateException("Request on " + route + " already finished in state " + current);
        }
        states.add(next);
        logger.debug("[{}] {} -> {}", route, current, next);
    }

    /**
     * Marks the request failed, keeping the original error for the log.
     */
    public void fail(Exception cause) {
        if (current().isTerminal()) {
            return;
        }
        logger.debug("[{}] {} -> {} ({})", route, current(), RequestState.FAILED, cause.getClass().getSimpleName());
        states.add(RequestState.FAILED);
    }

    public RequestState current() {
        return states.get(states.size() - 1);
    }

    public List<RequestState> history() {
        return Collections.unmodifiableList(states);
    }

    public String getRoute() {
        return route;
    }
}
