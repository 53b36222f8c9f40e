package com.numaansystems.obo.service;

import com.numaansystems.obo.model.RequestState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestTraceTest {

    @Test
    @DisplayName("Should record transitions in order")
    void testHistory() {
        RequestTrace trace = new RequestTrace("search");

        trace.moveTo(RequestState.CLAIMS_EXTRACTED);
        trace.moveTo(RequestState.EXCHANGING);
        trace.moveTo(RequestState.EXCHANGED);
        trace.moveTo(RequestState.FILTER_BUILT);
        trace.moveTo(RequestState.CALLING);
        trace.moveTo(RequestState.RESPONDED);

        assertEquals(List.of(RequestState.AWAITING_TOKEN, RequestState.CLAIMS_EXTRACTED, RequestState.EXCHANGING,
                RequestState.EXCHANGED, RequestState.FILTER_BUILT, RequestState.CALLING, RequestState.RESPONDED),
                trace.history());
        assertEquals("search", trace.getRoute());
    }

    @Test
    @DisplayName("Should reject transitions after a terminal state")
    void testTerminal() {
        RequestTrace trace = new RequestTrace("profile");
        trace.moveTo(RequestState.RESPONDED);

        assertThrows(IllegalStateException.class, () -> trace.moveTo(RequestState.CALLING));
    }

    @Test
    @DisplayName("Should fail once and ignore later failures")
    void testFail() {
        RequestTrace trace = new RequestTrace("search");
        trace.moveTo(RequestState.EXCHANGING);
        trace.moveTo(RequestState.EXCHANGE_FAILED);

        trace.fail(new IllegalStateException("first"));
        trace.fail(new IllegalStateException("second"));

        assertEquals(RequestState.FAILED, trace.current());
        assertEquals(4, trace.history().size());
    }
}
