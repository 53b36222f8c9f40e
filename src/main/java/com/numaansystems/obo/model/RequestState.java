package com.numaansystems.obo.model;

public enum RequestState {
    AWAITING_TOKEN,
    CLAIMS_EXTRACTED,
    EXCHANGING,
    EXCHANGED,
    EXCHANGE_FAILED,
    FILTER_BUILT,
    CALLING,
    RESPONDED,
    FAILED;

    public boolean isTerminal() {
        return this == RESPONDED || this == FAILED;
    }
}
