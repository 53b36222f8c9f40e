package com.numaansystems.obo.model;

/**
 * What the search filter does for a user whose token carries no groups.
 */
public enum EmptyGroupsPolicy {

    /** No filter is applied and every document is visible (fail-open). */
    SHOW_ALL,

    /** A deny-all filter is applied and nothing is visible (fail-closed). */
    SHOW_NONE
}
