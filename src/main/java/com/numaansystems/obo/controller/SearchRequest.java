package com.numaansystems.obo.controller;

/**
 * Body of the search routes. A missing {@code query} searches for everything.
 */
public record SearchRequest(String query) {
}
