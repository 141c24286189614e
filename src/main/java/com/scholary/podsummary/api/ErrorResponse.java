package com.scholary.podsummary.api;

/**
 * Error body returned for every failed request.
 *
 * @param error short machine-readable category, e.g. {@code not_found}
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String message) {}
