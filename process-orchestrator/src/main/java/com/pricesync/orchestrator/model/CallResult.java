package com.pricesync.orchestrator.model;

/**
 * Outcome of a single call to the external API.
 * {@code statusCode} is null when no HTTP response was received (timeout, refused connection).
 */
public record CallResult(boolean succeeded, String message, Integer statusCode) {

    public static CallResult success(String message, int statusCode) {
        return new CallResult(true, message, statusCode);
    }

    public static CallResult failure(String message, Integer statusCode) {
        return new CallResult(false, message, statusCode);
    }

    public static CallResult transportFailure(String message) {
        return new CallResult(false, message, null);
    }
}
