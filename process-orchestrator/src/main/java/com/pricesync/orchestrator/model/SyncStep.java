package com.pricesync.orchestrator.model;

import java.util.List;

/**
 * One "table process" call of a chain: the remote method name plus optional
 * string arguments, which are sent JSON-encoded as the {@code args} parameter.
 */
public record SyncStep(String method, List<String> args) {

    public SyncStep {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static SyncStep of(String method, String... args) {
        return new SyncStep(method, List.of(args));
    }
}
