package com.pricesync.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A compiled-in business process: parsers to start first, then table processes
 * that reconcile what the parsers gathered. Order matters in both lists.
 */
@Value
@Builder
public class ProcessDefinition {

    String name;

    @Singular
    List<String> parsers;

    @Singular
    List<SyncStep> syncSteps;

    public int stepCount() {
        return parsers.size() + syncSteps.size();
    }
}
