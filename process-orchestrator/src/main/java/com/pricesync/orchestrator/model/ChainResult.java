package com.pricesync.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a whole chain run. Built once per run and handed to the status store
 * and the notifier; never kept around afterwards.
 */
@Value
@Builder
public class ChainResult {

    public enum Stage { FETCH, SYNC }

    String processName;
    boolean succeeded;

    /** Status of the failing step, or of the last step on success. */
    Integer statusCode;

    /** Null on success. */
    Stage failedStage;

    /** One "[status] step: message" entry per executed step, in execution order. */
    @Singular("logEntry")
    List<String> log;

    /**
     * Operator-facing text, also what gets persisted as the status message.
     */
    public String summary() {
        String details = String.join("\n", log);
        if (succeeded) {
            return "Process '" + processName + "' completed successfully.\n\nExecution details:\n" + details;
        }
        String stage = failedStage == Stage.SYNC ? "table sync" : "parser";
        return "Process '" + processName + "' stopped at the " + stage + " stage:\n" + details;
    }
}
