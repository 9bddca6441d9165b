package com.pricesync.orchestrator.service;

import com.pricesync.orchestrator.model.CallResult;
import com.pricesync.orchestrator.model.ChainResult;
import com.pricesync.orchestrator.model.ProcessDefinition;
import com.pricesync.orchestrator.model.SyncStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a process chain: every parser in order, then every table process in order.
 *
 * The chain stops at the first failing step. Later steps work on data the earlier
 * ones produced, so nothing after a failure is attempted.
 *
 * Callers are expected to hold the {@link RunLock}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChainExecutor {

    private final ApiGateway apiGateway;

    public ChainResult run(ProcessDefinition definition) {
        ChainResult.ChainResultBuilder result = ChainResult.builder().processName(definition.getName());
        try {
            return execute(definition, result);
        } catch (Exception e) {
            log.error("Unexpected failure while running '{}': {}", definition.getName(), e.getMessage(), e);
            return result
                    .succeeded(false)
                    .logEntry("[-] Process '" + definition.getName()
                            + "': unexpected internal error, see server logs")
                    .build();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ChainResult execute(ProcessDefinition definition, ChainResult.ChainResultBuilder result) {
        log.info("Running '{}' chain. Parsers: {}", definition.getName(), definition.getParsers());
        Integer lastStatus = null;

        for (String parser : definition.getParsers()) {
            CallResult call = apiGateway.startParser(parser);
            result.logEntry(entry(call, "Parser '" + parser + "'"));
            lastStatus = call.statusCode();
            if (!call.succeeded()) {
                log.warn("Chain '{}' stopped: parser '{}' failed", definition.getName(), parser);
                return result.succeeded(false).statusCode(lastStatus).failedStage(ChainResult.Stage.FETCH).build();
            }
        }

        log.info("Parsers finished for '{}'. Starting sync methods: {}", definition.getName(),
                definition.getSyncSteps().stream().map(SyncStep::method).toList());

        for (SyncStep step : definition.getSyncSteps()) {
            CallResult call = apiGateway.startTableProcess(step.method(), step.args());
            result.logEntry(entry(call, "Table process '" + step.method() + "'"));
            lastStatus = call.statusCode();
            if (!call.succeeded()) {
                log.warn("Chain '{}' stopped: table process '{}' failed", definition.getName(), step.method());
                return result.succeeded(false).statusCode(lastStatus).failedStage(ChainResult.Stage.SYNC).build();
            }
        }

        log.info("Chain '{}' completed successfully", definition.getName());
        return result.succeeded(true).statusCode(lastStatus).build();
    }

    static String entry(CallResult call, String description) {
        String status = call.statusCode() == null ? "-" : String.valueOf(call.statusCode());
        return "[" + status + "] " + description + ": " + call.message();
    }
}
