package com.pricesync.orchestrator.service;

import com.pricesync.orchestrator.model.ProcessDefinition;
import com.pricesync.orchestrator.model.SyncStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name → chain lookup for every process operators may run or schedule.
 *
 * Definitions are compiled in. An unknown name is a validation error for the
 * caller, reported as {@link IllegalArgumentException}.
 */
@Component
@Slf4j
public class ProcessRegistry {

    public static final String SALE = "Sale";
    public static final String CURRENCY_INFO = "CurrencyInfo";
    public static final String PACKAGE_ID_PRICE = "PackageIdPrice";

    private final Map<String, ProcessDefinition> definitions;
    private final List<String> names;

    public ProcessRegistry() {
        this(defaultDefinitions());
    }

    public ProcessRegistry(List<ProcessDefinition> definitions) {
        Map<String, ProcessDefinition> byName = new LinkedHashMap<>();
        for (ProcessDefinition def : definitions) {
            validate(def);
            if (byName.putIfAbsent(def.getName(), def) != null) {
                throw new IllegalStateException("Duplicate process definition: " + def.getName());
            }
        }
        this.definitions = Map.copyOf(byName);
        this.names = List.copyOf(byName.keySet());
        log.info("Registered {} process chains: {}", names.size(), names);
    }

    public Optional<ProcessDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(definitions.get(name));
    }

    public ProcessDefinition require(String name) {
        return find(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown process '" + name + "'. Known processes: " + names));
    }

    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }

    /** Registration order. */
    public List<String> names() {
        return names;
    }

    public Collection<ProcessDefinition> all() {
        return names.stream().map(definitions::get).toList();
    }

    // ── Built-in chains ───────────────────────────────────────────────────────

    static List<ProcessDefinition> defaultDefinitions() {
        return List.of(
                ProcessDefinition.builder()
                        .name(SALE)
                        .parser("PackageIdSaleInfo")
                        .parser("BundleIdSaleInfo")
                        .syncStep(SyncStep.of("set_final_price"))
                        .syncStep(SyncStep.of("set_delivery_region"))
                        .syncStep(SyncStep.of("set_shop_price", "main"))
                        .build(),
                ProcessDefinition.builder()
                        .name(CURRENCY_INFO)
                        .parser("CurrencyInfo")
                        .syncStep(SyncStep.of("set_delivery_region"))
                        .syncStep(SyncStep.of("set_shop_price", "main"))
                        .build(),
                ProcessDefinition.builder()
                        .name(PACKAGE_ID_PRICE)
                        .parser("PackageIdPrice")
                        .syncStep(SyncStep.of("set_final_price"))
                        .syncStep(SyncStep.of("set_delivery_region"))
                        .syncStep(SyncStep.of("set_shop_price", "main"))
                        .build()
        );
    }

    private static void validate(ProcessDefinition def) {
        if (def.getName() == null || def.getName().isBlank()) {
            throw new IllegalStateException("Process definition without a name");
        }
        // job ids are "schedule_<name>"; an underscore would make the id ambiguous
        if (!def.getName().matches("[A-Za-z0-9]+")) {
            throw new IllegalStateException("Process name must be alphanumeric: " + def.getName());
        }
        if (def.stepCount() == 0) {
            throw new IllegalStateException("Process '" + def.getName() + "' has no steps");
        }
    }
}
