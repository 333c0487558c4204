package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.Capability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static provider priority per task type.
 * <p>
 * A chain is a list of tiers; a configured entry {@code "a|b"} puts a and b in the same
 * tier. Resolution order: phase override, task type, capability id, {@code "default"},
 * then every registered provider as a single tier. Ids the registry does not know are
 * dropped, as are repeats of an id already placed in an earlier tier.
 */
public class FallbackChains {

    public static final String DEFAULT_KEY = "default";

    private final Map<String, List<String>> chains;

    public FallbackChains(Map<String, List<String>> chains) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (chains != null) {
            chains.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), List.copyOf(v)));
        }
        this.chains = Map.copyOf(normalized);
    }

    public List<List<String>> resolve(String taskType, Capability capability, List<String> override,
                                      ProviderRegistry registry) {
        List<String> configured = pick(taskType, capability, override);
        if (configured == null) {
            return registry.isEmpty() ? List.of() : List.of(registry.ids());
        }
        return tiers(configured, registry);
    }

    public Map<String, List<String>> configured() {
        return chains;
    }

    private List<String> pick(String taskType, Capability capability, List<String> override) {
        if (override != null && !override.isEmpty()) {
            return override;
        }
        if (taskType != null) {
            List<String> byTask = chains.get(taskType.toLowerCase(Locale.ROOT));
            if (byTask != null) {
                return byTask;
            }
        }
        if (capability != null && chains.containsKey(capability.id())) {
            return chains.get(capability.id());
        }
        return chains.get(DEFAULT_KEY);
    }

    private static List<List<String>> tiers(List<String> entries, ProviderRegistry registry) {
        Set<String> seen = new LinkedHashSet<>();
        List<List<String>> tiers = new ArrayList<>();
        for (String entry : entries) {
            List<String> tier = Arrays.stream(entry.split("\\|"))
                    .map(String::trim)
                    .filter(id -> !id.isEmpty() && registry.contains(id) && seen.add(id))
                    .toList();
            if (!tier.isEmpty()) {
                tiers.add(tier);
            }
        }
        return tiers;
    }

    /** Every provider id named anywhere in an entry list, used for validation. */
    public static List<String> providerIds(List<String> entries) {
        return entries.stream()
                .flatMap(e -> Arrays.stream(e.split("\\|")))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
    }
}
