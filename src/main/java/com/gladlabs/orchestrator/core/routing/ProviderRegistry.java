package com.gladlabs.orchestrator.core.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of registered providers and their profiles, built once at startup.
 */
public final class ProviderRegistry {

    private final Map<String, ProviderHandle> handles;

    public ProviderRegistry(List<ProviderHandle> handles) {
        Map<String, ProviderHandle> byId = new LinkedHashMap<>();
        for (ProviderHandle handle : handles) {
            if (!handle.providerId().equals(handle.provider().id())) {
                throw new IllegalArgumentException("Profile id " + handle.providerId()
                        + " does not match provider id " + handle.provider().id());
            }
            if (byId.putIfAbsent(handle.providerId(), handle) != null) {
                throw new IllegalArgumentException("Duplicate provider id: " + handle.providerId());
            }
        }
        this.handles = Collections.unmodifiableMap(byId);
    }

    public Optional<ProviderHandle> find(String providerId) {
        return Optional.ofNullable(handles.get(providerId));
    }

    public boolean contains(String providerId) {
        return handles.containsKey(providerId);
    }

    /** Profiles in registration order. */
    public List<ModelProfile> profiles() {
        List<ModelProfile> profiles = new ArrayList<>(handles.size());
        handles.values().forEach(h -> profiles.add(h.profile()));
        return profiles;
    }

    public List<ProviderHandle> handles() {
        return List.copyOf(handles.values());
    }

    public List<String> ids() {
        return List.copyOf(handles.keySet());
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }
}
