package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.Capability;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One handler per {@link Capability}, resolved once at startup. Startup fails when a
 * capability has no handler or more than one.
 */
@Component
public class PhaseHandlerRegistry {

    private final Map<Capability, PhaseHandler> handlers = new EnumMap<>(Capability.class);

    public PhaseHandlerRegistry(List<PhaseHandler> handlers) {
        for (PhaseHandler handler : handlers) {
            if (this.handlers.putIfAbsent(handler.capability(), handler) != null) {
                throw new IllegalStateException("Duplicate phase handler for capability " + handler.capability());
            }
        }
        for (Capability capability : Capability.values()) {
            if (!this.handlers.containsKey(capability)) {
                throw new IllegalStateException("No phase handler registered for capability " + capability);
            }
        }
    }

    public PhaseHandler handlerFor(Capability capability) {
        return handlers.get(capability);
    }
}
