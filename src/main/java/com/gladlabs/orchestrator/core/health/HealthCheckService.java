package com.gladlabs.orchestrator.core.health;

import com.gladlabs.orchestrator.core.persistence.InMemoryTaskStore;
import com.gladlabs.orchestrator.core.persistence.TaskStore;
import com.gladlabs.orchestrator.core.routing.ProviderHandle;
import com.gladlabs.orchestrator.core.routing.ProviderLivenessCache;
import com.gladlabs.orchestrator.core.routing.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports provider liveness and task store connectivity.
 * <p>
 * Provider checks go through the liveness cache, so a probe is only sent for entries
 * older than the cache TTL.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProviderRegistry registry;
    private final ProviderLivenessCache liveness;
    private final TaskStore taskStore;

    public HealthCheckService(ProviderRegistry registry, ProviderLivenessCache liveness, TaskStore taskStore) {
        this.registry = registry;
        this.liveness = liveness;
        this.taskStore = taskStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProviders());
        results.add(checkTaskStore());
        return results;
    }

    public HealthStatus checkProviders() {
        if (registry.isEmpty()) {
            return new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No providers configured", Map.of());
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        int live = 0;
        for (ProviderHandle handle : registry.handles()) {
            boolean up = liveness.isLive(handle.provider());
            metadata.put(handle.providerId(), up ? "UP" : "DOWN");
            if (up) {
                live++;
            }
        }
        int total = registry.handles().size();
        HealthStatus.Status status = live == total ? HealthStatus.Status.UP
                : live == 0 ? HealthStatus.Status.DOWN : HealthStatus.Status.DEGRADED;
        if (status != HealthStatus.Status.UP) {
            log.warn("Provider health {}: {}/{} live", status, live, total);
        }
        return new HealthStatus("providers", status, live + "/" + total + " providers live", metadata);
    }

    public HealthStatus checkTaskStore() {
        String kind = taskStore instanceof InMemoryTaskStore ? "in-memory" : "jdbc";
        try {
            if (taskStore.isHealthy()) {
                return new HealthStatus("taskStore", HealthStatus.Status.UP,
                        "Task store available", Map.of("type", kind));
            }
            return new HealthStatus("taskStore", HealthStatus.Status.DOWN,
                    "Task store connection invalid", Map.of("type", kind));
        } catch (RuntimeException e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return new HealthStatus("taskStore", HealthStatus.Status.DOWN,
                    "Task store error: " + e.getMessage(), Map.of("type", kind));
        }
    }
}
