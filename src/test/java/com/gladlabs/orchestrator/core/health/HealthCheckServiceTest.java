package com.gladlabs.orchestrator.core.health;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.persistence.InMemoryTaskStore;
import com.gladlabs.orchestrator.core.persistence.TaskStore;
import com.gladlabs.orchestrator.core.persistence.TaskStoreException;
import com.gladlabs.orchestrator.core.routing.ModelProfile;
import com.gladlabs.orchestrator.core.routing.ProviderHandle;
import com.gladlabs.orchestrator.core.routing.ProviderLivenessCache;
import com.gladlabs.orchestrator.core.routing.ProviderRegistry;
import com.gladlabs.orchestrator.support.ScriptedProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static ProviderRegistry registry(ScriptedProvider... providers) {
        return new ProviderRegistry(Arrays.stream(providers)
                .map(p -> new ProviderHandle(
                        new ModelProfile(p.id(), "m", "http://localhost", EnumSet.allOf(Capability.class),
                                0.0, 1.0, true), p))
                .toList());
    }

    private static HealthCheckService service(ProviderRegistry registry, TaskStore store) {
        return new HealthCheckService(registry, new ProviderLivenessCache(Duration.ofSeconds(30), Clock.systemUTC()), store);
    }

    @Test
    @DisplayName("all providers live reports UP")
    void allLive() {
        var health = service(registry(new ScriptedProvider("a"), new ScriptedProvider("b")), new InMemoryTaskStore());

        HealthStatus status = health.checkProviders();

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("UP", status.metadata().get("a"));
        assertEquals("2/2 providers live", status.detail());
    }

    @Test
    @DisplayName("some providers down reports DEGRADED, none live reports DOWN")
    void partialAndNone() {
        var mixed = service(registry(new ScriptedProvider("a"), new ScriptedProvider("b").live(false)),
                new InMemoryTaskStore());
        assertEquals(HealthStatus.Status.DEGRADED, mixed.checkProviders().status());
        assertEquals("DOWN", mixed.checkProviders().metadata().get("b"));

        var dead = service(registry(new ScriptedProvider("a").live(false)), new InMemoryTaskStore());
        assertEquals(HealthStatus.Status.DOWN, dead.checkProviders().status());
    }

    @Test
    @DisplayName("no configured providers reports DOWN")
    void noProviders() {
        var health = service(new ProviderRegistry(List.of()), new InMemoryTaskStore());
        assertEquals(HealthStatus.Status.DOWN, health.checkProviders().status());
    }

    @Test
    @DisplayName("liveness results are cached between checks")
    void probesCached() {
        ScriptedProvider provider = new ScriptedProvider("a");
        var health = service(registry(provider), new InMemoryTaskStore());

        health.checkProviders();
        health.checkProviders();

        assertEquals(1, provider.probes());
    }

    @Test
    @DisplayName("task store status reflects connectivity and errors")
    void taskStore() {
        var inMemory = service(registry(new ScriptedProvider("a")), new InMemoryTaskStore()).checkTaskStore();
        assertEquals(HealthStatus.Status.UP, inMemory.status());
        assertEquals("in-memory", inMemory.metadata().get("type"));

        TaskStore invalid = mock(TaskStore.class);
        when(invalid.isHealthy()).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN,
                service(registry(new ScriptedProvider("a")), invalid).checkTaskStore().status());

        TaskStore broken = mock(TaskStore.class);
        when(broken.isHealthy()).thenThrow(new TaskStoreException("pool exhausted"));
        HealthStatus failed = service(registry(new ScriptedProvider("a")), broken).checkTaskStore();
        assertEquals(HealthStatus.Status.DOWN, failed.status());
        assertTrue(failed.detail().contains("pool exhausted"));
        assertEquals("jdbc", failed.metadata().get("type"));
    }

    @Test
    @DisplayName("checkAll covers providers and the task store")
    void checkAll() {
        var all = service(registry(new ScriptedProvider("a")), new InMemoryTaskStore()).checkAll();
        assertEquals(List.of("providers", "taskStore"), all.stream().map(HealthStatus::component).toList());
    }
}
