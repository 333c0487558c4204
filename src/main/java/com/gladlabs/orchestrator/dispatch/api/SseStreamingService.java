package com.gladlabs.orchestrator.dispatch.api;

import com.gladlabs.orchestrator.core.engine.ExecutionStatusView;
import com.gladlabs.orchestrator.core.events.EventBus;
import com.gladlabs.orchestrator.core.events.OrchestrationEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each client gets an emitter subscribed to one execution. The emitter completes after
 * the execution's terminal event. Idle connections get a comment heartbeat so proxies
 * do not drop them.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final Set<String> TERMINAL_EVENTS = Set.of(
            "execution.completed", "execution.failed", "execution.cancelled");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter callbacks clean up closed connections
                log.debug("Heartbeat skipped for execution {}: {}", registration.executionId, e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter streaming the events of one execution.
     */
    public SseEmitter createEmitter(String executionId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(executionId, event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(executionId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for execution {}: {}", executionId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for execution {}: {}", executionId, e.getMessage());
        }

        log.info("SSE emitter created for execution {} (timeout={}ms)", executionId, timeoutMs);
        return emitter;
    }

    /**
     * Replays the terminal status of an execution that finished before the client
     * subscribed, then completes the emitter.
     */
    public void sendFinalStatus(SseEmitter emitter, ExecutionStatusView view) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", view.status().value());
        payload.put("progress_percent", view.progressPercent());
        if (view.error() != null) {
            payload.put("kind", view.error().kind().label());
            payload.put("message", view.error().message());
        }
        log.debug("Execution {} already {}; replaying final status", view.executionId(), view.status().value());
        sendEvent(emitter, OrchestrationEvent.of("execution." + view.status().value(), view.executionId(),
                null, payload));
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, OrchestrationEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("executionId", event.executionId());
            if (event.phaseName() != null) {
                data.put("phase", event.phaseName());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
            if (TERMINAL_EVENTS.contains(event.eventType())) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for execution {}: {}",
                    event.eventType(), event.executionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String executionId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
