package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.approval.PromptEvent;
import com.agentgate.orchestrator.approval.PromptEventBus;
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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link PromptEventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * Each connected UI gets its own emitter and bus subscription; the
 * subscription is dropped when the emitter completes, times out or errors.
 * A comment line is sent every 30 seconds so idle proxies keep the
 * connection open while no prompt is pending.
 */
@Service
public class PromptStreamService {

    private static final Logger log = LoggerFactory.getLogger(PromptStreamService.class);

    /** Emitter lifetime; the UI reconnects after this. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final PromptEventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "prompt-sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public PromptStreamService(PromptEventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    PromptStreamService(PromptEventBus eventBus, long timeoutMs) {
        this.eventBus  = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
        for (EmitterRegistration registration : activeRegistrations) {
            registration.emitter().complete();
        }
    }

    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        PromptEventBus.Subscription subscription = eventBus.subscribe(event -> sendEvent(emitter, event));
        var registration = new EmitterRegistration(emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("Prompt stream error: {}", ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment on prompt stream: {}", e.getMessage());
        }

        log.info("Prompt stream opened ({} active)", activeRegistrations.size());
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, PromptEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event()
                    .id(event.promptId())
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping {} for {} on closed stream: {}",
                    event.eventType(), event.promptId(), e.getMessage());
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError / onCompletion callbacks remove the registration
                log.debug("Heartbeat failed on prompt stream: {}", e.getMessage());
            }
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(SseEmitter emitter, PromptEventBus.Subscription subscription) {}
}
