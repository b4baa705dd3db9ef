package com.xksgroup.signagesync.service;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.xksgroup.signagesync.model.dto.SseSubscriber;
import com.xksgroup.signagesync.model.sync.SyncEvent;
import com.xksgroup.signagesync.sync.SyncService;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/**
 * Relays sync events to SSE clients. Progress events are coalesced; everything else goes out as it happens.
 */
@Slf4j
@Service
public class EventService {

    private final Map<String, SseSubscriber> emitters = new ConcurrentHashMap<>();
    private final SyncService syncService;

    // Throttling fields
    private final long dispatchCooldownMs;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final AtomicBoolean cooldownActive = new AtomicBoolean(false);
    private final AtomicBoolean pendingUpdate = new AtomicBoolean(false);
    private final AtomicReference<SyncEvent> latestProgress = new AtomicReference<>();

    private Disposable subscription;

    public EventService(SyncService syncService,
                        @Value("${events.progress-cooldown-ms:2000}") long dispatchCooldownMs) {
        this.syncService = syncService;
        this.dispatchCooldownMs = dispatchCooldownMs;
    }

    @PostConstruct
    public void start() {
        subscription = syncService.events().subscribe(this::onSyncEvent,
                e -> log.error("Sync event stream terminated", e));
    }

    /**
     * Client subscribes to SSE stream.
     */
    public SseEmitter subscribe(String clientId, Set<String> eventTypes) {
        SseEmitter emitter = createEmitter();
        emitters.put(clientId, SseSubscriber.builder().sseEmitter(emitter).eventTypes(eventTypes).build());

        Runnable cleanup = () -> emitters.remove(clientId);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(t -> cleanup.run());

        // Initial connection event
        safeSend(emitter, "connected", Map.of("ok", true, "clientId", clientId));
        return emitter;
    }

    SseEmitter createEmitter() {
        return new SseEmitter(0L);
    }

    /**
     * Progress still held back by the cooldown goes out before any other event,
     * so clients never see {@code catalog-ready} ahead of the final progress.
     */
    synchronized void onSyncEvent(SyncEvent event) {
        if (SyncEvent.DOWNLOAD_PROGRESS.equals(event.getType())) {
            latestProgress.set(event);
            dispatchProgress();
        } else {
            if (pendingUpdate.getAndSet(false)) {
                doDispatch();
            }
            broadcast(event);
        }
    }

    /**
     * Smart-throttled dispatch:
     * - Sends immediately if cooldown not active.
     * - Otherwise, marks pending for next round.
     * - When cooldown expires, sends the latest progress once.
     */
    synchronized void dispatchProgress() {
        if (cooldownActive.compareAndSet(false, true)) {
            doDispatch();

            try {
                scheduler.schedule(() -> {
                    cooldownActive.set(false);
                    if (pendingUpdate.getAndSet(false)) {
                        dispatchProgress();
                    }
                }, dispatchCooldownMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Progress dispatch scheduler already stopped");
            }
        } else {
            pendingUpdate.set(true);
        }
    }

    private void doDispatch() {
        SyncEvent progress = latestProgress.get();
        if (progress != null) {
            broadcast(progress);
        }
    }

    private void broadcast(SyncEvent event) {
        emitters.forEach((clientId, subscriber) -> {
            if (subscriber.accepts(event.getType())) {
                safeSend(subscriber.getSseEmitter(), event.getType(), event.getPayload());
            }
        });
    }

    public boolean isClientConnected(String clientId) {
        return emitters.containsKey(clientId);
    }

    public int connectedClients() {
        return emitters.size();
    }

    /**
     * Safely sends an SSE event, removing the emitter on failure.
     */
    private void safeSend(SseEmitter emitter, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(eventName)
                    .data(data)
                    .reconnectTime(3000)
                    .build());
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE client after failed send: {}", e.getMessage());
            emitter.completeWithError(e);
            emitters.entrySet().removeIf(en -> en.getValue().getSseEmitter() == emitter);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.dispose();
        }
        scheduler.shutdownNow();
        emitters.values().forEach(subscriber -> subscriber.getSseEmitter().complete());
        emitters.clear();
    }
}
