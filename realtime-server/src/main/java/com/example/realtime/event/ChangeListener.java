package com.example.realtime.event;

import com.example.realtime.service.exception.ConnectionException;
import com.example.realtime.service.exception.HandlerException;
import com.example.realtime.service.exception.MalformedPayloadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Keeps exactly one subscription link to the change source alive and routes each parsed
 * notification to the handler registered for its channel.
 *
 * <p>Connect attempts are serialized. After a link failure exactly one reconnect is pending at a
 * time; an explicit {@link #disconnect()} or {@link #forceClose()} cancels it. Handlers run on the
 * receive thread and never see the link itself.
 */
@Slf4j
public class ChangeListener {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ChangeEventSource source;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final Executor receiveExecutor;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration pollTimeout;
    private final Duration disconnectTimeout;

    private final Map<String, ChangeEventHandler> handlers = new ConcurrentHashMap<>();
    private final Object connectLock = new Object();
    private final Object stateLock = new Object();

    private final AtomicLong handledEvents = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong failedEvents = new AtomicLong();

    // guarded by stateLock
    private LinkState state = LinkState.DISCONNECTED;
    private SubscriptionLink link;
    private SubscriptionLink closingLink;
    private ScheduledFuture<?> reconnectTask;
    private int consecutiveFailures;
    private boolean stopped;

    public ChangeListener(
            ChangeEventSource source,
            ObjectMapper objectMapper,
            ScheduledExecutorService scheduler,
            Executor receiveExecutor,
            ReconnectPolicy reconnectPolicy,
            Duration pollTimeout,
            Duration disconnectTimeout) {
        this.source = source;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.receiveExecutor = receiveExecutor;
        this.reconnectPolicy = reconnectPolicy;
        this.pollTimeout = pollTimeout;
        this.disconnectTimeout = disconnectTimeout;
    }

    /**
     * Associates a handler with a channel. A second registration for the same channel replaces the
     * first. Channels registered while connected are subscribed on the next connect.
     */
    public void registerChannel(String channel, ChangeEventHandler handler) {
        if (!StringUtils.hasText(channel)) {
            throw new IllegalArgumentException("Channel name is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler is required for channel " + channel);
        }
        if (!source.supportsChannel(channel)) {
            throw new IllegalArgumentException("Channel name not accepted by the change source: " + channel);
        }
        ChangeEventHandler previous = handlers.put(channel, handler);
        if (previous != null) {
            log.info("Replaced handler for channel {}", channel);
        } else {
            log.info("Registered handler for channel {}", channel);
        }
    }

    /**
     * Opens the link, subscribes every registered channel and starts receiving.
     *
     * @throws ConnectionException if the link cannot be established; a reconnect is scheduled
     */
    public void connect() {
        doConnect(true);
    }

    // a scheduled reconnect never clears the stop flag set by disconnect() or forceClose()
    private void doConnect(boolean explicit) {
        synchronized (connectLock) {
            synchronized (stateLock) {
                if (explicit) {
                    stopped = false;
                } else if (stopped) {
                    log.info("Change listener stopped, reconnect skipped");
                    return;
                }
                if (state == LinkState.CONNECTED) {
                    log.debug("Change listener already connected");
                    return;
                }
                moveTo(LinkState.CONNECTING);
                cancelReconnect();
            }

            SubscriptionLink opened = null;
            try {
                opened = source.open();
                for (String channel : handlers.keySet()) {
                    opened.subscribe(channel);
                    log.info("Listening on channel {}", channel);
                }
            } catch (RuntimeException ex) {
                if (opened != null) {
                    forceCloseQuietly(opened);
                }
                synchronized (stateLock) {
                    moveTo(LinkState.DISCONNECTED);
                    consecutiveFailures++;
                    scheduleReconnect();
                }
                log.error("Change listener failed to connect", ex);
                throw ex instanceof ConnectionException connectionException
                        ? connectionException
                        : new ConnectionException("Failed to open subscription link", ex);
            }

            synchronized (stateLock) {
                if (stopped) {
                    moveTo(LinkState.DISCONNECTED);
                    forceCloseQuietly(opened);
                    log.info("Change listener stopped while connecting, link discarded");
                    return;
                }
                link = opened;
                consecutiveFailures = 0;
                moveTo(LinkState.CONNECTED);
            }
            log.info("Change listener connected, {} channel(s) subscribed", handlers.size());

            SubscriptionLink active = opened;
            receiveExecutor.execute(() -> receiveLoop(active));
        }
    }

    /**
     * Graceful close bounded by the configured timeout. Cancels any pending reconnect.
     *
     * @throws ConnectionException if the link did not close in time; {@link #forceClose()} still
     *     works afterwards
     */
    public void disconnect() {
        SubscriptionLink current;
        synchronized (stateLock) {
            stopped = true;
            cancelReconnect();
            current = link;
            link = null;
            if (state == LinkState.CONNECTED) {
                moveTo(LinkState.DISCONNECTED);
            }
            closingLink = current;
        }
        if (current == null) {
            log.debug("Change listener disconnect requested with no open link");
            return;
        }

        CompletableFuture<Void> closing = CompletableFuture.runAsync(current::close);
        try {
            closing.get(disconnectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            synchronized (stateLock) {
                closingLink = null;
            }
            log.info("Change listener disconnected");
        } catch (TimeoutException ex) {
            throw new ConnectionException("Disconnect timed out after " + disconnectTimeout.toMillis() + " ms", ex);
        } catch (ExecutionException ex) {
            throw new ConnectionException("Graceful disconnect failed", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while disconnecting", ex);
        }
    }

    /**
     * Closes the link immediately without waiting on the remote side.
     */
    public void forceClose() {
        SubscriptionLink current;
        SubscriptionLink pending;
        synchronized (stateLock) {
            stopped = true;
            cancelReconnect();
            current = link;
            pending = closingLink;
            link = null;
            closingLink = null;
            if (state == LinkState.CONNECTED) {
                moveTo(LinkState.DISCONNECTED);
            }
        }
        if (current != null) {
            forceCloseQuietly(current);
        }
        if (pending != null && pending != current) {
            forceCloseQuietly(pending);
        }
        log.info("Change listener force-closed");
    }

    public boolean isConnected() {
        synchronized (stateLock) {
            return state == LinkState.CONNECTED;
        }
    }

    public LinkState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isReconnectPending() {
        synchronized (stateLock) {
            return reconnectTask != null && !reconnectTask.isDone();
        }
    }

    public Set<String> registeredChannels() {
        return Set.copyOf(handlers.keySet());
    }

    public long handledEvents() {
        return handledEvents.get();
    }

    public long droppedEvents() {
        return droppedEvents.get();
    }

    public long failedEvents() {
        return failedEvents.get();
    }

    private void receiveLoop(SubscriptionLink active) {
        while (isCurrent(active)) {
            List<ChangeNotification> batch;
            try {
                batch = active.poll(pollTimeout);
            } catch (RuntimeException ex) {
                handleLinkFailure(active, ex);
                return;
            }
            for (ChangeNotification notification : batch) {
                dispatch(notification);
            }
        }
        log.debug("Receive loop finished for superseded link");
    }

    private boolean isCurrent(SubscriptionLink candidate) {
        synchronized (stateLock) {
            return link == candidate;
        }
    }

    private void handleLinkFailure(SubscriptionLink failed, RuntimeException cause) {
        synchronized (stateLock) {
            if (link != failed) {
                return;
            }
            link = null;
            moveTo(LinkState.DISCONNECTED);
            consecutiveFailures++;
        }
        log.error("Subscription link lost", cause);
        forceCloseQuietly(failed);
        synchronized (stateLock) {
            scheduleReconnect();
        }
    }

    private void dispatch(ChangeNotification notification) {
        String channel = notification.channel();
        if (!StringUtils.hasText(channel) || notification.payload() == null) {
            log.warn("Received notification without channel or payload");
            droppedEvents.incrementAndGet();
            return;
        }

        Map<String, Object> payload;
        try {
            payload = parse(channel, notification.payload());
        } catch (MalformedPayloadException ex) {
            log.warn("Dropping malformed payload on channel {}: {}", channel, ex.getMessage());
            droppedEvents.incrementAndGet();
            return;
        }

        ChangeEventHandler handler = handlers.get(channel);
        if (handler == null) {
            log.warn("No handler registered for channel {}", channel);
            droppedEvents.incrementAndGet();
            return;
        }

        log.debug("Received on {}: {}", channel, payload);
        try {
            handler.handle(new ChangeEvent(channel, payload));
            handledEvents.incrementAndGet();
        } catch (MalformedPayloadException ex) {
            log.warn("Handler rejected payload on channel {}: {}", channel, ex.getMessage());
            droppedEvents.incrementAndGet();
        } catch (RuntimeException ex) {
            HandlerException failure = new HandlerException(channel, ex);
            log.error(failure.getMessage(), failure);
            failedEvents.incrementAndGet();
        }
    }

    private Map<String, Object> parse(String channel, String rawPayload) {
        try {
            Map<String, Object> payload = objectMapper.readValue(rawPayload, PAYLOAD_TYPE);
            if (payload == null) {
                throw new MalformedPayloadException(channel, "Payload is JSON null");
            }
            return payload;
        } catch (JsonProcessingException ex) {
            throw new MalformedPayloadException(channel, ex.getOriginalMessage(), ex);
        }
    }

    private void reconnect() {
        synchronized (stateLock) {
            reconnectTask = null;
            if (stopped) {
                return;
            }
        }
        log.info("Attempting change listener reconnect");
        try {
            doConnect(false);
        } catch (ConnectionException ex) {
            log.warn("Reconnect failed: {}", ex.getMessage());
        }
    }

    // caller holds stateLock
    private void scheduleReconnect() {
        if (stopped) {
            return;
        }
        if (reconnectTask != null && !reconnectTask.isDone()) {
            return;
        }
        Duration delay = reconnectPolicy.delayFor(consecutiveFailures);
        log.info("Attempting reconnect in {} ms", delay.toMillis());
        reconnectTask = scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    // caller holds stateLock
    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    // caller holds stateLock
    private void moveTo(LinkState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal listener transition " + state + " -> " + next);
        }
        state = next;
    }

    private void forceCloseQuietly(SubscriptionLink target) {
        try {
            target.forceClose();
        } catch (RuntimeException ex) {
            log.warn("Error while force-closing subscription link", ex);
        }
    }
}
