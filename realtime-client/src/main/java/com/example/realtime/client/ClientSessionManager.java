package com.example.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the live connection of one device. Connects while the user is signed in and the app is in
 * the foreground, suspends on backgrounding, retries transient failures with a bounded
 * {@link RetryPolicy} and rejoins every tracked room after each successful connect.
 *
 * <p>All operations return immediately. Every connect attempt carries a generation number; a
 * completion whose generation was superseded by sign-out, backgrounding or a newer attempt is
 * discarded and its session closed.
 */
@Slf4j
public class ClientSessionManager {

    private final TransportConnector connector;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    // guarded by lock
    private SessionState state = SessionState.DISCONNECTED;
    private Credentials credentials;
    private boolean foreground = true;
    private boolean authRejected;
    private long generation;
    private int failedAttempts;
    private TransportSession session;
    private ScheduledFuture<?> pendingRetry;
    private final Set<TrackedRoom> rooms = new LinkedHashSet<>();

    public ClientSessionManager(TransportConnector connector, RetryPolicy retryPolicy, ScheduledExecutorService scheduler) {
        this.connector = connector;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    public SessionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isRetryPending() {
        synchronized (lock) {
            return pendingRetry != null && !pendingRetry.isDone();
        }
    }

    public Set<TrackedRoom> trackedRooms() {
        synchronized (lock) {
            return Set.copyOf(rooms);
        }
    }

    /**
     * A user signed in, or refreshed the credential. Replaces any existing connection.
     */
    public void signIn(Credentials newCredentials) {
        synchronized (lock) {
            boolean otherUser = credentials != null && !credentials.getProfileId().equals(newCredentials.getProfileId());
            credentials = newCredentials;
            authRejected = false;
            if (otherUser) {
                rooms.clear();
            }
            if (state == SessionState.CONNECTED || state == SessionState.CONNECTING) {
                teardown(SessionState.DISCONNECTED);
            }
            failedAttempts = 0;
            connectIfWanted();
        }
    }

    public void signOut() {
        synchronized (lock) {
            credentials = null;
            authRejected = false;
            rooms.clear();
            teardown(SessionState.DISCONNECTED);
            log.info("Signed out, live connection closed");
        }
    }

    public void onForeground() {
        synchronized (lock) {
            foreground = true;
            if (state == SessionState.SUSPENDED) {
                moveTo(SessionState.DISCONNECTED);
            }
            failedAttempts = 0;
            connectIfWanted();
        }
    }

    public void onBackground() {
        synchronized (lock) {
            foreground = false;
            if (state == SessionState.CONNECTED || state == SessionState.CONNECTING) {
                teardown(SessionState.SUSPENDED);
                log.info("App in background, live connection suspended");
            }
        }
    }

    /**
     * Tracks a room and joins it now if connected. Tracked rooms are rejoined after every connect.
     */
    public void joinRoom(RoomKind kind, String roomId) {
        TrackedRoom room = new TrackedRoom(kind, roomId);
        synchronized (lock) {
            if (rooms.add(room) && state == SessionState.CONNECTED) {
                session.emit(kind.joinEvent(), roomId);
            }
        }
    }

    public void leaveRoom(RoomKind kind, String roomId) {
        TrackedRoom room = new TrackedRoom(kind, roomId);
        synchronized (lock) {
            if (rooms.remove(room) && state == SessionState.CONNECTED) {
                session.emit(kind.leaveEvent(), roomId);
            }
        }
    }

    // caller holds lock
    private void connectIfWanted() {
        if (credentials == null || !foreground || authRejected) {
            return;
        }
        if (state != SessionState.DISCONNECTED || isRetryPending()) {
            return;
        }
        startAttempt();
    }

    // caller holds lock
    private void startAttempt() {
        long attempt = ++generation;
        moveTo(SessionState.CONNECTING);
        log.debug("Connecting as profile {} (attempt generation {})", credentials.getProfileId(), attempt);

        CompletableFuture<TransportSession> pending;
        try {
            pending = connector.connect(credentials, new GenerationEvents(attempt));
        } catch (RuntimeException ex) {
            pending = CompletableFuture.failedFuture(ex);
        }
        pending.whenComplete((opened, failure) -> onAttemptCompleted(attempt, opened, failure));
    }

    private void onAttemptCompleted(long attempt, TransportSession opened, Throwable failure) {
        synchronized (lock) {
            if (attempt != generation || state != SessionState.CONNECTING) {
                if (opened != null) {
                    log.debug("Discarding superseded connection {}", opened.id());
                    closeQuietly(opened);
                }
                return;
            }

            if (failure == null) {
                session = opened;
                failedAttempts = 0;
                moveTo(SessionState.CONNECTED);
                log.info("Connected as profile {}, rejoining {} room(s)", credentials.getProfileId(), rooms.size());
                for (TrackedRoom room : rooms) {
                    session.emit(room.getKind().joinEvent(), room.getId());
                }
                return;
            }

            Throwable cause = unwrap(failure);
            if (cause instanceof AuthException) {
                authRejected = true;
                moveTo(SessionState.DISCONNECTED);
                log.warn("Credential rejected for profile {}: {}", credentials.getProfileId(), cause.getMessage());
                listeners.forEach(listener -> listener.onAuthFailed(cause.getMessage()));
                return;
            }
            log.warn("Connect failed: {}", cause.getMessage());
            moveTo(SessionState.DISCONNECTED);
            scheduleRetry();
        }
    }

    private void onDropped(long attempt, String reason) {
        synchronized (lock) {
            if (attempt != generation || state != SessionState.CONNECTED) {
                return;
            }
            log.warn("Live connection dropped: {}", reason);
            closeQuietly(session);
            session = null;
            failedAttempts = 0;
            moveTo(SessionState.DISCONNECTED);
            scheduleRetry();
        }
    }

    // caller holds lock
    private void scheduleRetry() {
        failedAttempts++;
        if (!retryPolicy.allowsAttempt(failedAttempts)) {
            int attempts = failedAttempts - 1;
            failedAttempts = 0;
            log.warn("Giving up after {} retry attempt(s)", attempts);
            listeners.forEach(listener -> listener.onGaveUp(attempts));
            return;
        }
        long delay = retryPolicy.delayFor(failedAttempts).toMillis();
        long scheduledFor = generation;
        log.info("Retrying connection in {} ms (attempt {}/{})", delay, failedAttempts, retryPolicy.maxAttempts());
        pendingRetry = scheduler.schedule(() -> retry(scheduledFor), delay, TimeUnit.MILLISECONDS);
    }

    private void retry(long scheduledFor) {
        synchronized (lock) {
            pendingRetry = null;
            if (scheduledFor != generation || state != SessionState.DISCONNECTED) {
                return;
            }
            if (credentials == null || !foreground || authRejected) {
                return;
            }
            startAttempt();
        }
    }

    // caller holds lock
    private void teardown(SessionState next) {
        generation++;
        if (pendingRetry != null) {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }
        if (session != null) {
            closeQuietly(session);
            session = null;
        }
        failedAttempts = 0;
        if (state != next) {
            moveTo(next);
        }
    }

    // caller holds lock
    private void moveTo(SessionState next) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        listeners.forEach(listener -> listener.onStateChanged(previous, next));
    }

    private void closeQuietly(TransportSession target) {
        try {
            target.close();
        } catch (RuntimeException ex) {
            log.warn("Error while closing connection {}", target.id(), ex);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private final class GenerationEvents implements TransportEvents {

        private final long attempt;

        private GenerationEvents(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onDisconnected(String reason) {
            onDropped(attempt, reason);
        }

        @Override
        public void onEvent(String event, JsonNode payload) {
            synchronized (lock) {
                if (attempt != generation) {
                    return;
                }
            }
            listeners.forEach(listener -> listener.onEvent(event, payload));
        }
    }
}
