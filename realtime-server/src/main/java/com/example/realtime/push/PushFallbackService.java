package com.example.realtime.push;

import com.example.realtime.config.RealtimeProperties;
import com.example.realtime.domain.DeviceToken;
import com.example.realtime.service.DeviceTokenRegistry;
import com.example.realtime.service.exception.DeliveryException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Sends a notification to every registered device of an offline recipient and prunes tokens
 * the provider reports as dead. Failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class PushFallbackService {

    private final DeviceTokenRegistry deviceTokenRegistry;
    private final PushGateway pushGateway;
    private final Executor pushExecutor;
    private final int chunkSize;
    private final String sound;
    private final Clock clock;

    @Autowired
    public PushFallbackService(
            DeviceTokenRegistry deviceTokenRegistry,
            PushGateway pushGateway,
            @Qualifier("pushExecutor") Executor pushExecutor,
            RealtimeProperties properties) {
        this(deviceTokenRegistry, pushGateway, pushExecutor, properties.getPush().getChunkSize(),
                properties.getPush().getSound(), Clock.systemUTC());
    }

    PushFallbackService(
            DeviceTokenRegistry deviceTokenRegistry,
            PushGateway pushGateway,
            Executor pushExecutor,
            int chunkSize,
            String sound,
            Clock clock) {
        this.deviceTokenRegistry = deviceTokenRegistry;
        this.pushGateway = pushGateway;
        this.pushExecutor = pushExecutor;
        this.chunkSize = Math.max(1, chunkSize);
        this.sound = sound;
        this.clock = clock;
    }

    /**
     * Queues {@link #sendToRecipient} on the push executor and returns immediately.
     */
    public void dispatch(String profileId, String title, String body, Map<String, Object> data, Integer badgeCount) {
        try {
            pushExecutor.execute(() -> {
                try {
                    sendToRecipient(profileId, title, body, data, badgeCount);
                } catch (RuntimeException ex) {
                    log.error("Push fallback for profile {} failed", profileId, ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.error("Push executor rejected delivery for profile {}", profileId, ex);
        }
    }

    public PushResult sendToRecipient(String profileId, String title, String body, Map<String, Object> data, Integer badgeCount) {
        List<DeviceToken> tokens;
        try {
            tokens = deviceTokenRegistry.findByProfile(profileId);
        } catch (RuntimeException ex) {
            log.error("Could not load push tokens for profile {}", profileId, ex);
            return PushResult.NO_TOKENS;
        }
        if (tokens.isEmpty()) {
            log.debug("No push tokens for profile {}", profileId);
            return PushResult.NO_TOKENS;
        }

        List<String> dead = new ArrayList<>();
        List<DeviceToken> sendable = new ArrayList<>(tokens.size());
        for (DeviceToken token : tokens) {
            if (ExpoPushTokens.isExpoPushToken(token.getToken())) {
                sendable.add(token);
            } else {
                log.warn("Removing malformed push token {} of profile {}", token.getId(), profileId);
                dead.add(token.getId());
            }
        }
        pruneTokens(dead);
        int pruned = dead.size();

        int accepted = 0;
        int retained = 0;
        int batches = 0;
        List<String> used = new ArrayList<>();
        for (int from = 0; from < sendable.size(); from += chunkSize) {
            List<DeviceToken> chunk = sendable.subList(from, Math.min(from + chunkSize, sendable.size()));
            List<PushMessage> messages = new ArrayList<>(chunk.size());
            for (DeviceToken token : chunk) {
                messages.add(PushMessage.builder()
                        .to(token.getToken())
                        .title(title)
                        .body(body)
                        .data(data)
                        .sound(sound)
                        .badge(badgeCount)
                        .build());
            }
            batches++;

            List<PushTicket> tickets;
            try {
                tickets = pushGateway.send(messages);
            } catch (DeliveryException ex) {
                log.error("Push batch of {} message(s) for profile {} failed", messages.size(), profileId, ex);
                retained += chunk.size();
                continue;
            } catch (RuntimeException ex) {
                log.error("Unexpected error sending push batch for profile {}", profileId, ex);
                retained += chunk.size();
                continue;
            }

            List<String> deadInChunk = new ArrayList<>();
            for (int i = 0; i < chunk.size(); i++) {
                DeviceToken token = chunk.get(i);
                PushTicket ticket = i < tickets.size() ? tickets.get(i) : null;
                if (ticket == null) {
                    log.warn("No push ticket for token {}, keeping it", token.getId());
                    retained++;
                } else if (ticket.isOk()) {
                    accepted++;
                    used.add(token.getId());
                } else if (ticket.isDeviceNotRegistered()) {
                    log.info("Push token {} of profile {} is no longer registered", token.getId(), profileId);
                    deadInChunk.add(token.getId());
                } else {
                    log.warn("Push to token {} failed ({}): {}", token.getId(), ticket.errorCode(), ticket.getMessage());
                    retained++;
                }
            }
            pruneTokens(deadInChunk);
            pruned += deadInChunk.size();
        }

        if (!used.isEmpty()) {
            try {
                deviceTokenRegistry.markUsed(used, Instant.now(clock));
            } catch (RuntimeException ex) {
                log.warn("Could not update last use of {} push token(s)", used.size(), ex);
            }
        }

        PushResult result = new PushResult(accepted, pruned, retained, batches);
        log.info("Push fallback for profile {}: {}", profileId, result);
        return result;
    }

    private void pruneTokens(List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        try {
            int removed = deviceTokenRegistry.deleteByIds(ids);
            log.info("Pruned {} push token(s)", removed);
        } catch (RuntimeException ex) {
            log.error("Failed to prune {} push token(s)", ids.size(), ex);
        }
    }
}
