package com.example.realtime.delivery;

import com.example.realtime.config.RealtimeProperties;
import com.example.realtime.domain.NotificationTemplate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Push title and body per notification type. Configured entries replace the built-in ones.
 */
@Slf4j
@Component
public class NotificationTemplates {

    public static final String FALLBACK_TYPE = "system";

    private static final Map<String, NotificationTemplate> DEFAULTS = defaults();

    private final Map<String, NotificationTemplate> templates;

    public NotificationTemplates(RealtimeProperties properties) {
        this(properties.getPush().getTemplates());
    }

    NotificationTemplates(Map<String, NotificationTemplate> overrides) {
        Map<String, NotificationTemplate> merged = new LinkedHashMap<>(DEFAULTS);
        if (overrides != null) {
            overrides.forEach((type, template) -> {
                if (template != null && StringUtils.hasText(template.getTitle())) {
                    merged.put(type, template);
                } else {
                    log.warn("Ignoring push template override for {} without a title", type);
                }
            });
        }
        this.templates = Collections.unmodifiableMap(merged);
    }

    public NotificationTemplate forType(String notificationType) {
        NotificationTemplate template = notificationType != null ? templates.get(notificationType) : null;
        if (template == null) {
            log.debug("No push template for type {}, using {}", notificationType, FALLBACK_TYPE);
            return templates.get(FALLBACK_TYPE);
        }
        return template;
    }

    public Map<String, NotificationTemplate> all() {
        return templates;
    }

    private static Map<String, NotificationTemplate> defaults() {
        Map<String, NotificationTemplate> map = new LinkedHashMap<>();
        map.put("booking_confirmed", new NotificationTemplate("Buchung bestätigt", "Deine Buchung wurde bestätigt"));
        map.put("booking_status_update", new NotificationTemplate("Status Update", "Der Status deiner Buchung hat sich geändert"));
        map.put("booking_ready", new NotificationTemplate("Buchung bereit!", "Deine Buchung ist bereit"));
        map.put("booking_completed", new NotificationTemplate("Buchung abgeschlossen", "Deine Buchung wurde abgeschlossen"));
        map.put("booking_cancelled", new NotificationTemplate("Buchung storniert", "Deine Buchung wurde storniert"));
        map.put("payment_received", new NotificationTemplate("Zahlung erhalten", "Deine Zahlung wurde erfolgreich verarbeitet"));
        map.put("payment_refunded", new NotificationTemplate("Rückerstattung", "Deine Zahlung wurde zurückerstattet"));
        map.put("community_invite", new NotificationTemplate("Community Einladung", "Du wurdest in eine Community eingeladen"));
        map.put("community_join_request", new NotificationTemplate("Beitrittsanfrage", "Jemand möchte deiner Community beitreten"));
        map.put("community_member_approved", new NotificationTemplate("Willkommen!", "Du wurdest in die Community aufgenommen"));
        map.put("new_offering", new NotificationTemplate("Neues Angebot", "Ein neues Angebot ist verfügbar"));
        map.put("offering_update", new NotificationTemplate("Angebot aktualisiert", "Ein Angebot wurde aktualisiert"));
        map.put("new_review", new NotificationTemplate("Neue Bewertung", "Du hast eine neue Bewertung erhalten"));
        map.put("new_message", new NotificationTemplate("Neue Nachricht", "Du hast eine neue Nachricht erhalten"));
        map.put(FALLBACK_TYPE, new NotificationTemplate("Benachrichtigung", "Du hast eine neue Nachricht"));
        return Collections.unmodifiableMap(map);
    }
}
