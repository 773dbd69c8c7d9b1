package com.craftnotify.engine.provider;

import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.enums.NotificationType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the legacy Office 365 connector "MessageCard" payload for Teams
 * incoming webhooks.
 */
final class TeamsMessageCard {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    private TeamsMessageCard() {
    }

    static Map<String, Object> build(Notification notification, LocalDateTime timestamp) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("activityTitle", notification.getTitle());
        section.put("activitySubtitle", "Priority: " + notification.getPriority());
        if (notification.getImageUrl() != null) {
            section.put("activityImage", notification.getImageUrl());
        }
        section.put("text", notification.getMessage());
        section.put("facts", facts(notification, timestamp));

        Map<String, Object> card = new LinkedHashMap<>();
        card.put("@type", "MessageCard");
        card.put("@context", "https://schema.org/extensions");
        card.put("summary", notification.getTitle());
        card.put("themeColor", themeColor(notification.getType()));
        card.put("sections", List.of(section));

        if (notification.getActionUrl() != null && !notification.getActionUrl().isBlank()) {
            Map<String, Object> action = new LinkedHashMap<>();
            action.put("@type", "OpenUri");
            action.put("name", "View Details");
            action.put("targets", List.of(Map.of("os", "default", "uri", notification.getActionUrl())));
            card.put("potentialAction", List.of(action));
        }
        return card;
    }

    static String themeColor(NotificationType type) {
        if (type == null) {
            return "0078D4";
        }
        return switch (type) {
            case SUCCESS -> "00FF00";
            case WARNING -> "FFA500";
            case ERROR -> "FF0000";
            case INFO -> "0078D4";
        };
    }

    private static List<Map<String, String>> facts(Notification notification, LocalDateTime timestamp) {
        List<Map<String, String>> facts = new ArrayList<>();
        facts.add(fact("Type", String.valueOf(notification.getType())));
        facts.add(fact("Priority", String.valueOf(notification.getPriority())));
        if (notification.getCategory() != null && !notification.getCategory().isBlank()) {
            facts.add(fact("Category", notification.getCategory()));
        }
        if (notification.getRecipientUserId() != null && !notification.getRecipientUserId().isBlank()) {
            facts.add(fact("Recipient", notification.getRecipientUserId()));
        }
        facts.add(fact("Timestamp", timestamp.format(TIMESTAMP_FORMAT)));
        return facts;
    }

    private static Map<String, String> fact(String name, String value) {
        Map<String, String> fact = new LinkedHashMap<>();
        fact.put("name", name);
        fact.put("value", value);
        return fact;
    }
}
