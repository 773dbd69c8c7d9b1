package com.craftnotify.engine.dto;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.model.NotificationPriority;
import com.craftnotify.engine.enums.NotificationType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
public class NotificationRequest {
    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must not exceed 200 characters")
    private String title;

    @NotBlank(message = "Message is required")
    @Size(max = 2000, message = "Message must not exceed 2000 characters")
    private String message;

    // Defaults applied by NotificationService when null
    private NotificationType type;
    private NotificationPriority priority;
    private Set<NotificationChannel> channels;

    @Size(max = 100, message = "Category must not exceed 100 characters")
    private String category;

    // Recipient (at least one of these)
    @Size(max = 450, message = "Recipient user id must not exceed 450 characters")
    private String recipientUserId;

    @Email(message = "Recipient email must be a valid email address")
    @Size(max = 256, message = "Recipient email must not exceed 256 characters")
    private String recipientEmail;

    @Size(max = 50, message = "Recipient phone must not exceed 50 characters")
    private String recipientPhone;

    private String senderUserId;
    private String tenantId;

    @Size(max = 500, message = "Action URL must not exceed 500 characters")
    private String actionUrl;

    @Size(max = 500, message = "Image URL must not exceed 500 characters")
    private String imageUrl;

    private LocalDateTime expiresAt;

    // Provider hints, e.g. "webhookUrl", "teamsWebhookUrl"
    private Map<String, Object> metadata;

    @AssertTrue(message = "At least one recipient (user id, email or phone) is required")
    public boolean isRecipientPresent() {
        return hasText(recipientUserId) || hasText(recipientEmail) || hasText(recipientPhone);
    }

    /**
     * Copy of this request addressed to another user. Contact fields are not
     * copied since they belong to the original recipient.
     */
    public NotificationRequest copyForRecipient(String userId) {
        NotificationRequest copy = new NotificationRequest();
        copy.setTitle(title);
        copy.setMessage(message);
        copy.setType(type);
        copy.setPriority(priority);
        copy.setChannels(channels == null ? null : new LinkedHashSet<>(channels));
        copy.setCategory(category);
        copy.setRecipientUserId(userId);
        copy.setSenderUserId(senderUserId);
        copy.setTenantId(tenantId);
        copy.setActionUrl(actionUrl);
        copy.setImageUrl(imageUrl);
        copy.setExpiresAt(expiresAt);
        copy.setMetadata(metadata == null ? null : new HashMap<>(metadata));
        return copy;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
