package com.craftnotify.engine.entity;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.model.NotificationPriority;
import com.craftnotify.engine.config.ChannelSetConverter;
import com.craftnotify.engine.enums.NotificationStatus;
import com.craftnotify.engine.enums.NotificationType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A notification addressed to one recipient.
 * 
 * The id is assigned by the engine before dispatch so providers and delivery
 * logs can reference it; {@code version} tells Spring Data whether the row is new.
 * 
 * Invariants kept by NotificationService:
 * - status READ implies readAt is set
 * - status DELIVERED implies deliveredAt is set
 * - deliveryAttempts never decreases
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_recipient", columnList = "recipient_user_id"),
    @Index(name = "idx_notifications_status", columnList = "status"),
    @Index(name = "idx_notifications_scheduled_for", columnList = "scheduled_for"),
    @Index(name = "idx_notifications_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Notification extends BaseAuditableEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, length = 2000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private NotificationType type = NotificationType.INFO;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 20)
    private NotificationPriority priority = NotificationPriority.NORMAL;

    @Column(name = "category", length = 100)
    private String category;

    @Convert(converter = ChannelSetConverter.class)
    @Column(name = "requested_channels", nullable = false)
    private ChannelSet requestedChannels = ChannelSet.of(NotificationChannel.IN_APP);

    /**
     * Channels left after preference resolution; what the dispatcher actually ran.
     */
    @Convert(converter = ChannelSetConverter.class)
    @Column(name = "effective_channels", nullable = false)
    private ChannelSet effectiveChannels = ChannelSet.none();

    @Column(name = "recipient_user_id", length = 450)
    private String recipientUserId;

    @Column(name = "recipient_email", length = 256)
    private String recipientEmail;

    @Column(name = "recipient_phone", length = 50)
    private String recipientPhone;

    @Column(name = "sender_user_id", length = 450)
    private String senderUserId;

    @Column(name = "tenant_id", length = 100)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private NotificationStatus status = NotificationStatus.PENDING;

    @Column(name = "scheduled_for")
    private LocalDateTime scheduledFor;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "delivery_attempts", nullable = false)
    private Integer deliveryAttempts = 0;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    /**
     * JSON object; see NotificationMetadataSerializer.
     */
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "action_url", length = 500)
    private String actionUrl;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "is_deleted", nullable = false)
    private Boolean isDeleted = false;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public boolean isRead() {
        return readAt != null;
    }
}
