package com.craftnotify.engine.entity;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.model.NotificationPriority;
import com.craftnotify.engine.config.ChannelSetConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Delivery preference of a user, either for one category or (category null)
 * the user's default.
 * 
 * Unique on (user_id, category). Databases treat NULLs as distinct in unique
 * constraints, so NotificationPreferenceService also guarantees a single
 * default row per user.
 */
@Entity
@Table(name = "notification_preferences",
    uniqueConstraints = @UniqueConstraint(name = "uk_preferences_user_category", columnNames = {"user_id", "category"}),
    indexes = @Index(name = "idx_preferences_user", columnList = "user_id"))
@Getter
@Setter
@NoArgsConstructor
public class NotificationPreference extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 450)
    private String userId;

    @Column(name = "tenant_id", length = 100)
    private String tenantId;

    @Column(name = "category", length = 100)
    private String category;

    @Convert(converter = ChannelSetConverter.class)
    @Column(name = "enabled_channels", nullable = false)
    private ChannelSet enabledChannels = ChannelSet.of(NotificationChannel.IN_APP);

    /**
     * Master switch. When false nothing is delivered on any channel.
     */
    @Column(name = "is_enabled", nullable = false)
    private Boolean isEnabled = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "minimum_priority", nullable = false, length = 20)
    private NotificationPriority minimumPriority = NotificationPriority.LOW;

    @Column(name = "email", length = 256)
    private String email;

    @Column(name = "phone", length = 50)
    private String phone;

    @Column(name = "push_endpoint", length = 500)
    private String pushEndpoint;

    @Column(name = "push_public_key", length = 200)
    private String pushPublicKey;

    @Column(name = "push_auth", length = 100)
    private String pushAuth;

    @Column(name = "webhook_url", length = 500)
    private String webhookUrl;

    public NotificationPreference(String userId, String category) {
        this.userId = userId;
        this.category = category;
    }

    public boolean isChannelEnabled(NotificationChannel channel) {
        return Boolean.TRUE.equals(isEnabled) && enabledChannels != null && enabledChannels.contains(channel);
    }

    public boolean hasPushSubscription() {
        return pushEndpoint != null && !pushEndpoint.isBlank();
    }
}
