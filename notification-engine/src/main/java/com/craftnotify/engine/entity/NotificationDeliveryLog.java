package com.craftnotify.engine.entity;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.ProviderErrorCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One delivery attempt of one notification on one channel.
 * 
 * ⚠️ APPEND-ONLY: rows are written once by DeliveryLogRecorder and never
 * updated. They are removed only together with their notification during
 * hard-delete cleanup.
 */
@Entity
@Table(name = "notification_delivery_logs", indexes = {
    @Index(name = "idx_delivery_logs_notification", columnList = "notification_id"),
    @Index(name = "idx_delivery_logs_notification_channel", columnList = "notification_id, channel"),
    @Index(name = "idx_delivery_logs_created_at", columnList = "created_at")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDeliveryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "notification_id", nullable = false, updatable = false)
    private UUID notificationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, updatable = false, length = 20)
    private NotificationChannel channel;

    @Column(name = "provider_name", length = 50, updatable = false)
    private String providerName;

    /**
     * 1-based, counted per (notification, channel).
     */
    @Column(name = "attempt_number", nullable = false, updatable = false)
    private Integer attemptNumber;

    @Column(name = "is_success", nullable = false, updatable = false)
    private Boolean isSuccess;

    @Column(name = "error_message", length = 1000, updatable = false)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category", length = 20, updatable = false)
    private ProviderErrorCategory errorCategory;

    @Column(name = "provider_response", columnDefinition = "TEXT", updatable = false)
    private String providerResponse;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private Long durationMs;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
