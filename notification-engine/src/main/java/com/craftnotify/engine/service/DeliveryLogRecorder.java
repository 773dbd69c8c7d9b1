package com.craftnotify.engine.service;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.entity.NotificationDeliveryLog;
import com.craftnotify.engine.repository.NotificationDeliveryLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Append-only writer of delivery attempt rows.
 * 
 * ⚠️ AUDIT TRAIL: exposes inserts and reads only. Rows are never updated; they
 * disappear only when cleanup hard-deletes their notification.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryLogRecorder {

    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final NotificationDeliveryLogRepository deliveryLogRepository;
    private final NotificationProperties properties;

    /**
     * Persist one attempt. Must run inside the caller's transaction when it
     * belongs to a larger unit of work.
     */
    public NotificationDeliveryLog record(UUID notificationId, NotificationChannel channel, String providerName,
                                          int attemptNumber, DeliveryResult result) {
        NotificationDeliveryLog entry = new NotificationDeliveryLog();
        entry.setNotificationId(notificationId);
        entry.setChannel(channel);
        entry.setProviderName(providerName);
        entry.setAttemptNumber(attemptNumber);
        entry.setIsSuccess(result.isSuccess());
        entry.setErrorMessage(truncate(result.getErrorMessage(), MAX_ERROR_MESSAGE_LENGTH));
        entry.setErrorCategory(result.getErrorCategory());
        entry.setProviderResponse(truncate(result.providerResponse(), properties.getProviderResponseMaxLength()));
        entry.setDurationMs(result.durationMs());

        NotificationDeliveryLog saved = deliveryLogRepository.save(entry);
        log.debug("Recorded {} attempt {} for notification {} ({})",
            channel, attemptNumber, notificationId, result.isSuccess() ? "success" : "failure");
        return saved;
    }

    /**
     * Attempt number the next try on this channel will carry (1 for the first).
     */
    public int nextAttemptNumber(UUID notificationId, NotificationChannel channel) {
        if (notificationId == null) {
            return 1;
        }
        return (int) deliveryLogRepository.countByNotificationIdAndChannel(notificationId, channel) + 1;
    }

    /**
     * Highest attempt number on any channel, 0 when nothing was attempted yet.
     */
    public int highestAttemptNumber(UUID notificationId) {
        return deliveryLogRepository.findHighestAttemptNumber(notificationId);
    }

    public List<NotificationDeliveryLog> findByNotification(UUID notificationId) {
        return deliveryLogRepository.findByNotificationIdOrderByCreatedAtAsc(notificationId);
    }

    static String truncate(String value, int maxLength) {
        if (value == null || maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
