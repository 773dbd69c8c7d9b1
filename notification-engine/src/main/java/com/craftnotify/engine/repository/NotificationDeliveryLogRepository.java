package com.craftnotify.engine.repository;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.engine.entity.NotificationDeliveryLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationDeliveryLogRepository extends JpaRepository<NotificationDeliveryLog, UUID> {

    long countByNotificationIdAndChannel(UUID notificationId, NotificationChannel channel);

    List<NotificationDeliveryLog> findByNotificationIdOrderByCreatedAtAsc(UUID notificationId);

    /**
     * Highest attempt number across all channels of a notification, 0 if none.
     */
    @Query("SELECT COALESCE(MAX(l.attemptNumber), 0) FROM NotificationDeliveryLog l WHERE l.notificationId = :notificationId")
    int findHighestAttemptNumber(@Param("notificationId") UUID notificationId);

    /**
     * Used only when the parent notifications are hard-deleted.
     */
    @Modifying
    @Query("DELETE FROM NotificationDeliveryLog l WHERE l.notificationId IN :notificationIds")
    int deleteAllByNotificationIdIn(@Param("notificationIds") Collection<UUID> notificationIds);
}
