package com.craftnotify.engine.repository;

import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.enums.NotificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every read here filters out soft-deleted rows explicitly; there is no
 * global filter on the entity.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndIsDeletedFalse(UUID id);

    List<Notification> findByIdInAndIsDeletedFalse(Collection<UUID> ids);

    List<Notification> findByRecipientUserIdAndIsDeletedFalseOrderByCreatedAtDesc(String recipientUserId);

    List<Notification> findByRecipientUserIdAndReadAtIsNullAndIsDeletedFalseOrderByCreatedAtDesc(String recipientUserId);

    long countByRecipientUserIdAndReadAtIsNullAndIsDeletedFalse(String recipientUserId);

    /**
     * Unread notifications of a user that have not expired yet.
     */
    @Query("""
        SELECT n FROM Notification n
        WHERE n.recipientUserId = :userId
          AND n.readAt IS NULL
          AND n.isDeleted = false
          AND (n.expiresAt IS NULL OR n.expiresAt > :now)
        """)
    List<Notification> findUnreadActiveByRecipient(@Param("userId") String userId, @Param("now") LocalDateTime now);

    List<Notification> findByStatusAndScheduledForLessThanEqualAndIsDeletedFalseOrderByScheduledForAsc(
        NotificationStatus status, LocalDateTime scheduledFor);

    /**
     * Queued notifications whose scheduled time has come, oldest first.
     */
    default List<Notification> findDueScheduled(LocalDateTime now) {
        return findByStatusAndScheduledForLessThanEqualAndIsDeletedFalseOrderByScheduledForAsc(
            NotificationStatus.QUEUED, now);
    }

    @Query("""
        SELECT n.id FROM Notification n
        WHERE n.status IN :statuses
          AND n.createdAt < :cutoff
        """)
    List<UUID> findIdsByStatusInAndCreatedBefore(@Param("statuses") Collection<NotificationStatus> statuses,
                                                 @Param("cutoff") LocalDateTime cutoff);

    @Modifying
    @Query("DELETE FROM Notification n WHERE n.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<UUID> ids);
}
