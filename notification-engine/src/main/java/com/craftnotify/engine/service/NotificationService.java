package com.craftnotify.engine.service;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.model.NotificationPriority;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.dispatch.DeliveryAttempt;
import com.craftnotify.engine.dispatch.DispatchOutcome;
import com.craftnotify.engine.dispatch.NotificationDispatcher;
import com.craftnotify.engine.dto.NotificationRequest;
import com.craftnotify.engine.dto.ServiceResult;
import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.entity.NotificationDeliveryLog;
import com.craftnotify.engine.entity.NotificationPreference;
import com.craftnotify.engine.enums.NotificationStatus;
import com.craftnotify.engine.enums.NotificationType;
import com.craftnotify.engine.repository.NotificationDeliveryLogRepository;
import com.craftnotify.engine.repository.NotificationRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point of the engine: creates notifications, runs them through
 * preference resolution and dispatch, and manages their read/delete lifecycle.
 *
 * Send pipeline:
 * 1. validate the request
 * 2. build the notification with defaults (INFO, NORMAL, default channels, PENDING)
 * 3. narrow requested channels to the recipient's effective channels
 * 4. dispatch (outside any transaction, providers do network I/O)
 * 5. aggregate: any success means DELIVERED, otherwise the failure summary is kept
 * 6. save the notification and its attempt logs in one transaction
 *
 * ⚠️ RESULT SEMANTICS: a successful send result means the notification was
 * accepted and stored. Whether it reached the recipient is in its status and
 * error message. Only validation and persistence problems fail the call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;
    static final String BLOCKED_BY_PREFERENCES = "Blocked by recipient preferences";

    private static final Set<NotificationStatus> CLEANUP_STATUSES =
        EnumSet.of(NotificationStatus.DELIVERED, NotificationStatus.READ);
    private static final int CLEANUP_CHUNK_SIZE = 500;

    private final NotificationRepository notificationRepository;
    private final NotificationDeliveryLogRepository deliveryLogRepository;
    private final NotificationPreferenceService preferenceService;
    private final NotificationDispatcher dispatcher;
    private final DeliveryLogRecorder deliveryLogRecorder;
    private final StatusTransitionValidator statusTransitionValidator;
    private final NotificationMetadataSerializer metadataSerializer;
    private final NotificationMetricsService metricsService;
    private final NotificationProperties properties;
    private final Validator validator;
    private final TransactionTemplate transactionTemplate;

    public ServiceResult<Notification> send(NotificationRequest request) {
        String validationError = validate(request);
        if (validationError != null) {
            log.warn("Rejected notification request: {}", validationError);
            return ServiceResult.failure(validationError);
        }

        try {
            Notification notification = buildNotification(request);
            Notification saved = deliverAndPersist(notification);
            metricsService.recordCreated();
            log.info("Notification {} created for user {} with status {}",
                saved.getId(), saved.getRecipientUserId(), saved.getStatus());
            return ServiceResult.success(saved);
        } catch (Exception e) {
            log.error("Failed to send notification '{}' to user {}", request.getTitle(), request.getRecipientUserId(), e);
            return ServiceResult.failure("Failed to send notification: " + e.getMessage());
        }
    }

    /**
     * Send each request independently. The whole batch is rejected up front if
     * it is too large or any item is invalid; after that, an item that fails
     * on infrastructure is logged and left out of the result.
     */
    public ServiceResult<List<Notification>> sendBatch(List<NotificationRequest> requests) {
        if (!properties.isEnableBatchProcessing()) {
            return ServiceResult.failure("Batch processing is not enabled");
        }
        if (requests == null || requests.isEmpty()) {
            return ServiceResult.success(List.of());
        }
        if (requests.size() > properties.getMaxBatchSize()) {
            return ServiceResult.failure(String.format("Batch size %d exceeds maximum %d",
                requests.size(), properties.getMaxBatchSize()));
        }
        for (int i = 0; i < requests.size(); i++) {
            String validationError = validate(requests.get(i));
            if (validationError != null) {
                return ServiceResult.failure(String.format("Batch item %d is invalid: %s", i, validationError));
            }
        }

        List<Notification> notifications = new ArrayList<>(requests.size());
        for (NotificationRequest request : requests) {
            ServiceResult<Notification> result = send(request);
            if (result.success()) {
                notifications.add(result.data());
            } else {
                log.warn("Batch item for user {} failed: {}", request.getRecipientUserId(), result.error());
            }
        }

        log.info("Batch processed: {} of {} notifications created", notifications.size(), requests.size());
        return ServiceResult.success(notifications);
    }

    /**
     * Send the same content to every listed user, one independent notification each.
     * Duplicate user ids are sent to once.
     */
    public ServiceResult<List<Notification>> sendToMultiple(NotificationRequest request, Collection<String> userIds) {
        if (request == null) {
            return ServiceResult.failure("Notification request is required");
        }
        if (userIds == null || userIds.isEmpty()) {
            return ServiceResult.failure("At least one recipient user id is required");
        }

        List<NotificationRequest> requests = userIds.stream()
            .map(request::copyForRecipient)
            .collect(Collectors.toList());
        return sendBatch(requests);
    }

    /**
     * Store the notification as QUEUED without dispatching it. Delivery happens
     * when the scheduler calls {@link #dispatchScheduled(UUID)}.
     */
    public ServiceResult<Notification> schedule(NotificationRequest request, LocalDateTime scheduledFor) {
        if (scheduledFor == null) {
            return ServiceResult.failure("Scheduled time is required");
        }
        String validationError = validate(request);
        if (validationError != null) {
            return ServiceResult.failure(validationError);
        }

        try {
            Notification notification = buildNotification(request);
            notification.setStatus(NotificationStatus.QUEUED);
            notification.setScheduledFor(scheduledFor);

            Notification saved = transactionTemplate.execute(status -> notificationRepository.save(notification));
            metricsService.recordScheduled();
            log.info("Notification {} scheduled for {}", notification.getId(), scheduledFor);
            return ServiceResult.success(saved);
        } catch (Exception e) {
            log.error("Failed to schedule notification '{}'", request.getTitle(), e);
            return ServiceResult.failure("Failed to schedule notification: " + e.getMessage());
        }
    }

    /**
     * QUEUED notifications whose time has come. Polled by the external scheduler.
     */
    public List<Notification> findDueScheduled(LocalDateTime now) {
        return notificationRepository.findDueScheduled(now);
    }

    /**
     * Replay the send pipeline for a queued notification. It leaves QUEUED
     * either way: DELIVERED on success, PENDING with an error message otherwise.
     */
    public ServiceResult<Notification> dispatchScheduled(UUID notificationId) {
        try {
            Optional<Notification> found = notificationRepository.findByIdAndIsDeletedFalse(notificationId);
            if (found.isEmpty()) {
                return ServiceResult.failure("Notification not found");
            }
            Notification notification = found.get();
            if (notification.getStatus() != NotificationStatus.QUEUED) {
                return ServiceResult.failure(String.format("Notification %s is not queued (status %s)",
                    notificationId, notification.getStatus()));
            }

            transition(notification, NotificationStatus.PENDING);
            Notification saved = deliverAndPersist(notification);
            log.info("Scheduled notification {} dispatched with status {}", notificationId, saved.getStatus());
            return ServiceResult.success(saved);
        } catch (Exception e) {
            log.error("Failed to dispatch scheduled notification {}", notificationId, e);
            return ServiceResult.failure("Failed to dispatch scheduled notification: " + e.getMessage());
        }
    }

    /**
     * Run delivery again for a notification that is still PENDING.
     */
    public ServiceResult<Notification> retryDelivery(UUID notificationId) {
        try {
            Optional<Notification> found = notificationRepository.findByIdAndIsDeletedFalse(notificationId);
            if (found.isEmpty()) {
                return ServiceResult.failure("Notification not found");
            }
            Notification notification = found.get();
            if (notification.getStatus() != NotificationStatus.PENDING) {
                return ServiceResult.failure(String.format("Notification %s cannot be retried in status %s",
                    notificationId, notification.getStatus()));
            }
            int highestAttempt = deliveryLogRecorder.highestAttemptNumber(notificationId);
            if (highestAttempt >= properties.getMaxRetryAttempts()) {
                return ServiceResult.failure(String.format("Maximum retry attempts (%d) exceeded",
                    properties.getMaxRetryAttempts()));
            }

            Notification saved = deliverAndPersist(notification);
            log.info("Retried delivery for notification {}: {}", notificationId, saved.getStatus());
            return ServiceResult.success(saved);
        } catch (Exception e) {
            log.error("Failed to retry notification {}", notificationId, e);
            return ServiceResult.failure("Failed to retry: " + e.getMessage());
        }
    }

    /**
     * Idempotent: a notification that is already read stays as it is.
     */
    @Transactional
    public ServiceResult<Void> markAsRead(UUID notificationId) {
        try {
            Optional<Notification> found = notificationRepository.findByIdAndIsDeletedFalse(notificationId);
            if (found.isEmpty()) {
                return ServiceResult.failure("Notification not found");
            }
            Notification notification = found.get();
            if (notification.isRead()) {
                return ServiceResult.successEmpty();
            }
            markRead(notification, LocalDateTime.now());
            notificationRepository.save(notification);
            return ServiceResult.successEmpty();
        } catch (Exception e) {
            log.error("Failed to mark notification {} as read", notificationId, e);
            return ServiceResult.failure("Failed to mark notification as read: " + e.getMessage());
        }
    }

    @Transactional
    public ServiceResult<Void> markAllAsRead(Collection<UUID> notificationIds) {
        if (notificationIds == null || notificationIds.isEmpty()) {
            return ServiceResult.successEmpty();
        }
        try {
            int updated = markUnreadAsRead(notificationRepository.findByIdInAndIsDeletedFalse(notificationIds));
            log.info("Marked {} of {} notifications as read", updated, notificationIds.size());
            return ServiceResult.successEmpty();
        } catch (Exception e) {
            log.error("Failed to mark {} notifications as read", notificationIds.size(), e);
            return ServiceResult.failure("Failed to mark notifications as read: " + e.getMessage());
        }
    }

    /**
     * Marks every unread, unexpired notification of the user as read.
     */
    @Transactional
    public ServiceResult<Void> markAllAsReadForUser(String userId) {
        try {
            int updated = markUnreadAsRead(
                notificationRepository.findUnreadActiveByRecipient(userId, LocalDateTime.now()));
            log.info("Marked {} notifications as read for user {}", updated, userId);
            return ServiceResult.successEmpty();
        } catch (Exception e) {
            log.error("Failed to mark notifications as read for user {}", userId, e);
            return ServiceResult.failure("Failed to mark notifications as read: " + e.getMessage());
        }
    }

    /**
     * Newest first; soft-deleted notifications are never returned.
     */
    public List<Notification> getUserNotifications(String userId, boolean includeRead) {
        if (includeRead) {
            return notificationRepository.findByRecipientUserIdAndIsDeletedFalseOrderByCreatedAtDesc(userId);
        }
        return notificationRepository.findByRecipientUserIdAndReadAtIsNullAndIsDeletedFalseOrderByCreatedAtDesc(userId);
    }

    public List<Notification> getUserNotifications(String userId) {
        return getUserNotifications(userId, false);
    }

    public long getUnreadCount(String userId) {
        return notificationRepository.countByRecipientUserIdAndReadAtIsNullAndIsDeletedFalse(userId);
    }

    /**
     * Soft delete. The row and its delivery logs stay for auditing until
     * cleanup removes them.
     */
    @Transactional
    public ServiceResult<Void> delete(UUID notificationId) {
        try {
            Optional<Notification> found = notificationRepository.findByIdAndIsDeletedFalse(notificationId);
            if (found.isEmpty()) {
                return ServiceResult.failure("Notification not found");
            }
            Notification notification = found.get();
            notification.setIsDeleted(true);
            notification.setDeletedAt(LocalDateTime.now());
            notificationRepository.save(notification);
            log.info("Notification {} deleted", notificationId);
            return ServiceResult.successEmpty();
        } catch (Exception e) {
            log.error("Failed to delete notification {}", notificationId, e);
            return ServiceResult.failure("Failed to delete notification: " + e.getMessage());
        }
    }

    public List<NotificationDeliveryLog> getDeliveryLogs(UUID notificationId) {
        return deliveryLogRecorder.findByNotification(notificationId);
    }

    /**
     * Hard-delete DELIVERED and READ notifications older than the configured
     * age, with their delivery logs.
     *
     * @return number of notifications removed
     */
    public ServiceResult<Integer> cleanupOldNotifications() {
        if (!properties.isEnableAutoCleanup()) {
            log.debug("Automatic cleanup disabled");
            return ServiceResult.success(0);
        }

        LocalDateTime cutoff = LocalDateTime.now().minusDays(properties.getCleanupAfterDays());
        try {
            Integer removed = transactionTemplate.execute(status -> {
                List<UUID> ids = notificationRepository.findIdsByStatusInAndCreatedBefore(CLEANUP_STATUSES, cutoff);
                int total = 0;
                for (int from = 0; from < ids.size(); from += CLEANUP_CHUNK_SIZE) {
                    List<UUID> chunk = ids.subList(from, Math.min(from + CLEANUP_CHUNK_SIZE, ids.size()));
                    deliveryLogRepository.deleteAllByNotificationIdIn(chunk);
                    total += notificationRepository.deleteAllByIdIn(chunk);
                }
                return total;
            });
            log.info("Cleaned up {} notifications older than {} days", removed, properties.getCleanupAfterDays());
            return ServiceResult.success(removed);
        } catch (Exception e) {
            log.error("Failed to clean up old notifications", e);
            return ServiceResult.failure("Failed to clean up notifications: " + e.getMessage());
        }
    }

    private Notification deliverAndPersist(Notification notification) {
        ChannelSet effective = resolveEffectiveChannels(notification);
        notification.setEffectiveChannels(effective);

        DispatchOutcome outcome;
        if (effective.isEmpty()) {
            log.info("Notification {} for user {} blocked by preferences (requested {})",
                notification.getId(), notification.getRecipientUserId(), notification.getRequestedChannels());
            metricsService.recordBlocked();
            notification.setErrorMessage(BLOCKED_BY_PREFERENCES);
            outcome = DispatchOutcome.empty();
        } else {
            outcome = dispatcher.dispatch(notification, effective);
            applyOutcome(notification, outcome);
        }

        return persist(notification, outcome.attempts());
    }

    private ChannelSet resolveEffectiveChannels(Notification notification) {
        // Without a user there is no preference to apply
        if (!hasText(notification.getRecipientUserId())) {
            return notification.getRequestedChannels();
        }
        return preferenceService.getEffectiveChannels(
            notification.getRecipientUserId(),
            notification.getRequestedChannels(),
            notification.getPriority(),
            notification.getCategory());
    }

    private void applyOutcome(Notification notification, DispatchOutcome outcome) {
        notification.setDeliveryAttempts(notification.getDeliveryAttempts() + outcome.attempts().size());

        if (outcome.anySuccess()) {
            transition(notification, NotificationStatus.DELIVERED);
            notification.setDeliveredAt(LocalDateTime.now());
            notification.setErrorMessage(null);
            return;
        }

        String summary = outcome.failureSummary();
        if (summary == null && outcome.interrupted()) {
            summary = "Dispatch interrupted before any channel was attempted";
        }
        notification.setErrorMessage(DeliveryLogRecorder.truncate(summary, MAX_ERROR_MESSAGE_LENGTH));
        log.warn("Notification {} was not delivered on any channel: {}", notification.getId(), summary);
    }

    private Notification persist(Notification notification, List<DeliveryAttempt> attempts) {
        return transactionTemplate.execute(status -> {
            Notification saved = notificationRepository.save(notification);
            for (DeliveryAttempt attempt : attempts) {
                deliveryLogRecorder.record(saved.getId(), attempt.channel(), attempt.providerName(),
                    attempt.attemptNumber(), attempt.result());
            }
            return saved;
        });
    }

    private Notification buildNotification(NotificationRequest request) {
        Notification notification = new Notification();
        notification.setId(UUID.randomUUID());
        notification.setTitle(request.getTitle());
        notification.setMessage(request.getMessage());
        notification.setType(request.getType() != null ? request.getType() : NotificationType.INFO);
        notification.setPriority(request.getPriority() != null ? request.getPriority() : NotificationPriority.NORMAL);
        notification.setCategory(request.getCategory());
        notification.setRequestedChannels(request.getChannels() == null || request.getChannels().isEmpty()
            ? properties.defaultChannelSet()
            : ChannelSet.of(request.getChannels()));
        notification.setRecipientUserId(request.getRecipientUserId());
        notification.setRecipientEmail(request.getRecipientEmail());
        notification.setRecipientPhone(request.getRecipientPhone());
        notification.setSenderUserId(request.getSenderUserId());
        notification.setTenantId(request.getTenantId());
        notification.setActionUrl(request.getActionUrl());
        notification.setImageUrl(request.getImageUrl());
        notification.setMetadata(metadataSerializer.write(request.getMetadata()));
        notification.setExpiresAt(request.getExpiresAt() != null
            ? request.getExpiresAt()
            : LocalDateTime.now().plusDays(properties.getDefaultExpirationDays()));
        notification.setStatus(NotificationStatus.PENDING);
        notification.setDeliveryAttempts(0);

        fillContactData(notification);
        return notification;
    }

    /**
     * Email and phone come from the recipient's preference when the request
     * asks for those channels without supplying the address.
     */
    private void fillContactData(Notification notification) {
        if (!hasText(notification.getRecipientUserId())) {
            return;
        }
        ChannelSet requested = notification.getRequestedChannels();
        boolean needsEmail = requested.contains(NotificationChannel.EMAIL) && !hasText(notification.getRecipientEmail());
        boolean needsPhone = requested.contains(NotificationChannel.SMS) && !hasText(notification.getRecipientPhone());
        if (!needsEmail && !needsPhone) {
            return;
        }

        NotificationPreference preference = preferenceService.resolvePreference(
            notification.getRecipientUserId(), notification.getCategory());
        if (needsEmail && hasText(preference.getEmail())) {
            notification.setRecipientEmail(preference.getEmail());
        }
        if (needsPhone && hasText(preference.getPhone())) {
            notification.setRecipientPhone(preference.getPhone());
        }
    }

    private int markUnreadAsRead(List<Notification> notifications) {
        LocalDateTime now = LocalDateTime.now();
        List<Notification> changed = new ArrayList<>();
        for (Notification notification : notifications) {
            if (!notification.isRead()) {
                markRead(notification, now);
                changed.add(notification);
            }
        }
        if (!changed.isEmpty()) {
            notificationRepository.saveAll(changed);
        }
        return changed.size();
    }

    private void markRead(Notification notification, LocalDateTime now) {
        transition(notification, NotificationStatus.READ);
        notification.setReadAt(now);
    }

    private void transition(Notification notification, NotificationStatus target) {
        statusTransitionValidator.assertValidTransition(notification.getStatus(), target);
        notification.setStatus(target);
    }

    private String validate(NotificationRequest request) {
        if (request == null) {
            return "Notification request is required";
        }
        Set<ConstraintViolation<NotificationRequest>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .collect(Collectors.joining("; "));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
