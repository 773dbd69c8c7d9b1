package com.craftnotify.engine.service;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.model.NotificationPriority;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.dispatch.DeliveryAttempt;
import com.craftnotify.engine.dispatch.DispatchOutcome;
import com.craftnotify.engine.dispatch.NotificationDispatcher;
import com.craftnotify.engine.dto.NotificationRequest;
import com.craftnotify.engine.dto.ServiceResult;
import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.entity.NotificationPreference;
import com.craftnotify.engine.enums.NotificationStatus;
import com.craftnotify.engine.enums.NotificationType;
import com.craftnotify.engine.repository.NotificationDeliveryLogRepository;
import com.craftnotify.engine.repository.NotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.craftnotify.common.channel.NotificationChannel.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final String USER_ID = "user-1";

    private static Validator validator;

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private NotificationDeliveryLogRepository deliveryLogRepository;

    @Mock
    private NotificationPreferenceService preferenceService;

    @Mock
    private NotificationDispatcher dispatcher;

    @Mock
    private DeliveryLogRecorder deliveryLogRecorder;

    @Mock
    private NotificationMetricsService metricsService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private NotificationProperties properties;
    private NotificationService notificationService;

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @BeforeEach
    void setUp() {
        properties = new NotificationProperties();
        notificationService = new NotificationService(
            notificationRepository,
            deliveryLogRepository,
            preferenceService,
            dispatcher,
            deliveryLogRecorder,
            new StatusTransitionValidator(),
            new NotificationMetadataSerializer(new ObjectMapper()),
            metricsService,
            properties,
            validator,
            new TransactionTemplate(transactionManager));
    }

    @Test
    void testSend_WithMinimalRequest_AppliesDefaultsAndDelivers() {
        DeliveryResult delivered = DeliveryResult.createSuccess("Stored for user " + USER_ID);
        when(preferenceService.getEffectiveChannels(USER_ID, ChannelSet.of(IN_APP), NotificationPriority.NORMAL, null))
            .thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(any(Notification.class), eq(ChannelSet.of(IN_APP))))
            .thenReturn(outcome(attempt(IN_APP, "in-app", delivered)));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request(USER_ID));

        assertTrue(result.success());
        Notification notification = result.data();
        assertNotNull(notification.getId());
        assertEquals(NotificationType.INFO, notification.getType());
        assertEquals(NotificationPriority.NORMAL, notification.getPriority());
        assertEquals(ChannelSet.of(IN_APP), notification.getRequestedChannels());
        assertEquals(ChannelSet.of(IN_APP), notification.getEffectiveChannels());
        assertEquals(NotificationStatus.DELIVERED, notification.getStatus());
        assertNotNull(notification.getDeliveredAt());
        assertNull(notification.getErrorMessage());
        assertEquals(1, notification.getDeliveryAttempts());
        assertFalse(notification.getIsDeleted());

        LocalDateTime expectedExpiry = LocalDateTime.now().plusDays(30);
        assertTrue(notification.getExpiresAt().isAfter(expectedExpiry.minusMinutes(1)));
        assertTrue(notification.getExpiresAt().isBefore(expectedExpiry.plusMinutes(1)));

        verify(deliveryLogRecorder).record(notification.getId(), IN_APP, "in-app", 1, delivered);
        verify(metricsService).recordCreated();
    }

    @Test
    void testSend_WhenOneChannelSucceedsAndOneFails_IsDeliveredWithTwoLogs() {
        NotificationRequest request = request(USER_ID);
        request.setChannels(EnumSet.of(IN_APP, EMAIL));
        request.setRecipientEmail("user@example.com");
        DeliveryResult inAppResult = DeliveryResult.createSuccess();
        DeliveryResult emailResult = DeliveryResult.createFailure("SendGrid returned 503");

        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any()))
            .thenReturn(ChannelSet.of(IN_APP, EMAIL));
        when(dispatcher.dispatch(any(Notification.class), eq(ChannelSet.of(IN_APP, EMAIL))))
            .thenReturn(outcome(attempt(IN_APP, "in-app", inAppResult), attempt(EMAIL, "sendgrid", emailResult)));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request);

        assertTrue(result.success());
        assertEquals(NotificationStatus.DELIVERED, result.data().getStatus());
        assertEquals(2, result.data().getDeliveryAttempts());
        assertNull(result.data().getErrorMessage());
        verify(deliveryLogRecorder).record(any(), eq(IN_APP), eq("in-app"), eq(1), eq(inAppResult));
        verify(deliveryLogRecorder).record(any(), eq(EMAIL), eq("sendgrid"), eq(1), eq(emailResult));
    }

    @Test
    void testSend_WhenAllChannelsFail_StaysPendingWithSummary() {
        NotificationRequest request = request(USER_ID);
        request.setChannels(EnumSet.of(IN_APP, WEBHOOK));

        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any()))
            .thenReturn(ChannelSet.of(IN_APP, WEBHOOK));
        when(dispatcher.dispatch(any(Notification.class), any(ChannelSet.class)))
            .thenReturn(outcome(
                attempt(IN_APP, "in-app", DeliveryResult.createFailure("store failed")),
                attempt(WEBHOOK, "webhook", DeliveryResult.createFailure("HTTP 500"))));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request);

        assertTrue(result.success());
        assertEquals(NotificationStatus.PENDING, result.data().getStatus());
        assertNull(result.data().getDeliveredAt());
        assertEquals("IN_APP: store failed; WEBHOOK: HTTP 500", result.data().getErrorMessage());
    }

    @Test
    void testSend_WhenPriorityBelowPreferenceMinimum_IsBlockedWithoutDispatch() {
        NotificationRequest request = request(USER_ID);
        request.setPriority(NotificationPriority.NORMAL);
        when(preferenceService.getEffectiveChannels(USER_ID, ChannelSet.of(IN_APP), NotificationPriority.NORMAL, null))
            .thenReturn(ChannelSet.none());
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request);

        assertTrue(result.success());
        assertEquals(NotificationStatus.PENDING, result.data().getStatus());
        assertTrue(result.data().getEffectiveChannels().isEmpty());
        assertEquals(NotificationService.BLOCKED_BY_PREFERENCES, result.data().getErrorMessage());
        assertEquals(0, result.data().getDeliveryAttempts());
        verifyNoInteractions(dispatcher, deliveryLogRecorder);
        verify(metricsService).recordBlocked();
    }

    @Test
    void testSend_WithoutRecipientUser_UsesRequestedChannels() {
        NotificationRequest request = new NotificationRequest();
        request.setTitle("Invoice ready");
        request.setMessage("Your invoice is ready");
        request.setRecipientEmail("billing@example.com");
        request.setChannels(EnumSet.of(EMAIL));
        when(dispatcher.dispatch(any(Notification.class), eq(ChannelSet.of(EMAIL))))
            .thenReturn(outcome(attempt(EMAIL, "sendgrid", DeliveryResult.createSuccess())));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request);

        assertTrue(result.success());
        assertEquals(NotificationStatus.DELIVERED, result.data().getStatus());
        verifyNoInteractions(preferenceService);
    }

    @Test
    void testSend_WhenEmailRequestedWithoutAddress_FillsFromPreference() {
        NotificationRequest request = request(USER_ID);
        request.setChannels(EnumSet.of(EMAIL));
        NotificationPreference preference = new NotificationPreference(USER_ID, null);
        preference.setEmail("stored@example.com");
        when(preferenceService.resolvePreference(USER_ID, null)).thenReturn(preference);
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(EMAIL));
        when(dispatcher.dispatch(any(Notification.class), any(ChannelSet.class)))
            .thenReturn(outcome(attempt(EMAIL, "sendgrid", DeliveryResult.createSuccess())));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request);

        assertEquals("stored@example.com", result.data().getRecipientEmail());
    }

    @Test
    void testSend_WithMetadata_StoresJson() {
        NotificationRequest request = request(USER_ID);
        request.setMetadata(Map.of("webhookUrl", "https://hooks.example.com/a"));
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(any(Notification.class), any(ChannelSet.class)))
            .thenReturn(outcome(attempt(IN_APP, "in-app", DeliveryResult.createSuccess())));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.send(request);

        assertEquals("{\"webhookUrl\":\"https://hooks.example.com/a\"}", result.data().getMetadata());
    }

    @Test
    void testSend_WhenTitleMissing_ReturnsFailure() {
        NotificationRequest request = request(USER_ID);
        request.setTitle(null);

        ServiceResult<Notification> result = notificationService.send(request);

        assertFalse(result.success());
        assertEquals("Title is required", result.error());
        verifyNoInteractions(notificationRepository, dispatcher);
    }

    @Test
    void testSend_WhenEmailMalformed_ReturnsFailure() {
        NotificationRequest request = request(USER_ID);
        request.setRecipientEmail("not-an-email");

        ServiceResult<Notification> result = notificationService.send(request);

        assertFalse(result.success());
        assertTrue(result.error().contains("valid email"));
    }

    @Test
    void testSend_WhenNoRecipient_ReturnsFailure() {
        NotificationRequest request = request(null);

        ServiceResult<Notification> result = notificationService.send(request);

        assertFalse(result.success());
        assertTrue(result.error().contains("At least one recipient"));
    }

    @Test
    void testSend_WhenPersistenceFails_ReturnsFailure() {
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(any(Notification.class), any(ChannelSet.class)))
            .thenReturn(outcome(attempt(IN_APP, "in-app", DeliveryResult.createSuccess())));
        when(notificationRepository.save(any(Notification.class)))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        ServiceResult<Notification> result = notificationService.send(request(USER_ID));

        assertFalse(result.success());
        assertEquals("Failed to send notification: db down", result.error());
        verifyNoInteractions(deliveryLogRecorder);
        verify(metricsService, never()).recordCreated();
    }

    @Test
    void testSendBatch_WhenOverMaximum_RejectsWholeBatch() {
        properties.setMaxBatchSize(2);

        ServiceResult<List<Notification>> result = notificationService.sendBatch(
            List.of(request("a"), request("b"), request("c")));

        assertFalse(result.success());
        assertEquals("Batch size 3 exceeds maximum 2", result.error());
        verifyNoInteractions(notificationRepository, dispatcher);
    }

    @Test
    void testSendBatch_WhenDisabled_ReturnsFailure() {
        properties.setEnableBatchProcessing(false);

        ServiceResult<List<Notification>> result = notificationService.sendBatch(List.of(request("a")));

        assertFalse(result.success());
        assertEquals("Batch processing is not enabled", result.error());
    }

    @Test
    void testSendBatch_WhenItemInvalid_RejectsBeforeSending() {
        NotificationRequest invalid = request("b");
        invalid.setMessage(" ");

        ServiceResult<List<Notification>> result = notificationService.sendBatch(List.of(request("a"), invalid));

        assertFalse(result.success());
        assertEquals("Batch item 1 is invalid: Message is required", result.error());
        verifyNoInteractions(notificationRepository, dispatcher);
    }

    @Test
    void testSendBatch_WhenEmpty_ReturnsEmptyList() {
        ServiceResult<List<Notification>> result = notificationService.sendBatch(List.of());

        assertTrue(result.success());
        assertTrue(result.data().isEmpty());
    }

    @Test
    void testSendToMultiple_CreatesOneNotificationPerRecipientEntry() {
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(any(Notification.class), any(ChannelSet.class)))
            .thenReturn(outcome(attempt(IN_APP, "in-app", DeliveryResult.createSuccess())));
        stubSaveReturnsArgument();

        ServiceResult<List<Notification>> result = notificationService.sendToMultiple(
            request(null), Arrays.asList("alice", "bob", "alice", "carol"));

        assertTrue(result.success());
        assertEquals(4, result.data().size());
        assertEquals(List.of("alice", "bob", "alice", "carol"), result.data().stream()
            .map(Notification::getRecipientUserId)
            .collect(Collectors.toList()));
        assertEquals(4, result.data().stream().map(Notification::getId).distinct().count());
        verify(dispatcher, times(4)).dispatch(any(Notification.class), any(ChannelSet.class));
    }

    @Test
    void testSchedule_StoresQueuedWithoutDispatch() {
        LocalDateTime scheduledFor = LocalDateTime.now().plusHours(2);
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.schedule(request(USER_ID), scheduledFor);

        assertTrue(result.success());
        assertEquals(NotificationStatus.QUEUED, result.data().getStatus());
        assertEquals(scheduledFor, result.data().getScheduledFor());
        verifyNoInteractions(dispatcher, preferenceService);
        verify(metricsService).recordScheduled();
    }

    @Test
    void testSchedule_WhenTimeMissing_ReturnsFailure() {
        ServiceResult<Notification> result = notificationService.schedule(request(USER_ID), null);

        assertFalse(result.success());
        verifyNoInteractions(notificationRepository);
    }

    @Test
    void testDispatchScheduled_WhenDeliveryFails_MovesToPendingWithError() {
        Notification queued = existing(NotificationStatus.QUEUED);
        when(notificationRepository.findByIdAndIsDeletedFalse(queued.getId())).thenReturn(Optional.of(queued));
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(queued, ChannelSet.of(IN_APP)))
            .thenReturn(outcome(attempt(IN_APP, "in-app", DeliveryResult.createFailure("boom"))));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.dispatchScheduled(queued.getId());

        assertTrue(result.success());
        assertEquals(NotificationStatus.PENDING, queued.getStatus());
        assertEquals("IN_APP: boom", queued.getErrorMessage());
    }

    @Test
    void testDispatchScheduled_WhenNotQueued_ReturnsFailure() {
        Notification delivered = existing(NotificationStatus.DELIVERED);
        when(notificationRepository.findByIdAndIsDeletedFalse(delivered.getId())).thenReturn(Optional.of(delivered));

        ServiceResult<Notification> result = notificationService.dispatchScheduled(delivered.getId());

        assertFalse(result.success());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testRetryDelivery_WhenAttemptsExhausted_ReturnsFailure() {
        Notification pending = existing(NotificationStatus.PENDING);
        when(notificationRepository.findByIdAndIsDeletedFalse(pending.getId())).thenReturn(Optional.of(pending));
        when(deliveryLogRecorder.highestAttemptNumber(pending.getId())).thenReturn(3);

        ServiceResult<Notification> result = notificationService.retryDelivery(pending.getId());

        assertFalse(result.success());
        assertEquals("Maximum retry attempts (3) exceeded", result.error());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testRetryDelivery_WhenUnderLimit_DispatchesAgain() {
        Notification pending = existing(NotificationStatus.PENDING);
        pending.setDeliveryAttempts(1);
        pending.setErrorMessage("IN_APP: boom");
        when(notificationRepository.findByIdAndIsDeletedFalse(pending.getId())).thenReturn(Optional.of(pending));
        when(deliveryLogRecorder.highestAttemptNumber(pending.getId())).thenReturn(1);
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(pending, ChannelSet.of(IN_APP)))
            .thenReturn(outcome(attempt(IN_APP, "in-app", 2, DeliveryResult.createSuccess())));
        stubSaveReturnsArgument();

        ServiceResult<Notification> result = notificationService.retryDelivery(pending.getId());

        assertTrue(result.success());
        assertEquals(NotificationStatus.DELIVERED, pending.getStatus());
        assertEquals(2, pending.getDeliveryAttempts());
        assertNull(pending.getErrorMessage());
        verify(deliveryLogRecorder).record(eq(pending.getId()), eq(IN_APP), eq("in-app"), eq(2), any());
    }

    @Test
    void testRetryDelivery_WhenAlreadyDelivered_ReturnsFailure() {
        Notification delivered = existing(NotificationStatus.DELIVERED);
        when(notificationRepository.findByIdAndIsDeletedFalse(delivered.getId())).thenReturn(Optional.of(delivered));

        ServiceResult<Notification> result = notificationService.retryDelivery(delivered.getId());

        assertFalse(result.success());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testMarkAsRead_WhenCalledTwice_IsIdempotent() {
        Notification delivered = existing(NotificationStatus.DELIVERED);
        when(notificationRepository.findByIdAndIsDeletedFalse(delivered.getId())).thenReturn(Optional.of(delivered));

        ServiceResult<Void> first = notificationService.markAsRead(delivered.getId());
        LocalDateTime readAt = delivered.getReadAt();
        ServiceResult<Void> second = notificationService.markAsRead(delivered.getId());

        assertTrue(first.success());
        assertTrue(second.success());
        assertEquals(NotificationStatus.READ, delivered.getStatus());
        assertNotNull(readAt);
        assertEquals(readAt, delivered.getReadAt());
        verify(notificationRepository, times(1)).save(delivered);
    }

    @Test
    void testMarkAsRead_WhenNotFound_ReturnsFailure() {
        UUID id = UUID.randomUUID();
        when(notificationRepository.findByIdAndIsDeletedFalse(id)).thenReturn(Optional.empty());

        ServiceResult<Void> result = notificationService.markAsRead(id);

        assertFalse(result.success());
        assertEquals("Notification not found", result.error());
    }

    @Test
    void testMarkAllAsReadForUser_MarksOnlyUnread() {
        Notification unread = existing(NotificationStatus.DELIVERED);
        Notification pending = existing(NotificationStatus.PENDING);
        when(notificationRepository.findUnreadActiveByRecipient(eq(USER_ID), any(LocalDateTime.class)))
            .thenReturn(List.of(unread, pending));

        ServiceResult<Void> result = notificationService.markAllAsReadForUser(USER_ID);

        assertTrue(result.success());
        assertTrue(unread.isRead());
        assertTrue(pending.isRead());
        assertEquals(NotificationStatus.READ, pending.getStatus());
        verify(notificationRepository).saveAll(List.of(unread, pending));
    }

    @Test
    void testMarkAllAsRead_SkipsAlreadyReadNotifications() {
        Notification unread = existing(NotificationStatus.DELIVERED);
        Notification read = existing(NotificationStatus.READ);
        read.setReadAt(LocalDateTime.now().minusDays(1));
        List<UUID> ids = List.of(unread.getId(), read.getId());
        when(notificationRepository.findByIdInAndIsDeletedFalse(ids)).thenReturn(List.of(unread, read));

        ServiceResult<Void> result = notificationService.markAllAsRead(ids);

        assertTrue(result.success());
        verify(notificationRepository).saveAll(List.of(unread));
    }

    @Test
    void testGetUnreadCount_DelegatesToRepository() {
        when(notificationRepository.countByRecipientUserIdAndReadAtIsNullAndIsDeletedFalse(USER_ID)).thenReturn(2L);

        assertEquals(2L, notificationService.getUnreadCount(USER_ID));
    }

    @Test
    void testGetUserNotifications_WhenExcludingRead_UsesUnreadQuery() {
        List<Notification> unread = List.of(existing(NotificationStatus.DELIVERED));
        when(notificationRepository.findByRecipientUserIdAndReadAtIsNullAndIsDeletedFalseOrderByCreatedAtDesc(USER_ID))
            .thenReturn(unread);

        assertEquals(unread, notificationService.getUserNotifications(USER_ID));
        verify(notificationRepository, never()).findByRecipientUserIdAndIsDeletedFalseOrderByCreatedAtDesc(any());
    }

    @Test
    void testDelete_MarksNotificationDeleted() {
        Notification notification = existing(NotificationStatus.DELIVERED);
        when(notificationRepository.findByIdAndIsDeletedFalse(notification.getId())).thenReturn(Optional.of(notification));

        ServiceResult<Void> result = notificationService.delete(notification.getId());

        assertTrue(result.success());
        assertTrue(notification.getIsDeleted());
        assertNotNull(notification.getDeletedAt());
        verify(notificationRepository).save(notification);
        verify(notificationRepository, never()).delete(any(Notification.class));
    }

    @Test
    void testCleanupOldNotifications_DeletesLogsThenNotifications() {
        List<UUID> ids = List.of(UUID.randomUUID(), UUID.randomUUID());
        when(notificationRepository.findIdsByStatusInAndCreatedBefore(any(), any(LocalDateTime.class))).thenReturn(ids);
        when(notificationRepository.deleteAllByIdIn(ids)).thenReturn(2);

        ServiceResult<Integer> result = notificationService.cleanupOldNotifications();

        assertTrue(result.success());
        assertEquals(2, result.data());
        InOrder inOrder = inOrder(deliveryLogRepository, notificationRepository);
        inOrder.verify(deliveryLogRepository).deleteAllByNotificationIdIn(ids);
        inOrder.verify(notificationRepository).deleteAllByIdIn(ids);
    }

    @Test
    void testCleanupOldNotifications_WhenDisabled_DoesNothing() {
        properties.setEnableAutoCleanup(false);

        ServiceResult<Integer> result = notificationService.cleanupOldNotifications();

        assertTrue(result.success());
        assertEquals(0, result.data());
        verifyNoInteractions(notificationRepository, deliveryLogRepository);
    }

    @Test
    void testSend_SavesNotificationBeforeRecordingLogs() {
        when(preferenceService.getEffectiveChannels(anyString(), any(), any(), any())).thenReturn(ChannelSet.of(IN_APP));
        when(dispatcher.dispatch(any(Notification.class), any(ChannelSet.class)))
            .thenReturn(outcome(attempt(IN_APP, "in-app", DeliveryResult.createSuccess())));
        stubSaveReturnsArgument();

        notificationService.send(request(USER_ID));

        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        InOrder inOrder = inOrder(notificationRepository, deliveryLogRecorder);
        inOrder.verify(notificationRepository).save(saved.capture());
        inOrder.verify(deliveryLogRecorder).record(eq(saved.getValue().getId()), eq(IN_APP), any(), anyInt(), any());
    }

    private void stubSaveReturnsArgument() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static NotificationRequest request(String userId) {
        NotificationRequest request = new NotificationRequest();
        request.setTitle("Build finished");
        request.setMessage("Pipeline #42 succeeded");
        request.setRecipientUserId(userId);
        return request;
    }

    private static Notification existing(NotificationStatus status) {
        Notification notification = new Notification();
        notification.setId(UUID.randomUUID());
        notification.setTitle("Build finished");
        notification.setMessage("Pipeline #42 succeeded");
        notification.setRecipientUserId(USER_ID);
        notification.setRequestedChannels(ChannelSet.of(IN_APP));
        notification.setStatus(status);
        return notification;
    }

    private static DeliveryAttempt attempt(NotificationChannel channel, String providerName, DeliveryResult result) {
        return attempt(channel, providerName, 1, result);
    }

    private static DeliveryAttempt attempt(NotificationChannel channel, String providerName, int attemptNumber,
                                           DeliveryResult result) {
        return new DeliveryAttempt(channel, providerName, attemptNumber, result);
    }

    private static DispatchOutcome outcome(DeliveryAttempt... attempts) {
        return new DispatchOutcome(List.of(attempts), false);
    }
}
