package com.craftnotify.engine.service;

import com.craftnotify.engine.enums.NotificationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guards notification status changes.
 * 
 * ⚠️ Must stay deterministic: pure enum-map lookup, no database calls, no
 * time-based logic.
 * 
 * Valid transitions:
 * - PENDING → DELIVERED, READ
 * - QUEUED → PENDING (scheduled time reached), DELIVERED, READ
 * - DELIVERED → READ
 * - READ → (terminal)
 * 
 * READ is reachable from every other state because marking as read does not
 * require a prior successful delivery.
 */
@Component
@Slf4j
public class StatusTransitionValidator {

    private static final Set<NotificationStatus> TERMINAL_STATES = EnumSet.of(NotificationStatus.READ);

    private static final Map<NotificationStatus, Set<NotificationStatus>> VALID_TRANSITIONS = Map.of(
        NotificationStatus.PENDING, EnumSet.of(
            NotificationStatus.DELIVERED,
            NotificationStatus.READ
        ),
        NotificationStatus.QUEUED, EnumSet.of(
            NotificationStatus.PENDING,
            NotificationStatus.DELIVERED,
            NotificationStatus.READ
        ),
        NotificationStatus.DELIVERED, EnumSet.of(
            NotificationStatus.READ
        )
    );

    /**
     * @return true if the transition is allowed; same-status is always allowed
     */
    public boolean isValidTransition(NotificationStatus fromStatus, NotificationStatus toStatus) {
        if (fromStatus == toStatus) {
            return true;
        }

        if (TERMINAL_STATES.contains(fromStatus)) {
            log.warn("Invalid status transition attempted: {} → {} ({} is a terminal state)",
                fromStatus, toStatus, fromStatus);
            return false;
        }

        Set<NotificationStatus> allowedTransitions = VALID_TRANSITIONS.get(fromStatus);
        if (allowedTransitions == null || !allowedTransitions.contains(toStatus)) {
            log.warn("Invalid status transition attempted: {} → {} (not in allowed transitions)",
                fromStatus, toStatus);
            return false;
        }

        return true;
    }

    /**
     * @throws IllegalArgumentException if the transition is not allowed
     */
    public void assertValidTransition(NotificationStatus fromStatus, NotificationStatus toStatus) {
        if (!isValidTransition(fromStatus, toStatus)) {
            throw new IllegalArgumentException(
                String.format("Invalid status transition: %s → %s", fromStatus, toStatus)
            );
        }
    }
}
