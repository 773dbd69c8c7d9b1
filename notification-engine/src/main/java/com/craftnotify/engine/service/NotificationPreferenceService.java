package com.craftnotify.engine.service;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.model.NotificationPriority;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.dto.ServiceResult;
import com.craftnotify.engine.entity.NotificationPreference;
import com.craftnotify.engine.repository.NotificationPreferenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Resolves which channels a recipient actually accepts and manages the
 * stored preferences behind that decision.
 * 
 * Lookup chain for (user, category):
 * 1. the row for that exact category
 * 2. the user's default row (category null)
 * 3. a virtual default: enabled, configured default channels, minimum priority LOW
 * 
 * A missing preference is never an error. Storage failures propagate from the
 * read methods and come back as failed results from the write methods.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationPreferenceService {

    private final NotificationPreferenceRepository preferenceRepository;
    private final NotificationProperties properties;

    /**
     * Channels of {@code requested} the recipient accepts for this priority and category.
     * 
     * Empty when the preference is disabled or the priority is below its floor;
     * otherwise the intersection of requested and enabled channels.
     */
    public ChannelSet getEffectiveChannels(String userId, ChannelSet requested,
                                           NotificationPriority priority, String category) {
        NotificationPreference preference = resolvePreference(userId, category);

        if (!Boolean.TRUE.equals(preference.getIsEnabled())) {
            log.debug("Notifications disabled for user {} (category {})", userId, category);
            return ChannelSet.none();
        }
        if (priority != null && priority.isBelow(preference.getMinimumPriority())) {
            log.debug("Priority {} below minimum {} for user {} (category {})",
                priority, preference.getMinimumPriority(), userId, category);
            return ChannelSet.none();
        }

        ChannelSet enabled = preference.getEnabledChannels() != null ? preference.getEnabledChannels() : ChannelSet.none();
        return requested.intersect(enabled);
    }

    public ChannelSet getEffectiveChannels(String userId, ChannelSet requested, NotificationPriority priority) {
        return getEffectiveChannels(userId, requested, priority, null);
    }

    /**
     * Preference that applies to (user, category), falling back to the user's
     * default row and then to an unsaved virtual default.
     */
    public NotificationPreference resolvePreference(String userId, String category) {
        Optional<NotificationPreference> preference = Optional.empty();
        if (category != null) {
            preference = preferenceRepository.findByUserIdAndCategory(userId, category);
        }
        if (preference.isEmpty()) {
            preference = preferenceRepository.findByUserIdAndCategoryIsNull(userId);
        }
        return preference.orElseGet(() -> virtualDefault(userId));
    }

    /**
     * Stored row for exactly (user, category); no fallback.
     */
    public Optional<NotificationPreference> getPreference(String userId, String category) {
        return preferenceRepository.findExact(userId, category);
    }

    public List<NotificationPreference> getAllPreferences(String userId) {
        return preferenceRepository.findByUserIdOrderByCategoryAsc(userId);
    }

    public boolean isChannelEnabled(String userId, NotificationChannel channel, String category) {
        return resolvePreference(userId, category).isChannelEnabled(channel);
    }

    public boolean isChannelEnabled(String userId, NotificationChannel channel) {
        return isChannelEnabled(userId, channel, null);
    }

    /**
     * Insert or replace the settings of the (user, category) row.
     */
    @Transactional
    public ServiceResult<NotificationPreference> updatePreference(NotificationPreference preference) {
        if (preference == null || isBlank(preference.getUserId())) {
            return ServiceResult.failure("User ID is required");
        }
        return upsert(preference.getUserId(), preference.getCategory(), target -> {
            target.setTenantId(preference.getTenantId());
            target.setEnabledChannels(preference.getEnabledChannels() != null
                ? preference.getEnabledChannels() : properties.defaultChannelSet());
            target.setIsEnabled(preference.getIsEnabled() == null || preference.getIsEnabled());
            target.setMinimumPriority(preference.getMinimumPriority() != null
                ? preference.getMinimumPriority() : NotificationPriority.LOW);
            target.setEmail(preference.getEmail());
            target.setPhone(preference.getPhone());
            target.setPushEndpoint(preference.getPushEndpoint());
            target.setPushPublicKey(preference.getPushPublicKey());
            target.setPushAuth(preference.getPushAuth());
            target.setWebhookUrl(preference.getWebhookUrl());
        });
    }

    @Transactional
    public ServiceResult<NotificationPreference> setEnabledChannels(String userId, ChannelSet channels, String category) {
        if (isBlank(userId)) {
            return ServiceResult.failure("User ID is required");
        }
        ChannelSet enabled = channels != null ? channels : ChannelSet.none();
        return upsert(userId, category, target -> target.setEnabledChannels(enabled));
    }

    /**
     * Store the web-push subscription on the user's default row and enable PUSH.
     */
    @Transactional
    public ServiceResult<NotificationPreference> registerPushSubscription(String userId, String endpoint,
                                                                          String publicKey, String auth) {
        if (isBlank(userId)) {
            return ServiceResult.failure("User ID is required");
        }
        if (isBlank(endpoint)) {
            return ServiceResult.failure("Push endpoint is required");
        }
        return upsert(userId, null, target -> {
            target.setPushEndpoint(endpoint);
            target.setPushPublicKey(publicKey);
            target.setPushAuth(auth);
            target.setEnabledChannels(target.getEnabledChannels().with(NotificationChannel.PUSH));
        });
    }

    /**
     * Clear the web-push subscription and disable PUSH. Succeeds when there is nothing to remove.
     */
    @Transactional
    public ServiceResult<Void> removePushSubscription(String userId) {
        try {
            preferenceRepository.findByUserIdAndCategoryIsNull(userId).ifPresent(preference -> {
                preference.setPushEndpoint(null);
                preference.setPushPublicKey(null);
                preference.setPushAuth(null);
                preference.setEnabledChannels(preference.getEnabledChannels().without(NotificationChannel.PUSH));
                preferenceRepository.save(preference);
            });
            log.info("Removed push subscription for user {}", userId);
            return ServiceResult.successEmpty();
        } catch (DataAccessException e) {
            log.error("Failed to remove push subscription for user {}", userId, e);
            return ServiceResult.failure("Failed to remove push subscription: " + e.getMessage());
        }
    }

    private ServiceResult<NotificationPreference> upsert(String userId, String category,
                                                         Consumer<NotificationPreference> changes) {
        try {
            NotificationPreference target = preferenceRepository.findExact(userId, category)
                .orElseGet(() -> newPreference(userId, category));
            changes.accept(target);
            NotificationPreference saved = preferenceRepository.save(target);
            log.info("Saved notification preference for user {} (category {})", userId, category);
            return ServiceResult.success(saved);
        } catch (DataAccessException e) {
            log.error("Failed to save notification preference for user {} (category {})", userId, category, e);
            return ServiceResult.failure("Failed to update preference: " + e.getMessage());
        }
    }

    private NotificationPreference newPreference(String userId, String category) {
        NotificationPreference preference = new NotificationPreference(userId, category);
        preference.setEnabledChannels(properties.defaultChannelSet());
        return preference;
    }

    private NotificationPreference virtualDefault(String userId) {
        NotificationPreference preference = newPreference(userId, null);
        preference.setIsEnabled(true);
        preference.setMinimumPriority(NotificationPriority.LOW);
        return preference;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
