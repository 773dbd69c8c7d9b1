package com.craftnotify.engine.repository;

import com.craftnotify.engine.entity.NotificationPreference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationPreferenceRepository extends JpaRepository<NotificationPreference, UUID> {

    Optional<NotificationPreference> findByUserIdAndCategory(String userId, String category);

    Optional<NotificationPreference> findByUserIdAndCategoryIsNull(String userId);

    List<NotificationPreference> findByUserIdOrderByCategoryAsc(String userId);

    /**
     * Exact (user, category) lookup; a null category selects the user's default row.
     */
    default Optional<NotificationPreference> findExact(String userId, String category) {
        return category == null
            ? findByUserIdAndCategoryIsNull(userId)
            : findByUserIdAndCategory(userId, category);
    }
}
