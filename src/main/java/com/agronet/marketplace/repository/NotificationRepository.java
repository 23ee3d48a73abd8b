package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for the notification inbox.
 *
 * @author Agronet Marketplace Team
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, String> {

    /**
     * List a user's notifications with optional seen and type filters.
     *
     * @param userId Recipient
     * @param seen Seen filter, null for all
     * @param type Type filter, null for all
     * @param pageable Page request
     * @return Page of notifications
     */
    @Query("SELECT n FROM Notification n WHERE n.userId = :userId " +
           "AND (:seen IS NULL OR n.seen = :seen) " +
           "AND (:type IS NULL OR n.type = :type)")
    Page<Notification> findForUser(
            @Param("userId") String userId,
            @Param("seen") Boolean seen,
            @Param("type") String type,
            Pageable pageable
    );

    Optional<Notification> findByIdAndUserId(String id, String userId);

    boolean existsByEventId(String eventId);

    long countByUserIdAndSeenFalse(String userId);

    /**
     * Mark every unseen notification of a user as seen.
     *
     * @param userId Recipient
     * @param seenAt Timestamp to record
     * @return Number of notifications updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Notification n SET n.seen = true, n.seenAt = :seenAt " +
           "WHERE n.userId = :userId AND n.seen = false")
    int markAllSeen(@Param("userId") String userId, @Param("seenAt") Instant seenAt);
}
