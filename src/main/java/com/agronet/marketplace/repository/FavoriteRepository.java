package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Favorite;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Favorite entity.
 *
 * @author Agronet Marketplace Team
 */
@Repository
public interface FavoriteRepository extends JpaRepository<Favorite, String> {

    boolean existsByAnnouncementIdAndUserId(String announcementId, String userId);

    Optional<Favorite> findByAnnouncementIdAndUserId(String announcementId, String userId);

    long countByAnnouncementId(String announcementId);

    /**
     * Announcements a user has favorited that are in the given status, most recently favorited first.
     * Pass an unsorted pageable; the order is fixed by the query.
     */
    @Query(value = "SELECT a FROM Favorite f, Announcement a " +
                   "WHERE a.id = f.announcementId AND f.userId = :userId AND a.status = :status " +
                   "ORDER BY f.createdAt DESC, f.id",
           countQuery = "SELECT COUNT(f) FROM Favorite f, Announcement a " +
                        "WHERE a.id = f.announcementId AND f.userId = :userId AND a.status = :status")
    Page<Announcement> findFavoritedAnnouncements(
            @Param("userId") String userId,
            @Param("status") AnnouncementStatus status,
            Pageable pageable
    );
}
