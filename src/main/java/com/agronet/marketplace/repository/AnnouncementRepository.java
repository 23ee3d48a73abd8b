package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Announcement entity.
 * Listing filters are expressed as {@link AnnouncementSpecifications}.
 *
 * @author Agronet Marketplace Team
 */
@Repository
public interface AnnouncementRepository extends JpaRepository<Announcement, String>,
        JpaSpecificationExecutor<Announcement> {

    /**
     * Find announcement with pessimistic write lock.
     * Every lifecycle transition and every ledger mutation goes through this lock,
     * which serializes concurrent approvals against the same announcement.
     *
     * @param id Announcement ID
     * @return Optional containing the locked announcement
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Announcement a WHERE a.id = :id")
    Optional<Announcement> findByIdForUpdate(@Param("id") String id);

    /**
     * Find ids of PUBLISHED announcements that are past their end date:
     * rent announcements whose rental period ended, or any announcement past its expiry date.
     *
     * @param status PUBLISHED
     * @param rent RENT category
     * @param today Current date in the marketplace time zone
     * @return Announcement ids to close
     */
    @Query("SELECT a.id FROM Announcement a WHERE a.status = :status " +
           "AND ((a.category = :rent AND a.dateTo < :today) OR a.expiryDate < :today) " +
           "ORDER BY a.createdAt")
    List<String> findExpiredIds(
            @Param("status") AnnouncementStatus status,
            @Param("rent") AnnouncementCategory rent,
            @Param("today") LocalDate today
    );
}
