package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.Application;
import com.agronet.marketplace.domain.model.Application.ApplicationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Repository interface for Application entity.
 *
 * @author Agronet Marketplace Team
 */
@Repository
public interface ApplicationRepository extends JpaRepository<Application, String> {

    /**
     * Find application with pessimistic write lock.
     * Callers lock the parent announcement first.
     *
     * @param id Application ID
     * @return Optional containing the locked application
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT ap FROM Application ap WHERE ap.id = :id")
    Optional<Application> findByIdForUpdate(@Param("id") String id);

    /**
     * Announcement an application belongs to, read without loading the entity
     * so that the application can be locked after its announcement.
     */
    @Query("SELECT ap.announcementId FROM Application ap WHERE ap.id = :id")
    Optional<String> findAnnouncementIdById(@Param("id") String id);

    /**
     * Sum of counts of applications in the given status for an announcement.
     * Used by the quantity ledger with status APPROVED.
     *
     * @param announcementId Announcement ID
     * @param status Application status
     * @return Sum of counts, zero when there are none
     */
    @Query("SELECT COALESCE(SUM(ap.count), 0) FROM Application ap " +
           "WHERE ap.announcementId = :announcementId AND ap.status = :status")
    BigDecimal sumCountByAnnouncementIdAndStatus(
            @Param("announcementId") String announcementId,
            @Param("status") ApplicationStatus status
    );

    boolean existsByAnnouncementIdAndApplicantIdAndStatus(
            String announcementId,
            String applicantId,
            ApplicationStatus status
    );

    Page<Application> findByAnnouncementId(String announcementId, Pageable pageable);

    Page<Application> findByAnnouncementIdAndApplicantId(String announcementId, String applicantId, Pageable pageable);

    Page<Application> findByApplicantId(String applicantId, Pageable pageable);

    Page<Application> findByApplicantIdAndAnnouncementId(String applicantId, String announcementId, Pageable pageable);
}
