package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.AnnouncementView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for AnnouncementView entity.
 *
 * @author Agronet Marketplace Team
 */
@Repository
public interface AnnouncementViewRepository extends JpaRepository<AnnouncementView, String> {

    boolean existsByAnnouncementIdAndUserId(String announcementId, String userId);
}
