package com.agronet.marketplace.service;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Favorite;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.repository.FavoriteRepository;
import com.agronet.marketplace.security.CurrentUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Favorites: users bookmark published announcements and list them later.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class FavoriteService {

    private static final Logger logger = LoggerFactory.getLogger(FavoriteService.class);

    private static final String ALREADY_FAVORITED = "Announcement is already in your favorites";

    private final FavoriteRepository favoriteRepository;
    private final AnnouncementRepository announcementRepository;
    private final PageRequests pageRequests;

    public FavoriteService(
            FavoriteRepository favoriteRepository,
            AnnouncementRepository announcementRepository,
            PageRequests pageRequests
    ) {
        this.favoriteRepository = favoriteRepository;
        this.announcementRepository = announcementRepository;
        this.pageRequests = pageRequests;
    }

    /**
     * Add an announcement to the caller's favorites. Only published announcements qualify.
     *
     * @throws ResourceNotFoundException if the announcement does not exist
     * @throws ValidationException if the announcement is not published
     * @throws ConflictException if the caller already favorited it
     */
    @Transactional
    public Favorite add(CurrentUser actor, String announcementId) {
        Announcement announcement = announcementRepository.findById(announcementId)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", announcementId));
        if (announcement.getStatus() != AnnouncementStatus.PUBLISHED) {
            throw new ValidationException("announcementId", "Only published announcements can be added to favorites");
        }
        if (favoriteRepository.existsByAnnouncementIdAndUserId(announcementId, actor.getId())) {
            throw new ConflictException(ALREADY_FAVORITED);
        }

        Favorite saved;
        try {
            saved = favoriteRepository.saveAndFlush(Favorite.builder()
                    .announcementId(announcementId)
                    .userId(actor.getId())
                    .build());
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent add by the same user
            throw new ConflictException(ALREADY_FAVORITED);
        }

        logger.info("Favorite added: announcement={}, user={}", announcementId, actor.getId());
        return saved;
    }

    /**
     * @throws ResourceNotFoundException if the caller has not favorited the announcement
     */
    @Transactional
    public void remove(CurrentUser actor, String announcementId) {
        Favorite favorite = favoriteRepository.findByAnnouncementIdAndUserId(announcementId, actor.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Favorite", announcementId));
        favoriteRepository.delete(favorite);
        logger.info("Favorite removed: announcement={}, user={}", announcementId, actor.getId());
    }

    /**
     * The caller's favorited announcements that are still published, most recently favorited first.
     * Favorites on announcements that left PUBLISHED are kept but not listed.
     */
    @Transactional(readOnly = true)
    public Page<Announcement> list(CurrentUser actor, Integer page, Integer limit) {
        return favoriteRepository.findFavoritedAnnouncements(
                actor.getId(), AnnouncementStatus.PUBLISHED, pageRequests.of(page, limit, Sort.unsorted()));
    }

    @Transactional(readOnly = true)
    public FavoriteStatus status(CurrentUser actor, String announcementId) {
        return new FavoriteStatus(
                announcementId,
                favoriteRepository.existsByAnnouncementIdAndUserId(announcementId, actor.getId()),
                favoriteRepository.countByAnnouncementId(announcementId));
    }
}
