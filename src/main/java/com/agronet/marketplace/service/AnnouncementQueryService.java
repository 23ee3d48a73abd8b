package com.agronet.marketplace.service;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.exception.ForbiddenOperationException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.security.CurrentUser;
import org.springframework.data.domain.Page;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

import static com.agronet.marketplace.repository.AnnouncementSpecifications.appliedBy;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.createdBefore;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.createdFrom;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.hasCategoryIn;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.hasGroupIn;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.hasItemIn;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.hasStatus;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.hasType;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.inAnyRegion;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.inAnyVillage;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.matchesText;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.notOwnedBy;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.ownedBy;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.priceFrom;
import static com.agronet.marketplace.repository.AnnouncementSpecifications.priceTo;

/**
 * Read side of announcements: public listing, search, the caller's own and applied-to lists.
 *
 * @author Agronet Marketplace Team
 */
@Service
@Transactional(readOnly = true)
public class AnnouncementQueryService {

    private final AnnouncementRepository announcementRepository;
    private final PageRequests pageRequests;
    private final Clock clock;

    public AnnouncementQueryService(
            AnnouncementRepository announcementRepository,
            PageRequests pageRequests,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.pageRequests = pageRequests;
        this.clock = clock;
    }

    /**
     * Public listing. Defaults to PUBLISHED; other statuses are visible to admins only.
     * The caller's own announcements are excluded.
     *
     * @param actor Caller, null when anonymous
     */
    public Page<Announcement> list(CurrentUser actor, AnnouncementFilter filter, Integer page, Integer limit) {
        AnnouncementStatus status = filter.getStatus() == null ? AnnouncementStatus.PUBLISHED : filter.getStatus();
        if (status != AnnouncementStatus.PUBLISHED && (actor == null || !actor.isAdmin())) {
            throw new ForbiddenOperationException(
                    "Only administrators can list announcements in status " + status);
        }

        Specification<Announcement> spec = Specification.where(hasStatus(status))
                .and(filters(filter))
                .and(notOwnedBy(actor == null ? null : actor.getId()));
        return announcementRepository.findAll(spec, pageRequests.newestFirst(page, limit));
    }

    /**
     * The caller's own announcements in any status.
     */
    public Page<Announcement> listMine(CurrentUser actor, AnnouncementFilter filter, Integer page, Integer limit) {
        Specification<Announcement> spec = Specification.where(ownedBy(actor.getId()))
                .and(hasStatus(filter.getStatus()))
                .and(filters(filter));
        return announcementRepository.findAll(spec, pageRequests.newestFirst(page, limit));
    }

    /**
     * Announcements the caller has applied to, whatever the application's status.
     */
    public Page<Announcement> listApplied(CurrentUser actor, AnnouncementFilter filter, Integer page, Integer limit) {
        Specification<Announcement> spec = Specification.where(appliedBy(actor.getId()))
                .and(hasStatus(filter.getStatus()))
                .and(filters(filter));
        return announcementRepository.findAll(spec, pageRequests.newestFirst(page, limit));
    }

    /**
     * Phrase search over published announcements: description, item name and category name.
     *
     * @param query Search phrase, required
     */
    public Page<Announcement> search(CurrentUser actor, String query, AnnouncementFilter filter, Integer page, Integer limit) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("q", "Search query is required");
        }
        Specification<Announcement> spec = Specification.where(hasStatus(AnnouncementStatus.PUBLISHED))
                .and(matchesText(query.trim()))
                .and(filters(filter))
                .and(notOwnedBy(actor == null ? null : actor.getId()));
        return announcementRepository.findAll(spec, pageRequests.newestFirst(page, limit));
    }

    /**
     * Published announcements are visible to everyone; the rest only to their owner and admins.
     */
    public Announcement get(CurrentUser actor, String id) {
        Announcement announcement = announcementRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", id));
        if (announcement.getStatus() == AnnouncementStatus.PUBLISHED) {
            return announcement;
        }
        if (actor != null && (actor.isAdmin() || announcement.isOwnedBy(actor.getId()))) {
            return announcement;
        }
        throw new ResourceNotFoundException("Announcement", id);
    }

    private Specification<Announcement> filters(AnnouncementFilter filter) {
        LocalDate from = DateRules.parseOptional("createdFrom", filter.getCreatedFrom());
        LocalDate to = DateRules.parseOptional("createdTo", filter.getCreatedTo());
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("createdFrom", "createdFrom must not be after createdTo");
        }
        if (filter.getPriceFrom() != null && filter.getPriceTo() != null
                && filter.getPriceFrom().compareTo(filter.getPriceTo()) > 0) {
            throw new ValidationException("priceFrom", "priceFrom must not be greater than priceTo");
        }

        return Specification.where(hasCategoryIn(filter.getCategories()))
                .and(hasType(filter.getType()))
                .and(hasGroupIn(filter.getGroupIds()))
                .and(hasItemIn(filter.getItemIds()))
                .and(inAnyRegion(filter.getRegions()))
                .and(inAnyVillage(filter.getVillages()))
                .and(priceFrom(filter.getPriceFrom()))
                .and(priceTo(filter.getPriceTo()))
                .and(createdFrom(startOfDay(from)))
                // createdTo is inclusive of the whole day
                .and(createdBefore(to == null ? null : startOfDay(to.plusDays(1))));
    }

    private Instant startOfDay(LocalDate date) {
        return date == null ? null : date.atStartOfDay(clock.getZone()).toInstant();
    }
}
