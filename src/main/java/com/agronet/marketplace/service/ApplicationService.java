package com.agronet.marketplace.service;

import com.agronet.marketplace.api.dto.CreateApplicationRequest;
import com.agronet.marketplace.api.dto.UpdateApplicationRequest;
import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Application;
import com.agronet.marketplace.domain.model.Application.ApplicationStatus;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.ForbiddenOperationException;
import com.agronet.marketplace.exception.InvalidTransitionException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.integration.UserDirectory;
import com.agronet.marketplace.integration.UserProfile;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.repository.ApplicationRepository;
import com.agronet.marketplace.security.CurrentUser;
import com.agronet.marketplace.service.notification.LifecycleNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application lifecycle: applying to announcements, owner decisions and applicant self-service.
 *
 * Lock order is always announcement first, then application. Together with the quantity ledger
 * this serializes every change to the approved total of one announcement, so two concurrent
 * approvals can never oversell it.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class ApplicationService {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationService.class);

    private static final String ENTITY = "application";

    private final ApplicationRepository applicationRepository;
    private final AnnouncementRepository announcementRepository;
    private final QuantityLedger quantityLedger;
    private final UserDirectory userDirectory;
    private final LifecycleNotifier lifecycleNotifier;
    private final MarketplaceMetricsService metricsService;
    private final PageRequests pageRequests;
    private final Clock clock;

    public ApplicationService(
            ApplicationRepository applicationRepository,
            AnnouncementRepository announcementRepository,
            QuantityLedger quantityLedger,
            UserDirectory userDirectory,
            LifecycleNotifier lifecycleNotifier,
            MarketplaceMetricsService metricsService,
            PageRequests pageRequests,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.announcementRepository = announcementRepository;
        this.quantityLedger = quantityLedger;
        this.userDirectory = userDirectory;
        this.lifecycleNotifier = lifecycleNotifier;
        this.metricsService = metricsService;
        this.pageRequests = pageRequests;
        this.clock = clock;
    }

    /**
     * Apply to a published announcement.
     *
     * @param actor Applicant
     * @param announcementId Announcement to apply to
     * @param request Count (goods only), delivery dates and notes
     * @return Created PENDING application
     * @throws ConflictException if the applicant already has a pending application here,
     *         or the requested count exceeds what is available
     */
    @Transactional
    public Application create(CurrentUser actor, String announcementId, CreateApplicationRequest request) {
        Announcement announcement = lockAnnouncement(announcementId);

        UserProfile applicant = userDirectory.getUser(actor.getId())
                .orElseThrow(() -> new ResourceNotFoundException("User", actor.getId()));
        if (!applicant.isInGoodStanding()) {
            throw new ForbiddenOperationException("Only verified, unlocked users can apply to announcements");
        }

        if (announcement.getStatus() != AnnouncementStatus.PUBLISHED) {
            throw new ValidationException(String.format(
                    "Can only apply to published announcements (announcement is %s)", announcement.getStatus()));
        }
        if (announcement.isOwnedBy(applicant.getId())) {
            throw new ForbiddenOperationException("You cannot apply to your own announcement");
        }

        List<LocalDate> deliveryDates = parseDeliveryDates(request.getDeliveryDates());
        BigDecimal count = request.getCount();
        if (announcement.isGoods()) {
            assertValidCount(count);
        } else if (count != null) {
            throw new ValidationException("count", "Count is only allowed for goods announcements");
        }

        if (applicationRepository.existsByAnnouncementIdAndApplicantIdAndStatus(
                announcementId, applicant.getId(), ApplicationStatus.PENDING)) {
            throw new ConflictException("You already have a pending application for this announcement");
        }
        if (announcement.isGoods()) {
            quantityLedger.assertAvailable(announcement, count, "apply");
        }

        Application application = Application.builder()
                .announcementId(announcementId)
                .applicantId(applicant.getId())
                .count(count)
                .deliveryDates(deliveryDates)
                .notes(request.getNotes())
                .status(ApplicationStatus.PENDING)
                .build();

        Application saved = applicationRepository.save(application);
        metricsService.recordTransition(ENTITY, ApplicationStatus.PENDING.name());

        logger.info("Application created: id={}, announcement={}, applicant={}, count={}",
                saved.getId(), announcementId, applicant.getId(), count);
        lifecycleNotifier.applicationCreated(saved, announcement, applicant.getDisplayName());
        return saved;
    }

    /**
     * Approve a pending application. For goods the requested count is checked again against the
     * available quantity under the announcement lock, then the ledger is recomputed.
     */
    @Transactional
    public Application approve(CurrentUser actor, String announcementId, String applicationId) {
        Locked locked = lockForOwnerDecision(actor, announcementId, applicationId, "approve");
        Application application = locked.application;
        Announcement announcement = locked.announcement;

        assertCanTransition(application, ApplicationStatus.APPROVED);
        if (announcement.isGoods() && application.getCount() != null) {
            quantityLedger.assertAvailable(announcement, application.getCount(), "approve");
        }

        application.transitionTo(ApplicationStatus.APPROVED);
        Application saved = applicationRepository.save(application);
        if (announcement.isGoods()) {
            quantityLedger.recompute(announcement);
            announcementRepository.save(announcement);
        }
        metricsService.recordTransition(ENTITY, ApplicationStatus.APPROVED.name());

        logger.info("Application approved: id={}, announcement={}, available={}",
                applicationId, announcement.getId(), announcement.getAvailableQuantity());
        lifecycleNotifier.applicationApproved(saved, announcement);
        return saved;
    }

    @Transactional
    public Application reject(CurrentUser actor, String announcementId, String applicationId) {
        Locked locked = lockForOwnerDecision(actor, announcementId, applicationId, "reject");

        locked.application.transitionTo(ApplicationStatus.REJECTED);
        Application saved = applicationRepository.save(locked.application);
        metricsService.recordTransition(ENTITY, ApplicationStatus.REJECTED.name());

        logger.info("Application rejected: id={}, announcement={}", applicationId, locked.announcement.getId());
        lifecycleNotifier.applicationRejected(saved, locked.announcement);
        return saved;
    }

    /**
     * Close an application.
     *
     * The announcement owner may close PENDING or APPROVED applications; closing an approved one
     * returns its count to the available quantity. The applicant may close only their own PENDING
     * application.
     *
     * @param announcementId Expected parent announcement, null when not addressed through it
     */
    @Transactional
    public Application close(CurrentUser actor, String announcementId, String applicationId) {
        Locked locked = lockPair(announcementId, applicationId);
        Application application = locked.application;
        Announcement announcement = locked.announcement;

        boolean byOwner = announcement.isOwnedBy(actor.getId());
        if (!byOwner) {
            if (!application.isSubmittedBy(actor.getId())) {
                throw new ForbiddenOperationException("You cannot close this application");
            }
            if (application.getStatus() != ApplicationStatus.PENDING) {
                throw new ForbiddenOperationException("Applicants can only close their pending applications");
            }
        }

        boolean wasApproved = application.getStatus() == ApplicationStatus.APPROVED;
        application.transitionTo(ApplicationStatus.CLOSED);
        Application saved = applicationRepository.save(application);
        if (wasApproved && announcement.isGoods()) {
            quantityLedger.recompute(announcement);
            announcementRepository.save(announcement);
        }
        metricsService.recordTransition(ENTITY, ApplicationStatus.CLOSED.name());

        logger.info("Application closed: id={}, by={}, wasApproved={}", applicationId, actor.getId(), wasApproved);
        if (byOwner) {
            lifecycleNotifier.applicationClosed(saved, announcement);
        }
        return saved;
    }

    /**
     * Move a REJECTED application back to PENDING at the applicant's request.
     * Subject to the same rules as a new application: one pending per announcement and,
     * for goods, enough available quantity.
     */
    @Transactional
    public Application reopen(CurrentUser actor, String applicationId) {
        Locked locked = lockPair(null, applicationId);
        Application application = locked.application;
        Announcement announcement = locked.announcement;

        if (!application.isSubmittedBy(actor.getId())) {
            throw new ForbiddenOperationException("Only the applicant can reopen an application");
        }
        assertCanTransition(application, ApplicationStatus.PENDING);
        if (announcement.getStatus() != AnnouncementStatus.PUBLISHED) {
            throw new ValidationException(String.format(
                    "Can only reopen applications on published announcements (announcement is %s)",
                    announcement.getStatus()));
        }
        if (applicationRepository.existsByAnnouncementIdAndApplicantIdAndStatus(
                announcement.getId(), actor.getId(), ApplicationStatus.PENDING)) {
            throw new ConflictException("You already have a pending application for this announcement");
        }
        if (announcement.isGoods() && application.getCount() != null) {
            quantityLedger.assertAvailable(announcement, application.getCount(), "reopen");
        }

        application.transitionTo(ApplicationStatus.PENDING);
        Application saved = applicationRepository.save(application);
        metricsService.recordTransition(ENTITY, ApplicationStatus.PENDING.name());

        logger.info("Application reopened: id={}, announcement={}", applicationId, announcement.getId());
        String applicantName = userDirectory.getUser(actor.getId())
                .map(UserProfile::getDisplayName)
                .orElse("A user");
        lifecycleNotifier.applicationCreated(saved, announcement, applicantName);
        return saved;
    }

    /**
     * Edit a pending application. Allowed for the applicant and the announcement owner.
     */
    @Transactional
    public Application edit(CurrentUser actor, String applicationId, UpdateApplicationRequest request) {
        Locked locked = lockPair(null, applicationId);
        Application application = locked.application;
        Announcement announcement = locked.announcement;

        if (!application.isSubmittedBy(actor.getId()) && !announcement.isOwnedBy(actor.getId())) {
            throw new ForbiddenOperationException("You cannot edit this application");
        }
        if (application.getStatus() != ApplicationStatus.PENDING) {
            throw new InvalidTransitionException("Application", application.getStatus(), "edited",
                    EnumSet.of(ApplicationStatus.PENDING));
        }

        List<LocalDate> deliveryDates = request.getDeliveryDates() != null
                ? parseDeliveryDates(request.getDeliveryDates())
                : null;

        if (announcement.isGoods() && request.getCount() != null) {
            assertValidCount(request.getCount());
            quantityLedger.assertAvailable(announcement, request.getCount(), "edit");
            application.setCount(request.getCount());
        }
        if (deliveryDates != null) {
            application.getDeliveryDates().clear();
            application.getDeliveryDates().addAll(deliveryDates);
        }
        if (request.getNotes() != null) {
            application.setNotes(request.getNotes());
        }

        Application saved = applicationRepository.save(application);
        logger.info("Application edited: id={}, by={}", applicationId, actor.getId());
        return saved;
    }

    /**
     * Visible to the applicant, the announcement owner and admins.
     */
    @Transactional(readOnly = true)
    public Application get(CurrentUser actor, String applicationId) {
        Application application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
        if (actor.isAdmin() || application.isSubmittedBy(actor.getId())) {
            return application;
        }
        Announcement announcement = announcementRepository.findById(application.getAnnouncementId())
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", application.getAnnouncementId()));
        if (!announcement.isOwnedBy(actor.getId())) {
            throw new ForbiddenOperationException("You cannot view this application");
        }
        return application;
    }

    /**
     * List applications on an announcement. The owner and admins see all of them,
     * anyone else only their own.
     */
    @Transactional(readOnly = true)
    public Page<Application> listForAnnouncement(CurrentUser actor, String announcementId, Integer page, Integer limit) {
        Announcement announcement = announcementRepository.findById(announcementId)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", announcementId));
        Pageable pageable = pageRequests.newestFirst(page, limit);

        if (actor.isAdmin() || announcement.isOwnedBy(actor.getId())) {
            return applicationRepository.findByAnnouncementId(announcementId, pageable);
        }
        return applicationRepository.findByAnnouncementIdAndApplicantId(announcementId, actor.getId(), pageable);
    }

    /**
     * @param announcementId Optional filter
     */
    @Transactional(readOnly = true)
    public Page<Application> listMine(CurrentUser actor, String announcementId, Integer page, Integer limit) {
        Pageable pageable = pageRequests.newestFirst(page, limit);
        if (announcementId != null && !announcementId.isBlank()) {
            return applicationRepository.findByApplicantIdAndAnnouncementId(actor.getId(), announcementId, pageable);
        }
        return applicationRepository.findByApplicantId(actor.getId(), pageable);
    }

    private Locked lockForOwnerDecision(CurrentUser actor, String announcementId, String applicationId, String action) {
        Locked locked = lockPair(announcementId, applicationId);
        if (!locked.announcement.isOwnedBy(actor.getId())) {
            throw new ForbiddenOperationException(String.format(
                    "Only the announcement owner can %s applications", action));
        }
        return locked;
    }

    /**
     * Lock the parent announcement, then the application.
     *
     * @param expectedAnnouncementId Parent the caller addressed, null to accept any
     */
    private Locked lockPair(String expectedAnnouncementId, String applicationId) {
        String announcementId = applicationRepository.findAnnouncementIdById(applicationId)
                .filter(parent -> expectedAnnouncementId == null || parent.equals(expectedAnnouncementId))
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
        Announcement announcement = announcementRepository.findByIdForUpdate(announcementId)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", announcementId));
        Application application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
        return new Locked(announcement, application);
    }

    private Announcement lockAnnouncement(String announcementId) {
        return announcementRepository.findByIdForUpdate(announcementId)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", announcementId));
    }

    private static void assertCanTransition(Application application, ApplicationStatus target) {
        ApplicationStatus current = application.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException("Application", current, target, current.allowedTransitions());
        }
    }

    private static void assertValidCount(BigDecimal count) {
        if (count == null) {
            throw new ValidationException("count", "Count is required for goods announcements");
        }
        if (count.signum() <= 0) {
            throw new ValidationException("count", "Count must be greater than 0");
        }
    }

    private List<LocalDate> parseDeliveryDates(List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("deliveryDates", "At least one delivery date is required");
        }
        LocalDate today = LocalDate.now(clock);
        Set<LocalDate> dates = new LinkedHashSet<>();
        List<String> past = new ArrayList<>();
        for (String value : values) {
            LocalDate date = DateRules.parse("deliveryDates", value);
            if (date.isBefore(today)) {
                past.add(value);
            }
            dates.add(date);
        }
        if (!past.isEmpty()) {
            throw new ValidationException("deliveryDates",
                    "Delivery dates cannot be in the past: " + String.join(", ", past));
        }
        return dates.stream().collect(Collectors.toCollection(ArrayList::new));
    }

    private static final class Locked {
        final Announcement announcement;
        final Application application;

        Locked(Announcement announcement, Application application) {
            this.announcement = announcement;
            this.application = application;
        }
    }
}
