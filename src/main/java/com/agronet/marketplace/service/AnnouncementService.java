package com.agronet.marketplace.service;

import com.agronet.marketplace.api.dto.CreateAnnouncementRequest;
import com.agronet.marketplace.api.dto.UpdateAnnouncementRequest;
import com.agronet.marketplace.config.MarketplaceProperties;
import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.AnnouncementView;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.ForbiddenOperationException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.integration.CatalogGate;
import com.agronet.marketplace.integration.ImageStore;
import com.agronet.marketplace.integration.RegionDirectory;
import com.agronet.marketplace.integration.UserDirectory;
import com.agronet.marketplace.integration.UserProfile;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.repository.AnnouncementViewRepository;
import com.agronet.marketplace.security.CurrentUser;
import com.agronet.marketplace.service.notification.LifecycleNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Announcement lifecycle: creation, editing and every status transition.
 *
 * Every mutating method loads the announcement with a pessimistic write lock
 * ({@code findByIdForUpdate}), validates, then writes in the same transaction.
 * Notifications go through {@link LifecycleNotifier} and are dispatched only after commit.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class AnnouncementService {

    private static final Logger logger = LoggerFactory.getLogger(AnnouncementService.class);

    private static final BigDecimal MAX_COUNT = new BigDecimal("999999");

    private static final String ENTITY = "announcement";

    private final AnnouncementRepository announcementRepository;
    private final AnnouncementViewRepository viewRepository;
    private final QuantityLedger quantityLedger;
    private final UserDirectory userDirectory;
    private final CatalogGate catalogGate;
    private final RegionDirectory regionDirectory;
    private final ImageStore imageStore;
    private final LifecycleNotifier lifecycleNotifier;
    private final MarketplaceMetricsService metricsService;
    private final MarketplaceProperties properties;
    private final Clock clock;

    public AnnouncementService(
            AnnouncementRepository announcementRepository,
            AnnouncementViewRepository viewRepository,
            QuantityLedger quantityLedger,
            UserDirectory userDirectory,
            CatalogGate catalogGate,
            RegionDirectory regionDirectory,
            ImageStore imageStore,
            LifecycleNotifier lifecycleNotifier,
            MarketplaceMetricsService metricsService,
            MarketplaceProperties properties,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.viewRepository = viewRepository;
        this.quantityLedger = quantityLedger;
        this.userDirectory = userDirectory;
        this.catalogGate = catalogGate;
        this.regionDirectory = regionDirectory;
        this.imageStore = imageStore;
        this.lifecycleNotifier = lifecycleNotifier;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create an announcement.
     *
     * Goods announcements without description and images are published immediately;
     * everything else waits in PENDING for admin verification.
     *
     * @param actor Creating user
     * @param request Announcement fields
     * @param uploads Image files to store, may be empty
     * @return Created announcement
     * @throws ResourceNotFoundException if the user, category or item does not exist
     * @throws ForbiddenOperationException if the user may not create announcements
     * @throws ValidationException if a field rule is violated
     */
    @Transactional
    public Announcement create(CurrentUser actor, CreateAnnouncementRequest request, List<ImageUpload> uploads) {
        UserProfile owner = userDirectory.getUser(actor.getId())
                .orElseThrow(() -> new ResourceNotFoundException("User", actor.getId()));
        assertCanCreate(owner);

        LocalDate today = LocalDate.now(clock);
        AnnouncementCategory category = request.getCategory();

        CategoryFields fields = new CategoryFields(
                request.getCount(),
                request.getDailyLimit(),
                request.getUnit(),
                DateRules.parseOptional("dateFrom", request.getDateFrom()),
                DateRules.parseOptional("dateTo", request.getDateTo()),
                request.getMinArea());
        fields.validate(category);
        fields.clearInapplicable(category);

        LocalDate expiryDate = DateRules.parseOptional("expiryDate", request.getExpiryDate());
        assertNotPast("expiryDate", expiryDate, today);

        List<String> imageKeys = normalize(request.getImages());
        List<ImageUpload> files = uploads == null ? Collections.emptyList() : uploads;
        assertImageCount(imageKeys.size() + files.size());
        validateUploads(files);

        Set<String> regions = new LinkedHashSet<>(normalize(request.getRegions()));
        Set<String> villages = new LinkedHashSet<>(normalize(request.getVillages()));
        validateVillages(regions, villages);

        assertCatalog(request.getGroupId(), request.getItemId());

        imageKeys.addAll(uploadImages(owner.getId(), files));

        boolean hasDescription = request.getDescription() != null && !request.getDescription().isBlank();
        AnnouncementStatus initialStatus = category == AnnouncementCategory.GOODS && !hasDescription && imageKeys.isEmpty()
                ? AnnouncementStatus.PUBLISHED
                : AnnouncementStatus.PENDING;

        if (expiryDate == null) {
            expiryDate = fields.dateTo != null
                    ? fields.dateTo
                    : today.plusDays(properties.getAnnouncements().getDefaultExpiryDays());
        }

        Announcement announcement = Announcement.builder()
                .type(request.getType())
                .category(category)
                .groupId(request.getGroupId())
                .itemId(request.getItemId())
                .ownerId(owner.getId())
                .price(request.getPrice())
                .description(hasDescription ? request.getDescription() : null)
                .status(initialStatus)
                .count(fields.count)
                .dailyLimit(fields.dailyLimit)
                .availableQuantity(fields.count)
                .unit(fields.unit)
                .dateFrom(fields.dateFrom)
                .dateTo(fields.dateTo)
                .minArea(fields.minArea)
                .expiryDate(expiryDate)
                .images(imageKeys)
                .regions(regions)
                .villages(villages)
                .build();

        Announcement saved = announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, initialStatus.name());

        logger.info("Announcement created: id={}, owner={}, category={}, status={}",
                saved.getId(), saved.getOwnerId(), category, initialStatus);
        return saved;
    }

    /**
     * Update an announcement.
     *
     * Admins may always edit. Owners may edit freely while PENDING; once PUBLISHED only the
     * expiry date may change, and terminal announcements cannot be edited at all.
     *
     * @param actor Editing user
     * @param id Announcement ID
     * @param request Fields to change, null fields are left unchanged
     * @param uploads Image files to append, may be empty
     * @return Updated announcement
     */
    @Transactional
    public Announcement update(CurrentUser actor, String id, UpdateAnnouncementRequest request, List<ImageUpload> uploads) {
        if (request.getStatus() != null) {
            rejectStatusField(request.getStatus());
        }

        Announcement announcement = lockAnnouncement(id);
        boolean owner = announcement.isOwnedBy(actor.getId());
        if (!actor.isAdmin() && !owner) {
            throw new ForbiddenOperationException("You can only edit your own announcements");
        }
        if (!actor.isAdmin() && announcement.getStatus().isTerminal()) {
            throw new ForbiddenOperationException(String.format(
                    "Announcement in status %s can no longer be edited", announcement.getStatus()));
        }

        LocalDate today = LocalDate.now(clock);
        List<ImageUpload> files = uploads == null ? Collections.emptyList() : uploads;
        LocalDate requestedFrom = DateRules.parseOptional("dateFrom", request.getDateFrom());
        LocalDate requestedTo = DateRules.parseOptional("dateTo", request.getDateTo());
        LocalDate requestedExpiry = DateRules.parseOptional("expiryDate", request.getExpiryDate());

        Set<String> changed = changedFields(announcement, request, requestedFrom, requestedTo, requestedExpiry, files);
        if (changed.isEmpty()) {
            logger.debug("Update of announcement {} changes nothing", id);
            return announcement;
        }

        if (!actor.isAdmin() && announcement.getStatus() == AnnouncementStatus.PUBLISHED) {
            Set<String> forbidden = new LinkedHashSet<>(changed);
            forbidden.remove("expiryDate");
            if (!forbidden.isEmpty()) {
                throw new ForbiddenOperationException(String.format(
                        "Published announcements can only have their expiry date changed (attempted: %s)",
                        String.join(", ", forbidden)));
            }
        }

        if (changed.contains("category")) {
            throw new ValidationException("category", "Category cannot be changed after creation");
        }

        AnnouncementCategory category = announcement.getCategory();
        CategoryFields fields = new CategoryFields(
                firstNonNull(request.getCount(), announcement.getCount()),
                firstNonNull(request.getDailyLimit(), announcement.getDailyLimit()),
                firstNonNull(request.getUnit(), announcement.getUnit()),
                firstNonNull(requestedFrom, announcement.getDateFrom()),
                firstNonNull(requestedTo, announcement.getDateTo()),
                firstNonNull(request.getMinArea(), announcement.getMinArea()));
        fields.validate(category);
        fields.clearInapplicable(category);

        if (changed.contains("count") && fields.count != null) {
            BigDecimal approved = quantityLedger.approvedTotal(announcement);
            if (fields.count.compareTo(approved) < 0) {
                throw new ConflictException(String.format(
                        "Count %s is lower than the quantity already approved (%s)",
                        fields.count.toPlainString(), approved.toPlainString()));
            }
        }

        if (requestedExpiry != null) {
            assertNotPast("expiryDate", requestedExpiry, today);
        }

        if (changed.contains("groupId") || changed.contains("itemId")) {
            assertCatalog(firstNonNull(request.getGroupId(), announcement.getGroupId()),
                    firstNonNull(request.getItemId(), announcement.getItemId()));
        }

        Set<String> regions = request.getRegions() != null
                ? new LinkedHashSet<>(normalize(request.getRegions()))
                : new LinkedHashSet<>(announcement.getRegions());
        Set<String> villages = request.getVillages() != null
                ? new LinkedHashSet<>(normalize(request.getVillages()))
                : new LinkedHashSet<>(announcement.getVillages());
        if (changed.contains("regions") || changed.contains("villages")) {
            validateVillages(regions, villages);
        }

        List<String> removedImages = Collections.emptyList();
        if (changed.contains("images")) {
            List<String> imageKeys = request.getImages() != null ? normalize(request.getImages()) : new ArrayList<>();
            assertImageCount(imageKeys.size() + files.size());
            validateUploads(files);
            imageKeys.addAll(uploadImages(announcement.getOwnerId(), files));

            removedImages = announcement.getImages().stream()
                    .filter(key -> !imageKeys.contains(key))
                    .collect(Collectors.toList());
            announcement.getImages().clear();
            announcement.getImages().addAll(imageKeys);
        }

        if (request.getType() != null) {
            announcement.setType(request.getType());
        }
        if (request.getGroupId() != null) {
            announcement.setGroupId(request.getGroupId());
        }
        if (request.getItemId() != null) {
            announcement.setItemId(request.getItemId());
        }
        if (request.getPrice() != null) {
            announcement.setPrice(request.getPrice());
        }
        if (request.getDescription() != null) {
            announcement.setDescription(request.getDescription().isBlank() ? null : request.getDescription());
        }
        announcement.setCount(fields.count);
        announcement.setDailyLimit(fields.dailyLimit);
        announcement.setUnit(fields.unit);
        announcement.setDateFrom(fields.dateFrom);
        announcement.setDateTo(fields.dateTo);
        announcement.setMinArea(fields.minArea);

        if (requestedExpiry != null) {
            announcement.setExpiryDate(requestedExpiry);
        } else if (category == AnnouncementCategory.RENT && changed.contains("dateTo")) {
            // A rental's expiry follows its end date unless set explicitly
            announcement.setExpiryDate(fields.dateTo);
        }

        if (request.getRegions() != null) {
            announcement.getRegions().clear();
            announcement.getRegions().addAll(regions);
        }
        if (request.getVillages() != null) {
            announcement.getVillages().clear();
            announcement.getVillages().addAll(villages);
        }

        if (changed.contains("count")) {
            quantityLedger.recompute(announcement);
        }

        Announcement saved = announcementRepository.save(announcement);
        deleteImagesAfterCommit(removedImages);

        logger.info("Announcement updated: id={}, by={}, fields={}", id, actor.getId(), changed);
        return saved;
    }

    /**
     * Publish a PENDING announcement after admin verification.
     * Notifies the owner and fans out to users in the announcement's regions.
     */
    @Transactional
    public Announcement publish(CurrentUser actor, String id) {
        requireAdmin(actor, "publish announcements");
        Announcement announcement = lockAnnouncement(id);

        announcement.publish();
        Announcement saved = announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, AnnouncementStatus.PUBLISHED.name());

        logger.info("Announcement published: id={}, admin={}", id, actor.getId());
        lifecycleNotifier.announcementPublished(saved);
        return saved;
    }

    /**
     * Block a non-terminal announcement. Records the admin in {@code closedBy}.
     */
    @Transactional
    public Announcement block(CurrentUser actor, String id) {
        requireAdmin(actor, "block announcements");
        Announcement announcement = lockAnnouncement(id);

        announcement.block(actor.getId());
        Announcement saved = announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, AnnouncementStatus.BLOCKED.name());

        logger.info("Announcement blocked: id={}, admin={}", id, actor.getId());
        lifecycleNotifier.announcementBlocked(saved);
        return saved;
    }

    /**
     * Close an announcement on behalf of its owner or an admin.
     */
    @Transactional
    public Announcement close(CurrentUser actor, String id) {
        Announcement announcement = lockAnnouncement(id);
        if (!actor.isAdmin() && !announcement.isOwnedBy(actor.getId())) {
            throw new ForbiddenOperationException("Only the owner or an administrator can close this announcement");
        }

        announcement.close(actor.getId());
        Announcement saved = announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, AnnouncementStatus.CLOSED.name());

        logger.info("Announcement closed: id={}, by={}", id, actor.getId());
        lifecycleNotifier.announcementClosed(saved);
        return saved;
    }

    @Transactional
    public Announcement cancel(CurrentUser actor, String id) {
        Announcement announcement = lockAnnouncement(id);
        if (!announcement.isOwnedBy(actor.getId())) {
            throw new ForbiddenOperationException("Only the owner can cancel this announcement");
        }

        announcement.cancel();
        Announcement saved = announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, AnnouncementStatus.CANCELED.name());

        logger.info("Announcement canceled: id={}, owner={}", id, actor.getId());
        return saved;
    }

    /**
     * Soft-delete: moves the announcement to CANCELED. Published announcements must be canceled
     * explicitly first. Deleting an already canceled announcement is a no-op.
     */
    @Transactional
    public void delete(CurrentUser actor, String id) {
        Announcement announcement = lockAnnouncement(id);
        if (!announcement.isOwnedBy(actor.getId())) {
            throw new ForbiddenOperationException("You can only delete your own announcements");
        }
        if (announcement.getStatus() == AnnouncementStatus.PUBLISHED) {
            throw new ForbiddenOperationException("Published announcements cannot be deleted. Please cancel it first");
        }
        if (announcement.getStatus() == AnnouncementStatus.CANCELED) {
            return;
        }

        announcement.cancel();
        announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, AnnouncementStatus.CANCELED.name());
        logger.info("Announcement deleted (canceled): id={}, owner={}", id, actor.getId());
    }

    /**
     * Close an expired announcement on behalf of the expiry sweep.
     * Re-checks eligibility under the row lock, so a second call for the same announcement does nothing.
     *
     * @param id Announcement ID
     * @param today Current date in the marketplace time zone
     * @return true if the announcement was closed by this call
     */
    @Transactional
    public boolean closeBySystem(String id, LocalDate today) {
        Announcement announcement = announcementRepository.findByIdForUpdate(id).orElse(null);
        if (announcement == null) {
            logger.warn("Expired announcement {} no longer exists", id);
            return false;
        }
        if (announcement.getStatus() != AnnouncementStatus.PUBLISHED || !isExpired(announcement, today)) {
            logger.debug("Announcement {} no longer eligible for expiry (status={})", id, announcement.getStatus());
            return false;
        }

        announcement.close(null);
        announcementRepository.save(announcement);
        metricsService.recordTransition(ENTITY, AnnouncementStatus.CLOSED.name());

        logger.info("Announcement expired and closed: id={}, category={}", id, announcement.getCategory());
        lifecycleNotifier.announcementExpired(announcement);
        return true;
    }

    /**
     * Count a view by a non-owner. Each user counts once per announcement.
     *
     * @return whether this call counted and the resulting total
     */
    @Transactional
    public ViewResult recordView(CurrentUser actor, String id) {
        Announcement announcement = lockAnnouncement(id);
        if (announcement.getStatus() != AnnouncementStatus.PUBLISHED) {
            throw new ValidationException("Only published announcements can be viewed");
        }
        if (announcement.isOwnedBy(actor.getId())
                || viewRepository.existsByAnnouncementIdAndUserId(id, actor.getId())) {
            return new ViewResult(false, announcement.getViewsCount());
        }

        viewRepository.save(AnnouncementView.builder()
                .announcementId(id)
                .userId(actor.getId())
                .build());
        announcement.setViewsCount(announcement.getViewsCount() + 1);
        announcementRepository.save(announcement);
        return new ViewResult(true, announcement.getViewsCount());
    }

    static boolean isExpired(Announcement announcement, LocalDate today) {
        boolean rentalEnded = announcement.isRent()
                && announcement.getDateTo() != null
                && announcement.getDateTo().isBefore(today);
        boolean pastExpiry = announcement.getExpiryDate() != null && announcement.getExpiryDate().isBefore(today);
        return rentalEnded || pastExpiry;
    }

    private Announcement lockAnnouncement(String id) {
        return announcementRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement", id));
    }

    private static void requireAdmin(CurrentUser actor, String action) {
        if (!actor.isAdmin()) {
            throw new ForbiddenOperationException("Only administrators can " + action);
        }
    }

    private static void assertCanCreate(UserProfile user) {
        if (!user.isVerified()) {
            throw new ForbiddenOperationException("Only verified users can create announcements");
        }
        if (user.isLocked() || user.isBlocked()) {
            throw new ForbiddenOperationException("Your account is locked or blocked");
        }
        if (!user.canPublishAnnouncements()) {
            throw new ForbiddenOperationException("Only farmers and companies can create announcements");
        }
    }

    private static void rejectStatusField(String status) {
        String validValues = Arrays.stream(AnnouncementStatus.values())
                .map(Enum::name)
                .collect(Collectors.joining(", "));
        boolean known = Arrays.stream(AnnouncementStatus.values()).anyMatch(s -> s.name().equalsIgnoreCase(status));
        String prefix = known ? "" : String.format("Invalid status '%s'. Valid values: %s. ", status, validValues);
        throw new ValidationException("status", prefix
                + "Status cannot be changed by updating the announcement. "
                + "Use the dedicated endpoints: /publish, /block, /close, /cancel");
    }

    private void assertCatalog(String groupId, String itemId) {
        if (!catalogGate.categoryExists(groupId)) {
            throw new ResourceNotFoundException("Category", groupId);
        }
        if (!catalogGate.itemExists(itemId)) {
            throw new ResourceNotFoundException("Item", itemId);
        }
    }

    private void validateVillages(Collection<String> regions, Collection<String> villages) {
        if (villages.isEmpty()) {
            return;
        }
        if (regions.isEmpty()) {
            throw new ValidationException("villages", "Villages can only be given together with their regions");
        }
        for (String villageId : villages) {
            if (!regionDirectory.villageBelongsToRegion(villageId, regions)) {
                throw new ValidationException("villages", String.format(
                        "Village %s does not belong to any of the selected regions", villageId));
            }
        }
    }

    private void assertImageCount(int total) {
        int max = properties.getAnnouncements().getMaxImages();
        if (total > max) {
            throw new ValidationException("images", String.format("At most %d images are allowed, got %d", max, total));
        }
    }

    private void validateUploads(List<ImageUpload> files) {
        MarketplaceProperties.Images settings = properties.getImages();
        for (ImageUpload file : files) {
            if (file.size() == 0) {
                throw new ValidationException("images", "Image file " + file.getFileName() + " is empty");
            }
            if (file.size() > settings.getMaxSizeBytes()) {
                throw new ValidationException("images", String.format(
                        "Image file %s exceeds the maximum size of %d bytes", file.getFileName(), settings.getMaxSizeBytes()));
            }
            if (file.getContentType() == null || !settings.getAllowedContentTypes().contains(file.getContentType())) {
                throw new ValidationException("images", String.format(
                        "Unsupported image type %s. Allowed: %s",
                        file.getContentType(), String.join(", ", settings.getAllowedContentTypes())));
            }
        }
    }

    /**
     * Upload files and arrange for them to be removed again if the transaction rolls back.
     */
    private List<String> uploadImages(String ownerId, List<ImageUpload> files) {
        if (files.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>();
        for (ImageUpload file : files) {
            keys.add(imageStore.upload(ownerId, file.getFileName(), file.getContent(), file.getContentType()));
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        logger.info("Removing {} uploaded images after rollback", keys.size());
                        keys.forEach(imageStore::delete);
                    }
                }
            });
        }
        return keys;
    }

    private void deleteImagesAfterCommit(List<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    keys.forEach(imageStore::delete);
                }
            });
        } else {
            keys.forEach(imageStore::delete);
        }
    }

    private static Set<String> changedFields(
            Announcement current,
            UpdateAnnouncementRequest request,
            LocalDate dateFrom,
            LocalDate dateTo,
            LocalDate expiryDate,
            List<ImageUpload> uploads
    ) {
        Set<String> changed = new LinkedHashSet<>();
        markIfDiffers(changed, "type", request.getType(), current.getType());
        markIfDiffers(changed, "category", request.getCategory(), current.getCategory());
        markIfDiffers(changed, "groupId", request.getGroupId(), current.getGroupId());
        markIfDiffers(changed, "itemId", request.getItemId(), current.getItemId());
        markIfDiffers(changed, "price", request.getPrice(), current.getPrice());
        markIfDiffers(changed, "description", request.getDescription(), current.getDescription());
        markIfDiffers(changed, "count", request.getCount(), current.getCount());
        markIfDiffers(changed, "dailyLimit", request.getDailyLimit(), current.getDailyLimit());
        markIfDiffers(changed, "unit", request.getUnit(), current.getUnit());
        markIfDiffers(changed, "dateFrom", dateFrom, current.getDateFrom());
        markIfDiffers(changed, "dateTo", dateTo, current.getDateTo());
        markIfDiffers(changed, "minArea", request.getMinArea(), current.getMinArea());
        markIfDiffers(changed, "expiryDate", expiryDate, current.getExpiryDate());
        if (request.getRegions() != null) {
            markIfDiffers(changed, "regions", new LinkedHashSet<>(normalize(request.getRegions())), current.getRegions());
        }
        if (request.getVillages() != null) {
            markIfDiffers(changed, "villages", new LinkedHashSet<>(normalize(request.getVillages())), current.getVillages());
        }
        if (!uploads.isEmpty()) {
            changed.add("images");
        } else if (request.getImages() != null) {
            markIfDiffers(changed, "images", normalize(request.getImages()), current.getImages());
        }
        return changed;
    }

    private static void markIfDiffers(Set<String> changed, String field, Object requested, Object current) {
        if (requested == null) {
            return;
        }
        boolean differs;
        if (requested instanceof BigDecimal && current instanceof BigDecimal) {
            differs = ((BigDecimal) requested).compareTo((BigDecimal) current) != 0;
        } else if (requested instanceof Set && current instanceof Collection) {
            differs = !requested.equals(new LinkedHashSet<>((Collection<?>) current));
        } else if (requested instanceof List && current instanceof Collection) {
            differs = !requested.equals(new ArrayList<>((Collection<?>) current));
        } else {
            differs = !Objects.equals(requested, current);
        }
        if (differs) {
            changed.add(field);
        }
    }

    private static void assertNotPast(String field, LocalDate date, LocalDate today) {
        if (date != null && date.isBefore(today)) {
            throw new ValidationException(field, field + " cannot be in the past");
        }
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    /**
     * The category-dependent fields of an announcement, validated together.
     */
    private static final class CategoryFields {
        BigDecimal count;
        BigDecimal dailyLimit;
        Announcement.Unit unit;
        LocalDate dateFrom;
        LocalDate dateTo;
        BigDecimal minArea;

        CategoryFields(BigDecimal count, BigDecimal dailyLimit, Announcement.Unit unit,
                       LocalDate dateFrom, LocalDate dateTo, BigDecimal minArea) {
            this.count = count;
            this.dailyLimit = dailyLimit;
            this.unit = unit;
            this.dateFrom = dateFrom;
            this.dateTo = dateTo;
            this.minArea = minArea;
        }

        void validate(AnnouncementCategory category) {
            switch (category) {
                case GOODS:
                    if (count == null) {
                        throw new ValidationException("count", "Count is required for goods announcements");
                    }
                    if (count.signum() <= 0) {
                        throw new ValidationException("count", "Count must be greater than 0");
                    }
                    if (count.compareTo(MAX_COUNT) > 0) {
                        throw new ValidationException("count", "Count must not exceed " + MAX_COUNT.toPlainString());
                    }
                    if (dailyLimit != null && dailyLimit.signum() <= 0) {
                        throw new ValidationException("dailyLimit", "Daily limit must be greater than 0");
                    }
                    if (dailyLimit != null && dailyLimit.compareTo(count) > 0) {
                        throw new ValidationException("dailyLimit", "Daily limit cannot exceed count");
                    }
                    break;
                case RENT:
                    if (dateFrom == null) {
                        throw new ValidationException("dateFrom", "dateFrom is required for rent announcements");
                    }
                    if (dateTo == null) {
                        throw new ValidationException("dateTo", "dateTo is required for rent announcements");
                    }
                    if (!dateFrom.isBefore(dateTo)) {
                        throw new ValidationException("dateFrom", "dateFrom must be before dateTo");
                    }
                    if (minArea != null && minArea.signum() <= 0) {
                        throw new ValidationException("minArea", "Minimum area must be greater than 0");
                    }
                    break;
                default:
                    break;
            }
        }

        void clearInapplicable(AnnouncementCategory category) {
            if (category != AnnouncementCategory.GOODS) {
                count = null;
                dailyLimit = null;
                unit = null;
            }
            if (category != AnnouncementCategory.RENT) {
                dateFrom = null;
                dateTo = null;
                minArea = null;
            }
        }
    }
}
