package com.agronet.marketplace.domain.model;

import com.agronet.marketplace.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Announcement entity: a supply (SELL) or demand (BUY) listing for goods, rent or services.
 *
 * Lifecycle:
 * - PENDING: awaiting admin verification
 * - PUBLISHED: visible and open for applications
 * - CLOSED, CANCELED, BLOCKED: terminal, never re-enter PENDING
 *
 * Goods announcements carry a finite {@code count}; {@code availableQuantity} is the part of it
 * not yet promised to approved applications and is maintained by the quantity ledger.
 * Announcements are never hard-deleted, deletion is a transition to CANCELED.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "announcements", indexes = {
    @Index(name = "idx_announcement_owner", columnList = "owner_id"),
    @Index(name = "idx_announcement_status_category", columnList = "status, category"),
    @Index(name = "idx_announcement_expiry", columnList = "status, expiry_date"),
    @Index(name = "idx_announcement_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Announcement {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 10)
    private AnnouncementType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 10)
    private AnnouncementCategory category;

    /**
     * Catalog category the item belongs to.
     */
    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "owner_id", nullable = false, length = 36)
    private String ownerId;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "description", length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AnnouncementStatus status;

    /**
     * Who closed or blocked the announcement. Null when closed by the expiry sweep.
     */
    @Column(name = "closed_by", length = 36)
    private String closedBy;

    @Column(name = "count", precision = 10, scale = 2)
    private BigDecimal count;

    @Column(name = "daily_limit", precision = 10, scale = 2)
    private BigDecimal dailyLimit;

    /**
     * count minus the sum of APPROVED application counts. Goods only.
     */
    @Column(name = "available_quantity", precision = 10, scale = 2)
    private BigDecimal availableQuantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "unit", length = 10)
    private Unit unit;

    @Column(name = "date_from")
    private LocalDate dateFrom;

    @Column(name = "date_to")
    private LocalDate dateTo;

    @Column(name = "min_area", precision = 10, scale = 2)
    private BigDecimal minArea;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    /**
     * Storage keys, in display order.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "announcement_images", joinColumns = @JoinColumn(name = "announcement_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "image_key", length = 255)
    @BatchSize(size = 50)
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "announcement_regions", joinColumns = @JoinColumn(name = "announcement_id"))
    @Column(name = "region_id", length = 36)
    @BatchSize(size = 50)
    @Builder.Default
    private Set<String> regions = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "announcement_villages", joinColumns = @JoinColumn(name = "announcement_id"))
    @Column(name = "village_id", length = 36)
    @BatchSize(size = 50)
    @Builder.Default
    private Set<String> villages = new LinkedHashSet<>();

    @Column(name = "views_count", nullable = false)
    @Builder.Default
    private Integer viewsCount = 0;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
        if (viewsCount == null) {
            viewsCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isGoods() {
        return category == AnnouncementCategory.GOODS;
    }

    public boolean isRent() {
        return category == AnnouncementCategory.RENT;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    /**
     * Move to the target status, enforcing the transition table.
     *
     * @param target Target status
     * @throws InvalidTransitionException if the move is not allowed from the current status
     */
    public void transitionTo(AnnouncementStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("Announcement", status, target, status.allowedTransitions());
        }
        this.status = target;
    }

    public void publish() {
        transitionTo(AnnouncementStatus.PUBLISHED);
    }

    /**
     * Block on behalf of an administrator.
     *
     * @param adminId Administrator performing the block
     */
    public void block(String adminId) {
        transitionTo(AnnouncementStatus.BLOCKED);
        this.closedBy = adminId;
    }

    /**
     * Close the announcement. Shared by interactive closes and the expiry sweep.
     *
     * @param actorId Closing user, or null for a system close
     */
    public void close(String actorId) {
        transitionTo(AnnouncementStatus.CLOSED);
        this.closedBy = actorId;
    }

    public void cancel() {
        transitionTo(AnnouncementStatus.CANCELED);
    }

    public List<String> getImages() {
        return images == null ? Collections.emptyList() : images;
    }

    /**
     * Announcement type: offering or requesting.
     */
    public enum AnnouncementType {
        SELL,
        BUY
    }

    /**
     * Announcement category. Drives which fields are required.
     */
    public enum AnnouncementCategory {
        /**
         * Finite quantity, tracked by the quantity ledger.
         */
        GOODS,

        /**
         * Rental over a date range.
         */
        RENT,

        SERVICE
    }

    public enum Unit {
        KG,
        TON,
        PCS,
        LITER,
        BAG,
        M2,
        HA
    }

    /**
     * Announcement status with its transition table.
     */
    public enum AnnouncementStatus {
        PENDING,
        PUBLISHED,
        CLOSED,
        CANCELED,
        BLOCKED;

        /**
         * @return statuses reachable from this one in a single step
         */
        public Set<AnnouncementStatus> allowedTransitions() {
            switch (this) {
                case PENDING:
                    return EnumSet.of(PUBLISHED, CLOSED, CANCELED, BLOCKED);
                case PUBLISHED:
                    return EnumSet.of(CLOSED, CANCELED, BLOCKED);
                default:
                    return EnumSet.noneOf(AnnouncementStatus.class);
            }
        }

        public boolean canTransitionTo(AnnouncementStatus target) {
            return allowedTransitions().contains(target);
        }

        public boolean isTerminal() {
            return allowedTransitions().isEmpty();
        }
    }
}
