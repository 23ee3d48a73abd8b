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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Application entity: a user's offer to fulfil an announcement.
 *
 * Status transitions:
 * - PENDING -> APPROVED, REJECTED, CLOSED
 * - APPROVED -> CLOSED
 * - REJECTED -> PENDING (reopen)
 * - CLOSED is terminal
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "applications", indexes = {
    @Index(name = "idx_application_announcement_status", columnList = "announcement_id, status"),
    @Index(name = "idx_application_applicant", columnList = "applicant_id"),
    @Index(name = "idx_application_announcement_applicant", columnList = "announcement_id, applicant_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Application {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "announcement_id", nullable = false, length = 36)
    private String announcementId;

    @Column(name = "applicant_id", nullable = false, length = 36)
    private String applicantId;

    /**
     * Requested quantity. Present only for goods announcements.
     */
    @Column(name = "count", precision = 10, scale = 2)
    private BigDecimal count;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "application_delivery_dates", joinColumns = @JoinColumn(name = "application_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "delivery_date", nullable = false)
    @BatchSize(size = 50)
    @Builder.Default
    private List<LocalDate> deliveryDates = new ArrayList<>();

    @Column(name = "notes", length = 1000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApplicationStatus status;

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
        if (status == null) {
            status = ApplicationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isSubmittedBy(String userId) {
        return applicantId != null && applicantId.equals(userId);
    }

    /**
     * Move to the target status, enforcing the transition table.
     *
     * @param target Target status
     * @throws InvalidTransitionException if the move is not allowed from the current status
     */
    public void transitionTo(ApplicationStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("Application", status, target, status.allowedTransitions());
        }
        this.status = target;
    }

    /**
     * Application status with its transition table.
     */
    public enum ApplicationStatus {
        PENDING,
        APPROVED,
        REJECTED,
        CLOSED;

        public Set<ApplicationStatus> allowedTransitions() {
            switch (this) {
                case PENDING:
                    return EnumSet.of(APPROVED, REJECTED, CLOSED);
                case APPROVED:
                    return EnumSet.of(CLOSED);
                case REJECTED:
                    return EnumSet.of(PENDING);
                default:
                    return EnumSet.noneOf(ApplicationStatus.class);
            }
        }

        public boolean canTransitionTo(ApplicationStatus target) {
            return allowedTransitions().contains(target);
        }
    }
}
