package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per distinct non-owner viewer of an announcement.
 * The unique constraint makes repeated views by the same user a no-op.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "announcement_views", uniqueConstraints = {
    @UniqueConstraint(name = "uk_announcement_view_user", columnNames = {"announcement_id", "user_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnouncementView {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "announcement_id", nullable = false, length = 36)
    private String announcementId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "viewed_at", nullable = false, updatable = false)
    private Instant viewedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (viewedAt == null) {
            viewedAt = Instant.now();
        }
    }
}
