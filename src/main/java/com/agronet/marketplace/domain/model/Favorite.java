package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's bookmark on an announcement. At most one per user and announcement.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "announcement_favorites", uniqueConstraints = {
    @UniqueConstraint(name = "uk_announcement_favorite_user", columnNames = {"announcement_id", "user_id"})
}, indexes = {
    @Index(name = "idx_favorite_user_created", columnList = "user_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Favorite {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "announcement_id", nullable = false, length = 36)
    private String announcementId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
