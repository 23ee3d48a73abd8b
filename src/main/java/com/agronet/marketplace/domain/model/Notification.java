package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * In-app notification inbox entry.
 * Written by the notification consumer after a lifecycle event has been dispatched.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notification_user_seen", columnList = "user_id, is_seen"),
    @Index(name = "idx_notification_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_notification_event_id", columnList = "event_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    /**
     * Id of the dispatched event. Unique, so a redelivered Kafka record is stored once.
     */
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "type", nullable = false, length = 50)
    private String type;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "body", nullable = false, length = 1000)
    private String body;

    /**
     * Event payload as a JSON object of string values.
     */
    @Column(name = "data_json", length = 2000)
    private String dataJson;

    @Column(name = "is_seen", nullable = false)
    @Builder.Default
    private Boolean seen = false;

    @Column(name = "seen_at")
    private Instant seenAt;

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
        if (seen == null) {
            seen = false;
        }
    }

    public void markSeen() {
        if (!Boolean.TRUE.equals(seen)) {
            this.seen = true;
            this.seenAt = Instant.now();
        }
    }
}
