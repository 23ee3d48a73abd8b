package com.agronet.marketplace.api.dto;

import com.agronet.marketplace.domain.model.Favorite;

import java.time.Instant;

/**
 * Response DTO for a stored favorite.
 *
 * @author Agronet Marketplace Team
 */
public class FavoriteResponse {

    private String id;
    private String announcementId;
    private Instant createdAt;

    public FavoriteResponse() {
    }

    public static FavoriteResponse fromEntity(Favorite favorite) {
        FavoriteResponse response = new FavoriteResponse();
        response.setId(favorite.getId());
        response.setAnnouncementId(favorite.getAnnouncementId());
        response.setCreatedAt(favorite.getCreatedAt());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAnnouncementId() {
        return announcementId;
    }

    public void setAnnouncementId(String announcementId) {
        this.announcementId = announcementId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
