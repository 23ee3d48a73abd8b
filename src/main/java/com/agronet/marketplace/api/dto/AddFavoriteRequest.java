package com.agronet.marketplace.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for adding an announcement to favorites.
 *
 * @author Agronet Marketplace Team
 */
public class AddFavoriteRequest {

    @NotBlank(message = "Announcement ID is required")
    private String announcementId;

    public AddFavoriteRequest() {
    }

    public AddFavoriteRequest(String announcementId) {
        this.announcementId = announcementId;
    }

    public String getAnnouncementId() {
        return announcementId;
    }

    public void setAnnouncementId(String announcementId) {
        this.announcementId = announcementId;
    }
}
