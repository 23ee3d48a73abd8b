package com.agronet.marketplace.api.dto;

/**
 * Response DTO for announcement creation: the announcement plus a message telling
 * the owner whether it was published right away or awaits verification.
 *
 * @author Agronet Marketplace Team
 */
public class CreateAnnouncementResponse {

    private String message;
    private AnnouncementResponse announcement;

    public CreateAnnouncementResponse() {
    }

    public CreateAnnouncementResponse(String message, AnnouncementResponse announcement) {
        this.message = message;
        this.announcement = announcement;
    }

    // Getters and setters
    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public AnnouncementResponse getAnnouncement() {
        return announcement;
    }

    public void setAnnouncement(AnnouncementResponse announcement) {
        this.announcement = announcement;
    }
}
