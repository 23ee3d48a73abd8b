package com.agronet.marketplace.api.dto;

import com.agronet.marketplace.domain.model.Notification;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for inbox notifications.
 *
 * @author Agronet Marketplace Team
 */
public class NotificationResponse {

    private String id;
    private String type;
    private String title;
    private String body;
    private Map<String, String> data;
    private boolean seen;
    private Instant seenAt;
    private Instant createdAt;

    public NotificationResponse() {
    }

    /**
     * @param data Structured payload, already decoded
     */
    public static NotificationResponse fromEntity(Notification notification, Map<String, String> data) {
        NotificationResponse response = new NotificationResponse();
        response.setId(notification.getId());
        response.setType(notification.getType());
        response.setTitle(notification.getTitle());
        response.setBody(notification.getBody());
        response.setData(data);
        response.setSeen(Boolean.TRUE.equals(notification.getSeen()));
        response.setSeenAt(notification.getSeenAt());
        response.setCreatedAt(notification.getCreatedAt());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public Map<String, String> getData() {
        return data;
    }

    public void setData(Map<String, String> data) {
        this.data = data;
    }

    public boolean isSeen() {
        return seen;
    }

    public void setSeen(boolean seen) {
        this.seen = seen;
    }

    public Instant getSeenAt() {
        return seenAt;
    }

    public void setSeenAt(Instant seenAt) {
        this.seenAt = seenAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
