package com.agronet.marketplace.service.notification;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A notification produced by a lifecycle transition, addressed to one recipient.
 *
 * @author Agronet Marketplace Team
 */
public class NotificationEvent {

    private String eventId;
    private EventType eventType;
    private String recipientId;
    private String title;
    private String body;
    private Map<String, String> data;
    private Instant occurredAt;

    /**
     * Default constructor for deserialization.
     */
    public NotificationEvent() {
    }

    public NotificationEvent(
            EventType eventType,
            String recipientId,
            String title,
            String body,
            Map<String, String> data
    ) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.recipientId = recipientId;
        this.title = title;
        this.body = body;
        this.data = data == null ? new HashMap<>() : new HashMap<>(data);
        this.occurredAt = Instant.now();
    }

    // Getters and setters
    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(String recipientId) {
        this.recipientId = recipientId;
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

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    @Override
    public String toString() {
        return "NotificationEvent{" +
                "eventId='" + eventId + '\'' +
                ", eventType=" + eventType +
                ", recipientId='" + recipientId + '\'' +
                '}';
    }

    /**
     * Lifecycle event types.
     */
    public enum EventType {
        ANNOUNCEMENT_PUBLISHED,
        /**
         * Sent to users in the announcement's regions when it is published.
         */
        ANNOUNCEMENT_PUBLISHED_IN_REGION,
        ANNOUNCEMENT_BLOCKED,
        /**
         * Closed by the owner, an admin or the expiry sweep; {@code closedBy} in the data tells which.
         */
        ANNOUNCEMENT_CLOSED,
        APPLICATION_CREATED,
        APPLICATION_APPROVED,
        APPLICATION_REJECTED,
        APPLICATION_CLOSED
    }
}
