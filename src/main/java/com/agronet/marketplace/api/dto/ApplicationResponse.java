package com.agronet.marketplace.api.dto;

import com.agronet.marketplace.domain.model.Application;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for applications.
 *
 * @author Agronet Marketplace Team
 */
public class ApplicationResponse {

    private String id;
    private String announcementId;
    private String applicantId;
    private BigDecimal count;
    private List<LocalDate> deliveryDates;
    private String notes;
    private String status;
    private Instant createdAt;
    private Instant updatedAt;

    public ApplicationResponse() {
    }

    public static ApplicationResponse fromEntity(Application application) {
        ApplicationResponse response = new ApplicationResponse();
        response.setId(application.getId());
        response.setAnnouncementId(application.getAnnouncementId());
        response.setApplicantId(application.getApplicantId());
        response.setCount(application.getCount());
        response.setDeliveryDates(new ArrayList<>(application.getDeliveryDates()));
        response.setNotes(application.getNotes());
        response.setStatus(application.getStatus().name());
        response.setCreatedAt(application.getCreatedAt());
        response.setUpdatedAt(application.getUpdatedAt());
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

    public String getApplicantId() {
        return applicantId;
    }

    public void setApplicantId(String applicantId) {
        this.applicantId = applicantId;
    }

    public BigDecimal getCount() {
        return count;
    }

    public void setCount(BigDecimal count) {
        this.count = count;
    }

    public List<LocalDate> getDeliveryDates() {
        return deliveryDates;
    }

    public void setDeliveryDates(List<LocalDate> deliveryDates) {
        this.deliveryDates = deliveryDates;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
