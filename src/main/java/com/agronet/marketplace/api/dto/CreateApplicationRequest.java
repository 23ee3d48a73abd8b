package com.agronet.marketplace.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for applying to an announcement.
 *
 * @author Agronet Marketplace Team
 */
public class CreateApplicationRequest {

    /**
     * Required for goods announcements, must be absent otherwise.
     */
    private BigDecimal count;

    @NotEmpty(message = "At least one delivery date is required")
    private List<String> deliveryDates;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    public CreateApplicationRequest() {
    }

    // Getters and setters
    public BigDecimal getCount() {
        return count;
    }

    public void setCount(BigDecimal count) {
        this.count = count;
    }

    public List<String> getDeliveryDates() {
        return deliveryDates;
    }

    public void setDeliveryDates(List<String> deliveryDates) {
        this.deliveryDates = deliveryDates;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
