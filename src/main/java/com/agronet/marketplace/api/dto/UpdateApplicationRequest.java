package com.agronet.marketplace.api.dto;

import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for editing a pending application. Null fields are left unchanged.
 *
 * @author Agronet Marketplace Team
 */
public class UpdateApplicationRequest {

    private BigDecimal count;
    private List<String> deliveryDates;
    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    public UpdateApplicationRequest() {
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
