package com.agronet.marketplace.api.dto;

import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementType;
import com.agronet.marketplace.domain.model.Announcement.Unit;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for creating an announcement.
 * Category-specific rules (count for goods, date range for rent) are checked by the service.
 * Dates are YYYY-MM-DD strings so that impossible dates can be reported precisely.
 *
 * @author Agronet Marketplace Team
 */
public class CreateAnnouncementRequest {

    @NotNull(message = "Type is required")
    private AnnouncementType type;

    @NotNull(message = "Category is required")
    private AnnouncementCategory category;

    @NotBlank(message = "Group ID is required")
    private String groupId;

    @NotBlank(message = "Item ID is required")
    private String itemId;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.00", message = "Price must not be negative")
    @Digits(integer = 10, fraction = 2, message = "Price must have at most 2 decimal places")
    private BigDecimal price;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private BigDecimal count;
    private BigDecimal dailyLimit;
    private Unit unit;
    private String dateFrom;
    private String dateTo;
    private BigDecimal minArea;
    private String expiryDate;
    private List<String> images;
    private List<String> regions;
    private List<String> villages;

    public CreateAnnouncementRequest() {
    }

    // Getters and setters
    public AnnouncementType getType() {
        return type;
    }

    public void setType(AnnouncementType type) {
        this.type = type;
    }

    public AnnouncementCategory getCategory() {
        return category;
    }

    public void setCategory(AnnouncementCategory category) {
        this.category = category;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getCount() {
        return count;
    }

    public void setCount(BigDecimal count) {
        this.count = count;
    }

    public BigDecimal getDailyLimit() {
        return dailyLimit;
    }

    public void setDailyLimit(BigDecimal dailyLimit) {
        this.dailyLimit = dailyLimit;
    }

    public Unit getUnit() {
        return unit;
    }

    public void setUnit(Unit unit) {
        this.unit = unit;
    }

    public String getDateFrom() {
        return dateFrom;
    }

    public void setDateFrom(String dateFrom) {
        this.dateFrom = dateFrom;
    }

    public String getDateTo() {
        return dateTo;
    }

    public void setDateTo(String dateTo) {
        this.dateTo = dateTo;
    }

    public BigDecimal getMinArea() {
        return minArea;
    }

    public void setMinArea(BigDecimal minArea) {
        this.minArea = minArea;
    }

    public String getExpiryDate() {
        return expiryDate;
    }

    public void setExpiryDate(String expiryDate) {
        this.expiryDate = expiryDate;
    }

    public List<String> getImages() {
        return images;
    }

    public void setImages(List<String> images) {
        this.images = images;
    }

    public List<String> getRegions() {
        return regions;
    }

    public void setRegions(List<String> regions) {
        this.regions = regions;
    }

    public List<String> getVillages() {
        return villages;
    }

    public void setVillages(List<String> villages) {
        this.villages = villages;
    }
}
