package com.agronet.marketplace.api.dto;

import com.agronet.marketplace.domain.model.Announcement;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Response DTO for announcements.
 * {@code images} holds display URLs, {@code imageKeys} the storage keys clients send back on update.
 *
 * @author Agronet Marketplace Team
 */
public class AnnouncementResponse {

    private String id;
    private String type;
    private String category;
    private String groupId;
    private String itemId;
    private String ownerId;
    private BigDecimal price;
    private String description;
    private String status;
    private String closedBy;
    private BigDecimal count;
    private BigDecimal dailyLimit;
    private BigDecimal availableQuantity;
    private String unit;
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private BigDecimal minArea;
    private LocalDate expiryDate;
    private List<String> images;
    private List<String> imageKeys;
    private List<String> regions;
    private List<String> villages;
    private Integer viewsCount;
    private Instant createdAt;
    private Instant updatedAt;

    public AnnouncementResponse() {
    }

    /**
     * Create response from Announcement entity.
     *
     * @param announcement Announcement entity
     * @param imageUrlResolver Turns a storage key into a display URL
     * @return AnnouncementResponse
     */
    public static AnnouncementResponse fromEntity(Announcement announcement, Function<String, String> imageUrlResolver) {
        AnnouncementResponse response = new AnnouncementResponse();
        response.setId(announcement.getId());
        response.setType(announcement.getType().name());
        response.setCategory(announcement.getCategory().name());
        response.setGroupId(announcement.getGroupId());
        response.setItemId(announcement.getItemId());
        response.setOwnerId(announcement.getOwnerId());
        response.setPrice(announcement.getPrice());
        response.setDescription(announcement.getDescription());
        response.setStatus(announcement.getStatus().name());
        response.setClosedBy(announcement.getClosedBy());
        response.setCount(announcement.getCount());
        response.setDailyLimit(announcement.getDailyLimit());
        response.setAvailableQuantity(announcement.getAvailableQuantity());
        response.setUnit(announcement.getUnit() == null ? null : announcement.getUnit().name());
        response.setDateFrom(announcement.getDateFrom());
        response.setDateTo(announcement.getDateTo());
        response.setMinArea(announcement.getMinArea());
        response.setExpiryDate(announcement.getExpiryDate());
        response.setImageKeys(new ArrayList<>(announcement.getImages()));
        response.setImages(announcement.getImages().stream().map(imageUrlResolver).collect(Collectors.toList()));
        response.setRegions(new ArrayList<>(announcement.getRegions()));
        response.setVillages(new ArrayList<>(announcement.getVillages()));
        response.setViewsCount(announcement.getViewsCount());
        response.setCreatedAt(announcement.getCreatedAt());
        response.setUpdatedAt(announcement.getUpdatedAt());
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

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
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

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getClosedBy() {
        return closedBy;
    }

    public void setClosedBy(String closedBy) {
        this.closedBy = closedBy;
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

    public BigDecimal getAvailableQuantity() {
        return availableQuantity;
    }

    public void setAvailableQuantity(BigDecimal availableQuantity) {
        this.availableQuantity = availableQuantity;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public LocalDate getDateFrom() {
        return dateFrom;
    }

    public void setDateFrom(LocalDate dateFrom) {
        this.dateFrom = dateFrom;
    }

    public LocalDate getDateTo() {
        return dateTo;
    }

    public void setDateTo(LocalDate dateTo) {
        this.dateTo = dateTo;
    }

    public BigDecimal getMinArea() {
        return minArea;
    }

    public void setMinArea(BigDecimal minArea) {
        this.minArea = minArea;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public void setExpiryDate(LocalDate expiryDate) {
        this.expiryDate = expiryDate;
    }

    public List<String> getImages() {
        return images;
    }

    public void setImages(List<String> images) {
        this.images = images;
    }

    public List<String> getImageKeys() {
        return imageKeys;
    }

    public void setImageKeys(List<String> imageKeys) {
        this.imageKeys = imageKeys;
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

    public Integer getViewsCount() {
        return viewsCount;
    }

    public void setViewsCount(Integer viewsCount) {
        this.viewsCount = viewsCount;
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
