package com.agronet.marketplace.service;

import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Listing filters. Every field is optional; list fields match when any value overlaps.
 * Dates are raw YYYY-MM-DD strings, validated when the query runs.
 *
 * @author Agronet Marketplace Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnouncementFilter {

    private AnnouncementStatus status;
    private List<AnnouncementCategory> categories;
    private AnnouncementType type;
    private List<String> groupIds;
    private List<String> itemIds;
    private List<String> regions;
    private List<String> villages;
    private BigDecimal priceFrom;
    private BigDecimal priceTo;
    private String createdFrom;
    private String createdTo;

    public static AnnouncementFilter empty() {
        return new AnnouncementFilter();
    }
}
