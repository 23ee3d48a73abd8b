package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementType;
import com.agronet.marketplace.domain.model.Application;
import com.agronet.marketplace.domain.model.CatalogCategory;
import com.agronet.marketplace.domain.model.CatalogItem;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;

/**
 * Composable JPA criteria for announcement listings.
 * A null or empty argument yields a no-op specification.
 *
 * @author Agronet Marketplace Team
 */
public final class AnnouncementSpecifications {

    private AnnouncementSpecifications() {
    }

    public static Specification<Announcement> hasStatus(AnnouncementStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<Announcement> hasCategoryIn(Collection<AnnouncementCategory> categories) {
        return (root, query, cb) -> isEmpty(categories) ? null : root.get("category").in(categories);
    }

    public static Specification<Announcement> hasType(AnnouncementType type) {
        return (root, query, cb) -> type == null ? null : cb.equal(root.get("type"), type);
    }

    public static Specification<Announcement> hasGroupIn(Collection<String> groupIds) {
        return (root, query, cb) -> isEmpty(groupIds) ? null : root.get("groupId").in(groupIds);
    }

    public static Specification<Announcement> hasItemIn(Collection<String> itemIds) {
        return (root, query, cb) -> isEmpty(itemIds) ? null : root.get("itemId").in(itemIds);
    }

    public static Specification<Announcement> ownedBy(String ownerId) {
        return (root, query, cb) -> ownerId == null ? null : cb.equal(root.get("ownerId"), ownerId);
    }

    public static Specification<Announcement> notOwnedBy(String userId) {
        return (root, query, cb) -> userId == null ? null : cb.notEqual(root.get("ownerId"), userId);
    }

    /**
     * Announcement lists at least one of the given regions.
     */
    public static Specification<Announcement> inAnyRegion(Collection<String> regionIds) {
        return elementOverlap("regions", regionIds);
    }

    /**
     * Announcement lists at least one of the given villages.
     */
    public static Specification<Announcement> inAnyVillage(Collection<String> villageIds) {
        return elementOverlap("villages", villageIds);
    }

    public static Specification<Announcement> createdFrom(Instant from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    public static Specification<Announcement> createdBefore(Instant to) {
        return (root, query, cb) -> to == null ? null : cb.lessThan(root.get("createdAt"), to);
    }

    public static Specification<Announcement> priceFrom(BigDecimal min) {
        return (root, query, cb) -> min == null ? null : cb.greaterThanOrEqualTo(root.get("price"), min);
    }

    public static Specification<Announcement> priceTo(BigDecimal max) {
        return (root, query, cb) -> max == null ? null : cb.lessThanOrEqualTo(root.get("price"), max);
    }

    /**
     * Announcements the user has submitted at least one application to.
     */
    public static Specification<Announcement> appliedBy(String applicantId) {
        return (root, query, cb) -> {
            Subquery<String> sub = query.subquery(String.class);
            Root<Application> application = sub.from(Application.class);
            sub.select(application.get("announcementId"))
                    .where(cb.equal(application.get("applicantId"), applicantId));
            return root.get("id").in(sub);
        };
    }

    /**
     * Case-insensitive phrase match on description, catalog item name or catalog category name.
     */
    public static Specification<Announcement> matchesText(String phrase) {
        return (root, query, cb) -> {
            if (phrase == null || phrase.isBlank()) {
                return null;
            }
            String pattern = "%" + phrase.trim().toLowerCase(Locale.ROOT) + "%";

            Subquery<String> items = query.subquery(String.class);
            Root<CatalogItem> item = items.from(CatalogItem.class);
            items.select(item.get("id")).where(cb.or(
                    cb.like(cb.lower(item.get("nameEn")), pattern),
                    cb.like(cb.lower(item.get("nameAm")), pattern)));

            Subquery<String> groups = query.subquery(String.class);
            Root<CatalogCategory> group = groups.from(CatalogCategory.class);
            groups.select(group.get("id")).where(cb.or(
                    cb.like(cb.lower(group.get("nameEn")), pattern),
                    cb.like(cb.lower(group.get("nameAm")), pattern)));

            return cb.or(
                    cb.like(cb.lower(root.get("description")), pattern),
                    root.get("itemId").in(items),
                    root.get("groupId").in(groups));
        };
    }

    private static Specification<Announcement> elementOverlap(String attribute, Collection<String> values) {
        return (root, query, cb) -> {
            if (isEmpty(values)) {
                return null;
            }
            Subquery<String> sub = query.subquery(String.class);
            Root<Announcement> inner = sub.from(Announcement.class);
            Join<Announcement, String> element = inner.join(attribute);
            sub.select(inner.get("id"))
                    .where(cb.equal(inner.get("id"), root.get("id")), element.in(values));
            return cb.exists(sub);
        };
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
