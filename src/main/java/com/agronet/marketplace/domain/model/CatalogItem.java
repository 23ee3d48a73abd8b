package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog item an announcement refers to. Read-only reference data.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "catalog_items", indexes = {
    @Index(name = "idx_catalog_item_category", columnList = "category_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItem {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "category_id", length = 36)
    private String categoryId;

    @Column(name = "name_en", length = 255)
    private String nameEn;

    @Column(name = "name_am", length = 255)
    private String nameAm;

    /**
     * English name, falling back to Armenian.
     */
    public String getDisplayName() {
        return nameEn != null && !nameEn.isBlank() ? nameEn : nameAm;
    }
}
