package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog category (announcement group). Read-only reference data.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "catalog_categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogCategory {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "name_en", length = 255)
    private String nameEn;

    @Column(name = "name_am", length = 255)
    private String nameAm;
}
