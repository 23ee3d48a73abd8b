package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Village lookup row. Each village belongs to exactly one region.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "villages", indexes = {
    @Index(name = "idx_village_region", columnList = "region_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Village {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "region_id", nullable = false, length = 36)
    private String regionId;

    @Column(name = "name_en", length = 255)
    private String nameEn;
}
