package com.agronet.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read model of a marketplace user. Owned by the identity service; this service only reads it.
 *
 * @author Agronet Marketplace Team
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_region", columnList = "region_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "full_name", length = 255)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", nullable = false, length = 20)
    private UserType userType;

    @Column(name = "verified", nullable = false)
    private boolean verified;

    @Column(name = "is_locked", nullable = false)
    private boolean locked;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_status", nullable = false, length = 20)
    @Builder.Default
    private AccountStatus accountStatus = AccountStatus.ACTIVE;

    @Column(name = "region_id", length = 36)
    private String regionId;

    @Column(name = "village_id", length = 36)
    private String villageId;

    public enum UserType {
        FARMER,
        COMPANY,
        ADMIN
    }

    public enum AccountStatus {
        ACTIVE,
        BLOCKED,
        DEACTIVATED
    }
}
