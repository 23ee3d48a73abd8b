package com.agronet.marketplace.integration;

import com.agronet.marketplace.domain.model.UserAccount.AccountStatus;
import com.agronet.marketplace.domain.model.UserAccount.UserType;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the user attributes the lifecycle rules depend on.
 *
 * @author Agronet Marketplace Team
 */
@Value
@Builder
public class UserProfile {

    String id;
    String fullName;
    UserType userType;
    boolean verified;
    boolean locked;
    AccountStatus accountStatus;
    String regionId;

    public boolean isBlocked() {
        return accountStatus == AccountStatus.BLOCKED;
    }

    /**
     * @return true if the user may take part in the marketplace at all
     */
    public boolean isInGoodStanding() {
        return verified && !locked && !isBlocked();
    }

    public boolean canPublishAnnouncements() {
        return userType == UserType.FARMER || userType == UserType.COMPANY;
    }

    public String getDisplayName() {
        return fullName == null || fullName.isBlank() ? "A user" : fullName;
    }
}
