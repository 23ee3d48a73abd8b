package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.UserAccount;
import com.agronet.marketplace.domain.model.UserAccount.AccountStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read-only access to marketplace users.
 *
 * @author Agronet Marketplace Team
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    /**
     * Ids of users living in any of the given regions.
     *
     * @param regionIds Region ids
     * @param verifiedOnly Keep only verified users in {@code status}
     * @param excludeLocked Drop locked accounts
     * @param status Account status required when {@code verifiedOnly} is set
     * @return Matching user ids
     */
    @Query("SELECT u.id FROM UserAccount u WHERE u.regionId IN :regionIds " +
           "AND (:verifiedOnly = false OR (u.verified = true AND u.accountStatus = :status)) " +
           "AND (:excludeLocked = false OR u.locked = false) " +
           "ORDER BY u.id")
    List<String> findIdsInRegions(
            @Param("regionIds") Collection<String> regionIds,
            @Param("verifiedOnly") boolean verifiedOnly,
            @Param("excludeLocked") boolean excludeLocked,
            @Param("status") AccountStatus status
    );
}
