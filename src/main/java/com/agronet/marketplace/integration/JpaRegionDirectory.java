package com.agronet.marketplace.integration;

import com.agronet.marketplace.domain.model.UserAccount.AccountStatus;
import com.agronet.marketplace.repository.UserAccountRepository;
import com.agronet.marketplace.repository.VillageRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * {@link RegionDirectory} backed by the users and villages tables.
 *
 * @author Agronet Marketplace Team
 */
@Component
@Transactional(readOnly = true)
public class JpaRegionDirectory implements RegionDirectory {

    private final UserAccountRepository userAccountRepository;
    private final VillageRepository villageRepository;

    public JpaRegionDirectory(UserAccountRepository userAccountRepository, VillageRepository villageRepository) {
        this.userAccountRepository = userAccountRepository;
        this.villageRepository = villageRepository;
    }

    @Override
    public List<String> usersInRegions(Collection<String> regionIds, boolean verifiedOnly, boolean excludeLocked) {
        if (regionIds == null || regionIds.isEmpty()) {
            return Collections.emptyList();
        }
        return userAccountRepository.findIdsInRegions(regionIds, verifiedOnly, excludeLocked, AccountStatus.ACTIVE);
    }

    @Override
    public boolean villageBelongsToRegion(String villageId, Collection<String> regionIds) {
        if (villageId == null || regionIds == null || regionIds.isEmpty()) {
            return false;
        }
        return villageRepository.existsByIdAndRegionIdIn(villageId, regionIds);
    }
}
