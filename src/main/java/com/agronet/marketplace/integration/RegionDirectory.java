package com.agronet.marketplace.integration;

import java.util.Collection;
import java.util.List;

/**
 * Region and village lookups used for location validation and region fan-out.
 *
 * @author Agronet Marketplace Team
 */
public interface RegionDirectory {

    /**
     * Users whose home region is any of the given regions.
     *
     * @param regionIds Region ids
     * @param verifiedOnly Only verified, active users
     * @param excludeLocked Drop locked accounts
     * @return Matching user ids, possibly empty
     */
    List<String> usersInRegions(Collection<String> regionIds, boolean verifiedOnly, boolean excludeLocked);

    boolean villageBelongsToRegion(String villageId, Collection<String> regionIds);
}
