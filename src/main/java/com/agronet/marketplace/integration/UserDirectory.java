package com.agronet.marketplace.integration;

import java.util.Optional;

/**
 * Lookup of users owned by the identity service.
 *
 * @author Agronet Marketplace Team
 */
public interface UserDirectory {

    Optional<UserProfile> getUser(String userId);
}
