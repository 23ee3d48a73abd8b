package com.agronet.marketplace.integration;

import java.util.Optional;

/**
 * Existence checks and names for catalog categories and items.
 *
 * @author Agronet Marketplace Team
 */
public interface CatalogGate {

    boolean categoryExists(String groupId);

    boolean itemExists(String itemId);

    /**
     * @return display name of the item, if it exists
     */
    Optional<String> itemName(String itemId);
}
