package com.agronet.marketplace.service;

import lombok.Value;

/**
 * Whether the caller has favorited an announcement, and how many users have.
 *
 * @author Agronet Marketplace Team
 */
@Value
public class FavoriteStatus {

    String announcementId;
    boolean favorited;
    long favoriteCount;
}
