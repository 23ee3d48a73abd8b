package com.agronet.marketplace.security;

import lombok.Value;

/**
 * The caller of a lifecycle operation: user id plus whether they act as administrator.
 *
 * @author Agronet Marketplace Team
 */
@Value(staticConstructor = "of")
public class CurrentUser {

    String id;
    boolean admin;

    public static CurrentUser user(String id) {
        return of(id, false);
    }

    public static CurrentUser admin(String id) {
        return of(id, true);
    }
}
