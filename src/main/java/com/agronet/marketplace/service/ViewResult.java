package com.agronet.marketplace.service;

import lombok.Value;

/**
 * Outcome of recording a view: whether it counted and the resulting total.
 *
 * @author Agronet Marketplace Team
 */
@Value
public class ViewResult {

    boolean viewed;
    int viewsCount;
}
