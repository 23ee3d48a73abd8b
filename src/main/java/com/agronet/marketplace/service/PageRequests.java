package com.agronet.marketplace.service;

import com.agronet.marketplace.config.MarketplaceProperties;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Builds page requests from the API's 1-based page and limit parameters.
 *
 * @author Agronet Marketplace Team
 */
@Component
public class PageRequests {

    private final int defaultLimit;
    private final int maxLimit;

    public PageRequests(MarketplaceProperties properties) {
        this.defaultLimit = properties.getPagination().getDefaultLimit();
        this.maxLimit = properties.getPagination().getMaxLimit();
    }

    /**
     * @param page 1-based page, null or below 1 means the first page
     * @param limit Page size, null means the default, capped at the configured maximum
     * @param sort Sort order
     * @return Pageable
     */
    public Pageable of(Integer page, Integer limit, Sort sort) {
        int pageNumber = page == null || page < 1 ? 1 : page;
        int size = limit == null || limit < 1 ? defaultLimit : Math.min(limit, maxLimit);
        return PageRequest.of(pageNumber - 1, size, sort);
    }

    public Pageable newestFirst(Integer page, Integer limit) {
        return of(page, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
