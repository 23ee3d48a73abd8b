package com.agronet.marketplace.api.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Paged list response. {@code page} is 1-based, matching the request parameter.
 *
 * @param <T> Item type
 * @author Agronet Marketplace Team
 */
public class PageResponse<T> {

    private List<T> items;
    private int page;
    private int limit;
    private long total;
    private int totalPages;

    public PageResponse() {
    }

    /**
     * Map a page of entities to a response.
     *
     * @param page Page from the repository
     * @param mapper Entity to DTO mapping
     * @return PageResponse
     */
    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
        PageResponse<T> response = new PageResponse<>();
        response.setItems(page.getContent().stream().map(mapper).collect(Collectors.toList()));
        response.setPage(page.getNumber() + 1);
        response.setLimit(page.getSize());
        response.setTotal(page.getTotalElements());
        response.setTotalPages(page.getTotalPages());
        return response;
    }

    // Getters and setters
    public List<T> getItems() {
        return items;
    }

    public void setItems(List<T> items) {
        this.items = items;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }
}
