package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.CatalogItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CatalogItemRepository extends JpaRepository<CatalogItem, String> {
}
