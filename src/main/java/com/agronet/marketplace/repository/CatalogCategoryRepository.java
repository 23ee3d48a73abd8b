package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.CatalogCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CatalogCategoryRepository extends JpaRepository<CatalogCategory, String> {
}
