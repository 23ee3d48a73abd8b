package com.agronet.marketplace.repository;

import com.agronet.marketplace.domain.model.Village;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface VillageRepository extends JpaRepository<Village, String> {

    boolean existsByIdAndRegionIdIn(String id, Collection<String> regionIds);
}
