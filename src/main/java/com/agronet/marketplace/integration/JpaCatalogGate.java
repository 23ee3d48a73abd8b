package com.agronet.marketplace.integration;

import com.agronet.marketplace.domain.model.CatalogItem;
import com.agronet.marketplace.repository.CatalogCategoryRepository;
import com.agronet.marketplace.repository.CatalogItemRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * {@link CatalogGate} backed by the catalog tables.
 *
 * @author Agronet Marketplace Team
 */
@Component
@Transactional(readOnly = true)
public class JpaCatalogGate implements CatalogGate {

    private final CatalogCategoryRepository categoryRepository;
    private final CatalogItemRepository itemRepository;

    public JpaCatalogGate(CatalogCategoryRepository categoryRepository, CatalogItemRepository itemRepository) {
        this.categoryRepository = categoryRepository;
        this.itemRepository = itemRepository;
    }

    @Override
    public boolean categoryExists(String groupId) {
        return groupId != null && categoryRepository.existsById(groupId);
    }

    @Override
    public boolean itemExists(String itemId) {
        return itemId != null && itemRepository.existsById(itemId);
    }

    @Override
    public Optional<String> itemName(String itemId) {
        if (itemId == null) {
            return Optional.empty();
        }
        return itemRepository.findById(itemId).map(CatalogItem::getDisplayName);
    }
}
