package com.adlanda.recommender.repository;

import com.adlanda.recommender.model.CatalogItem;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the opportunity catalog. The catalog is owned elsewhere;
 * the recommender never writes to it.
 */
public interface CatalogStore {

    List<CatalogItem> getAll();

    Optional<CatalogItem> getById(String id);

    /**
     * The {@code limit} most recently added items, newest first.
     */
    List<CatalogItem> getMostRecent(int limit);

    long count();
}
