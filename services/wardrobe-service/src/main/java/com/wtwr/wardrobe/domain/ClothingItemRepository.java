package com.wtwr.wardrobe.domain;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for {@link ClothingItem} documents. Every method may throw a
 * {@link StorageException}; id-taking methods throw {@link MalformedIdentifierException} for ids
 * that are not 24-hex.
 */
public interface ClothingItemRepository {

    /** Stores a new item and returns it with id and creation time assigned. */
    ClothingItem insert(ClothingItem item);

    /** All items, oldest first. */
    List<ClothingItem> findAll();

    Optional<ClothingItem> findById(String id);

    Optional<ClothingItem> deleteById(String id);

    /** Adds {@code userId} to the like set; a no-op if already present. */
    Optional<ClothingItem> addLike(String id, String userId);

    Optional<ClothingItem> removeLike(String id, String userId);
}
