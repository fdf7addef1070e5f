package com.wtwr.wardrobe.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A clothing item.
 *
 * @param id        24-hex document id; null before the store assigns one
 * @param name      2 to 30 characters
 * @param weather   weather the item suits
 * @param imageUrl  picture of the item
 * @param owner     id of the user who created it
 * @param likes     ids of users who liked it, insertion-ordered, unmodifiable
 * @param createdAt creation time; null before the store assigns one
 */
public record ClothingItem(
        String id, String name, Weather weather, String imageUrl, String owner, Set<String> likes, Instant createdAt) {

    public ClothingItem {
        likes = likes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(likes));
    }

    public static ClothingItem draft(String name, Weather weather, String imageUrl, String owner) {
        return new ClothingItem(null, name, weather, imageUrl, owner, Set.of(), null);
    }

    public boolean isOwnedBy(String userId) {
        return owner != null && owner.equals(userId);
    }

    public ClothingItem stored(String id, Instant createdAt) {
        return new ClothingItem(id, name, weather, imageUrl, owner, likes, createdAt);
    }

    public ClothingItem withLike(String userId) {
        Set<String> next = new LinkedHashSet<>(likes);
        next.add(userId);
        return new ClothingItem(id, name, weather, imageUrl, owner, next, createdAt);
    }

    public ClothingItem withoutLike(String userId) {
        Set<String> next = new LinkedHashSet<>(likes);
        next.remove(userId);
        return new ClothingItem(id, name, weather, imageUrl, owner, next, createdAt);
    }
}
