package com.wtwr.wardrobe.infrastructure.storage;

import static com.wtwr.wardrobe.infrastructure.storage.InMemoryUserRepository.requireId;

import com.wtwr.common.ObjectIds;
import com.wtwr.wardrobe.domain.ClothingItem;
import com.wtwr.wardrobe.domain.ClothingItemRepository;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Document-store stand-in for clothing items. */
@Repository
public class InMemoryClothingItemRepository implements ClothingItemRepository {

    private final Map<String, ClothingItem> byId = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryClothingItemRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ClothingItem insert(ClothingItem item) {
        StoreSchema.requireLength("name", item.name(), 2, 30);
        StoreSchema.requirePresent("weather", item.weather());
        StoreSchema.requireUrl("imageUrl", item.imageUrl());
        StoreSchema.requirePresent("owner", item.owner());

        ClothingItem stored = item.stored(ObjectIds.generate(), clock.instant());
        byId.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<ClothingItem> findAll() {
        return byId.values().stream()
                .sorted(Comparator.comparing(ClothingItem::createdAt).thenComparing(ClothingItem::id))
                .toList();
    }

    @Override
    public Optional<ClothingItem> findById(String id) {
        return Optional.ofNullable(byId.get(requireId(id)));
    }

    @Override
    public Optional<ClothingItem> deleteById(String id) {
        return Optional.ofNullable(byId.remove(requireId(id)));
    }

    @Override
    public Optional<ClothingItem> addLike(String id, String userId) {
        return Optional.ofNullable(byId.computeIfPresent(requireId(id), (key, item) -> item.withLike(userId)));
    }

    @Override
    public Optional<ClothingItem> removeLike(String id, String userId) {
        return Optional.ofNullable(byId.computeIfPresent(requireId(id), (key, item) -> item.withoutLike(userId)));
    }
}
