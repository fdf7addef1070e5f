package com.wtwr.wardrobe.domain;

import com.wtwr.common.ApiError;
import com.wtwr.common.Result;
import com.wtwr.validation.ValidatedInput;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Clothing item handlers. Identifiers reaching this class have already passed the request
 * validator's format check.
 */
@Service
public class ClothingItemService {

    private static final Logger log = LoggerFactory.getLogger(ClothingItemService.class);

    static final String ITEM_NOT_FOUND = "Item not found";

    private final ClothingItemRepository items;

    public ClothingItemService(ClothingItemRepository items) {
        this.items = items;
    }

    public List<ClothingItem> list() {
        return items.findAll();
    }

    public Result<ClothingItem> create(String owner, ValidatedInput input) {
        Optional<Weather> weather = Weather.fromWire(input.string("weather"));
        if (weather.isEmpty()) {
            return Result.err(ApiError.badRequest("\"weather\" must be one of " + Weather.wireValues()));
        }
        ClothingItem created = items.insert(
                ClothingItem.draft(input.string("name"), weather.get(), input.string("imageUrl"), owner));
        log.info("Clothing item created id={} owner={}", created.id(), owner);
        return Result.ok(created);
    }

    /** Deletes an item owned by {@code callerId}; anyone else gets {@code Forbidden}. */
    public Result<ClothingItem> delete(String itemId, String callerId) {
        Optional<ClothingItem> existing = items.findById(itemId);
        if (existing.isEmpty()) {
            return Result.err(ApiError.notFound(ITEM_NOT_FOUND));
        }
        if (!existing.get().isOwnedBy(callerId)) {
            return Result.err(ApiError.forbidden("You can only delete your own items")
                    .withContext("itemId", itemId));
        }
        return items.deleteById(itemId)
                .map(Result::ok)
                .orElseGet(() -> Result.err(ApiError.notFound(ITEM_NOT_FOUND)));
    }

    public Result<ClothingItem> like(String itemId, String callerId) {
        return found(items.addLike(itemId, callerId));
    }

    public Result<ClothingItem> dislike(String itemId, String callerId) {
        return found(items.removeLike(itemId, callerId));
    }

    private static Result<ClothingItem> found(Optional<ClothingItem> item) {
        return item.map(Result::ok).orElseGet(() -> Result.err(ApiError.notFound(ITEM_NOT_FOUND)));
    }
}
