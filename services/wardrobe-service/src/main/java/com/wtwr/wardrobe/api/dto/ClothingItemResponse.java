package com.wtwr.wardrobe.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wtwr.wardrobe.domain.ClothingItem;
import java.time.Instant;
import java.util.List;

public record ClothingItemResponse(
        @JsonProperty("_id") String id,
        String name,
        String weather,
        String imageUrl,
        String owner,
        List<String> likes,
        Instant createdAt) {

    public static ClothingItemResponse from(ClothingItem item) {
        return new ClothingItemResponse(
                item.id(),
                item.name(),
                item.weather().wireValue(),
                item.imageUrl(),
                item.owner(),
                List.copyOf(item.likes()),
                item.createdAt());
    }
}
