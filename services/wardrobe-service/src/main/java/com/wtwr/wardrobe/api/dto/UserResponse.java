package com.wtwr.wardrobe.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wtwr.wardrobe.domain.User;

/** Public view of a user. The password hash is never part of it. */
public record UserResponse(@JsonProperty("_id") String id, String name, String avatar, String email) {

    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.name(), user.avatar(), user.email());
    }
}
