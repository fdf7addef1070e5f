package com.wtwr.wardrobe.api;

import com.wtwr.validation.FieldSpec;
import com.wtwr.validation.ValidationSchema;
import com.wtwr.wardrobe.domain.Weather;

/** Validation schemas of every route that takes input. */
public final class RouteSchemas {

    private RouteSchemas() {
        // constants
    }

    public static final ValidationSchema SIGNUP = ValidationSchema.named("signup")
            .field(FieldSpec.string("name").withLength(2, 30))
            .field(FieldSpec.url("avatar").optional())
            .field(FieldSpec.email("email"))
            .field(FieldSpec.string("password").sensitiveValue())
            .build();

    public static final ValidationSchema SIGNIN = ValidationSchema.named("signin")
            .field(FieldSpec.email("email"))
            .field(FieldSpec.string("password").sensitiveValue())
            .build();

    public static final ValidationSchema UPDATE_PROFILE = ValidationSchema.named("update-profile")
            .field(FieldSpec.string("name").withLength(2, 30))
            .field(FieldSpec.url("avatar"))
            .build();

    public static final ValidationSchema CREATE_ITEM = ValidationSchema.named("create-item")
            .field(FieldSpec.string("name").withLength(2, 30))
            .field(FieldSpec.oneOf("weather", Weather.wireValues().toArray(String[]::new)))
            .field(FieldSpec.url("imageUrl"))
            .build();

    public static final ValidationSchema ITEM_ID = ValidationSchema.named("item-id")
            .field(FieldSpec.pathId("itemId"))
            .build();

    public static final ValidationSchema USER_ID = ValidationSchema.named("user-id")
            .field(FieldSpec.pathId("userId"))
            .build();
}
