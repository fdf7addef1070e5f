package com.wtwr.validation;

/** Where a field's raw value is read from. */
public enum FieldSource {
    BODY,
    PATH
}
