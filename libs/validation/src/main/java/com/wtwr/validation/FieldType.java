package com.wtwr.validation;

/** Primitive type of a schema field. All wire values are JSON strings. */
public enum FieldType {
    /** Free text, optionally length-bounded. */
    STRING,
    /** Absolute http or https URL with a host. */
    URL,
    /** {@code local@domain.tld} address. */
    EMAIL,
    /** One of a declared set of values, matched exactly. */
    ENUM,
    /** Document identifier: 24 hexadecimal characters. */
    OBJECT_ID
}
