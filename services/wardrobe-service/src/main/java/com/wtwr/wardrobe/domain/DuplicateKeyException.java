package com.wtwr.wardrobe.domain;

/** An insert or update collided with a unique index. */
public class DuplicateKeyException extends StorageException {

    private final String key;

    public DuplicateKeyException(String key) {
        super("E11000 duplicate key error on " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
