package com.wtwr.wardrobe.domain;

/**
 * A fault reported by the document store. The message is for logs only and is never sent to
 * the caller.
 */
public abstract class StorageException extends RuntimeException {

    protected StorageException(String message) {
        super(message);
    }
}
