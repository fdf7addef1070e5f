package com.wtwr.wardrobe.domain;

/** A lookup used an identifier the store cannot parse. */
public class MalformedIdentifierException extends StorageException {

    public MalformedIdentifierException(String id) {
        super("Cast to ObjectId failed for value \"" + id + "\"");
    }
}
