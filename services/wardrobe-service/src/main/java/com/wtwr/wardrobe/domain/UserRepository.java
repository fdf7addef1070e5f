package com.wtwr.wardrobe.domain;

import java.util.Optional;

/**
 * Storage port for {@link User} documents. Every method may throw a {@link StorageException}.
 */
public interface UserRepository {

    /**
     * Stores a new user and returns it with its assigned id.
     *
     * @throws DuplicateKeyException    if the email is already taken
     * @throws SchemaViolationException if a required field is missing or out of bounds
     */
    User insert(User user);

    /** @throws MalformedIdentifierException if {@code id} is not a 24-hex identifier */
    Optional<User> findById(String id);

    Optional<User> findByEmail(String email);

    /**
     * Replaces name and avatar of an existing user.
     *
     * @return the updated user, or empty if no user has that id
     */
    Optional<User> updateProfile(String id, String name, String avatar);
}
