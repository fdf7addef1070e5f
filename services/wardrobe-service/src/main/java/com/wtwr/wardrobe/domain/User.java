package com.wtwr.wardrobe.domain;

/**
 * A user account.
 *
 * @param id           24-hex document id; null before the store assigns one
 * @param name         display name, 2 to 30 characters
 * @param avatar       avatar URL, may be null
 * @param email        login email, unique, stored lower-case
 * @param passwordHash BCrypt hash; never leaves the service
 */
public record User(String id, String name, String avatar, String email, String passwordHash) {

    public User withId(String id) {
        return new User(id, name, avatar, email, passwordHash);
    }

    public User withProfile(String name, String avatar) {
        return new User(id, name, avatar, email, passwordHash);
    }
}
