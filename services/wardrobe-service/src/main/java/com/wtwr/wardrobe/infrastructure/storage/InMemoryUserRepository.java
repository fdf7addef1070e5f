package com.wtwr.wardrobe.infrastructure.storage;

import com.wtwr.common.ObjectIds;
import com.wtwr.wardrobe.domain.DuplicateKeyException;
import com.wtwr.wardrobe.domain.MalformedIdentifierException;
import com.wtwr.wardrobe.domain.User;
import com.wtwr.wardrobe.domain.UserRepository;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Document-store stand-in for user accounts. Enforces the same schema and unique email index a
 * real collection would, and reports violations with the store fault types.
 */
@Repository
public class InMemoryUserRepository implements UserRepository {

    private final Map<String, User> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByEmail = new ConcurrentHashMap<>();

    @Override
    public User insert(User user) {
        StoreSchema.requireLength("name", user.name(), 2, 30);
        StoreSchema.requireUrlIfPresent("avatar", user.avatar());
        StoreSchema.requirePresent("email", user.email());
        StoreSchema.requirePresent("password", user.passwordHash());

        String email = user.email().toLowerCase(Locale.ROOT);
        String id = ObjectIds.generate();
        if (idByEmail.putIfAbsent(email, id) != null) {
            throw new DuplicateKeyException("email");
        }
        User stored = new User(id, user.name(), user.avatar(), email, user.passwordHash());
        byId.put(id, stored);
        return stored;
    }

    @Override
    public Optional<User> findById(String id) {
        return Optional.ofNullable(byId.get(requireId(id)));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idByEmail.get(email.toLowerCase(Locale.ROOT))).map(byId::get);
    }

    @Override
    public Optional<User> updateProfile(String id, String name, String avatar) {
        StoreSchema.requireLength("name", name, 2, 30);
        StoreSchema.requireUrlIfPresent("avatar", avatar);
        return Optional.ofNullable(byId.computeIfPresent(requireId(id), (key, user) -> user.withProfile(name, avatar)));
    }

    static String requireId(String id) {
        if (!ObjectIds.isValid(id)) {
            throw new MalformedIdentifierException(id);
        }
        return id;
    }
}
