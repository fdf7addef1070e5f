package com.wtwr.wardrobe.infrastructure.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wtwr.common.ObjectIds;
import com.wtwr.wardrobe.domain.DuplicateKeyException;
import com.wtwr.wardrobe.domain.MalformedIdentifierException;
import com.wtwr.wardrobe.domain.SchemaViolationException;
import com.wtwr.wardrobe.domain.User;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryUserRepository")
class InMemoryUserRepositoryTest {

    private final InMemoryUserRepository repository = new InMemoryUserRepository();

    @Nested
    @DisplayName("insert")
    class Insert {

        @Test
        @DisplayName("assigns a 24-hex id and lower-cases the email")
        void assignsId() {
            User stored = repository.insert(user("Ada", "Ada@Example.com"));

            assertThat(ObjectIds.isValid(stored.id())).isTrue();
            assertThat(stored.email()).isEqualTo("ada@example.com");
            assertThat(repository.findById(stored.id())).contains(stored);
        }

        @Test
        @DisplayName("rejects a second account with the same email in any case")
        void uniqueEmail() {
            repository.insert(user("Ada", "ada@example.com"));

            assertThatThrownBy(() -> repository.insert(user("Other", "ADA@example.com")))
                    .isInstanceOf(DuplicateKeyException.class)
                    .extracting("key").isEqualTo("email");
        }

        @Test
        @DisplayName("lets exactly one of many concurrent sign-ups with one email win")
        void concurrentUniqueEmail() {
            var wins = new AtomicInteger();
            var futures = IntStream.range(0, 16)
                    .mapToObj(i -> CompletableFuture.runAsync(() -> {
                        try {
                            repository.insert(user("User" + i, "race@example.com"));
                            wins.incrementAndGet();
                        } catch (DuplicateKeyException expected) {
                            // lost the race
                        }
                    }))
                    .toArray(CompletableFuture[]::new);

            CompletableFuture.allOf(futures).join();

            assertThat(wins).hasValue(1);
        }

        @Test
        @DisplayName("enforces the name length")
        void nameLength() {
            assertThatThrownBy(() -> repository.insert(user("A", "a@example.com")))
                    .isInstanceOf(SchemaViolationException.class)
                    .extracting("field").isEqualTo("name");
        }

        @Test
        @DisplayName("requires a password hash")
        void passwordRequired() {
            assertThatThrownBy(() -> repository.insert(new User(null, "Ada", null, "a@example.com", null)))
                    .isInstanceOf(SchemaViolationException.class);
        }

        @Test
        @DisplayName("rejects an avatar that is not a URL")
        void avatarUrl() {
            assertThatThrownBy(() -> repository.insert(new User(null, "Ada", "avatar.png", "a@example.com", "hash")))
                    .isInstanceOf(SchemaViolationException.class);
        }
    }

    @Test
    @DisplayName("findById rejects a malformed id")
    void malformedId() {
        assertThatThrownBy(() -> repository.findById("123")).isInstanceOf(MalformedIdentifierException.class);
    }

    @Test
    @DisplayName("findByEmail ignores case and unknown addresses")
    void findByEmail() {
        User stored = repository.insert(user("Ada", "ada@example.com"));

        assertThat(repository.findByEmail("ADA@EXAMPLE.COM")).contains(stored);
        assertThat(repository.findByEmail("nobody@example.com")).isEmpty();
        assertThat(repository.findByEmail(null)).isEmpty();
    }

    @Test
    @DisplayName("updateProfile replaces name and avatar and keeps the rest")
    void updateProfile() {
        User stored = repository.insert(user("Ada", "ada@example.com"));

        var updated = repository.updateProfile(stored.id(), "Ada L", "https://cdn.example.com/ada.png");

        assertThat(updated).contains(stored.withProfile("Ada L", "https://cdn.example.com/ada.png"));
        assertThat(repository.updateProfile(ObjectIds.generate(), "Nobody", null)).isEmpty();
    }

    private static User user(String name, String email) {
        return new User(null, name, null, email, "$2a$04$hash");
    }
}
