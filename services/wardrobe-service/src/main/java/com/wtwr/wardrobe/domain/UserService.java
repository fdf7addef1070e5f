package com.wtwr.wardrobe.domain;

import com.wtwr.common.ApiError;
import com.wtwr.common.Result;
import com.wtwr.security.JwtCredentialIssuer;
import com.wtwr.validation.ValidatedInput;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Account handlers: sign-up, sign-in, profile read and update.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final String BAD_CREDENTIALS = "Incorrect email or password";

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final JwtCredentialIssuer credentialIssuer;

    public UserService(UserRepository users, PasswordEncoder passwordEncoder, JwtCredentialIssuer credentialIssuer) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.credentialIssuer = credentialIssuer;
    }

    /**
     * Creates an account. The email is checked for uniqueness before the password is hashed; a
     * concurrent sign-up that slips past the check surfaces as the store's duplicate-key fault.
     */
    public Result<User> signUp(ValidatedInput input) {
        String email = normalize(input.string("email"));
        if (users.findByEmail(email).isPresent()) {
            return Result.err(ApiError.conflict("A user with this email already exists")
                    .withContext("field", "email"));
        }
        String hash = passwordEncoder.encode(input.string("password"));
        User created = users.insert(new User(
                null, input.string("name"), input.optionalString("avatar").orElse(null), email, hash));
        log.info("User created id={}", created.id());
        return Result.ok(created);
    }

    /** Returns a fresh credential for the account matching email and password. */
    public Result<String> signIn(ValidatedInput input) {
        return users.findByEmail(normalize(input.string("email")))
                .filter(user -> passwordEncoder.matches(input.string("password"), user.passwordHash()))
                .map(user -> Result.ok(credentialIssuer.issue(user.id())))
                .orElseGet(() -> Result.err(ApiError.unauthorized(BAD_CREDENTIALS)));
    }

    public Result<User> findById(String id) {
        return users.findById(id)
                .map(Result::ok)
                .orElseGet(() -> Result.err(ApiError.notFound("User not found")));
    }

    public Result<User> updateProfile(String id, ValidatedInput input) {
        return users.updateProfile(id, input.string("name"), input.string("avatar"))
                .map(Result::ok)
                .orElseGet(() -> Result.err(ApiError.notFound("User not found")));
    }

    private static String normalize(String email) {
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
