package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * User registration, secret verification and API-key management on top of a
 * {@link CredentialRepository}.
 * <p>
 * Secrets are hashed with the supplied {@link PasswordEncoder} (BCrypt in production). API keys
 * are 256-bit random values stored as SHA-256 digests, which keeps lookup by key possible
 * without keeping the key.
 * <p>
 * {@link #verifySecret(String, String)} performs exactly one encoder comparison on every path,
 * including unknown and disabled users, so failures cannot be told apart by timing or by
 * response.
 * <p>
 * BCrypt only reads the first {@value #MAX_SECRET_BYTES} bytes of a secret, so longer secrets are
 * refused when set and never match when presented.
 */
public class CredentialStore implements IdentityLookup {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    /** Minimum accepted length for a login secret. */
    public static final int MIN_SECRET_LENGTH = 8;

    /** Maximum accepted length of a login secret, in UTF-8 bytes. */
    public static final int MAX_SECRET_BYTES = 72;

    private static final int API_KEY_RANDOM_BYTES = 32;

    private final CredentialRepository repository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final String dummyHash;

    public CredentialStore(CredentialRepository repository, PasswordEncoder passwordEncoder, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.passwordEncoder = Objects.requireNonNull(passwordEncoder, "passwordEncoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Registers a new user.
     *
     * @return the new user's id
     * @throws DuplicateEmailException  if the email is taken
     * @throws IllegalArgumentException if the email or secret is malformed
     */
    public String createUser(String email, String secret, PrivilegeLevel privilege) {
        String normalisedEmail = normaliseEmail(email);
        if (!normalisedEmail.contains("@")) {
            throw new IllegalArgumentException("email must contain '@'");
        }
        requireAcceptableSecret(secret);
        Objects.requireNonNull(privilege, "privilege");

        var user = new User(
                UUID.randomUUID().toString(),
                normalisedEmail,
                passwordEncoder.encode(secret),
                null,
                privilege,
                clock.instant(),
                false);
        repository.insert(user);
        log.info("Registered user {} with privilege {}", user.userId(), privilege);
        return user.userId();
    }

    /**
     * Checks a login secret.
     *
     * @throws InvalidCredentialsException for an unknown email, a wrong secret or a disabled user
     */
    public Identity verifySecret(String email, String candidate) {
        String raw = candidate == null ? "" : candidate;
        boolean tooLong = exceedsMaxBytes(raw);
        Optional<User> user = email == null || email.isBlank()
                ? Optional.empty()
                : repository.findByEmail(normaliseEmail(email));

        String hash = tooLong ? dummyHash : user.map(User::secretHash).orElse(dummyHash);
        boolean matches = passwordEncoder.matches(tooLong ? "" : raw, hash);

        if (user.isEmpty() || user.get().disabled() || tooLong || !matches) {
            throw new InvalidCredentialsException();
        }
        return user.get().toIdentity();
    }

    /**
     * Issues a new API key for the user. The previous key stops resolving as soon as this
     * returns.
     *
     * @throws InvalidCredentialsException if the user does not exist or is disabled
     */
    public ApiKey rotateApiKey(String userId) {
        User user = repository.findById(userId)
                .filter(u -> !u.disabled())
                .orElseThrow(InvalidCredentialsException::new);

        ApiKey key = generateApiKey();
        if (!repository.updateApiKeyHash(user.userId(), Digests.sha256Hex(key.value()))) {
            throw new InvalidCredentialsException();
        }
        log.info("Rotated API key for user {}", user.userId());
        return key;
    }

    /**
     * Resolves an API key to its owner.
     *
     * @throws InvalidCredentialsException if the key is unknown, malformed or belongs to a disabled user
     */
    public Identity lookupByApiKey(String key) {
        if (!ApiKey.looksLikeApiKey(key)) {
            throw new InvalidCredentialsException();
        }
        return repository.findByApiKeyHash(Digests.sha256Hex(key))
                .filter(u -> !u.disabled())
                .map(User::toIdentity)
                .orElseThrow(InvalidCredentialsException::new);
    }

    public void updatePrivilege(String userId, PrivilegeLevel privilege) {
        Objects.requireNonNull(privilege, "privilege");
        if (!repository.updatePrivilege(userId, privilege)) {
            throw new IllegalArgumentException("Unknown user: " + userId);
        }
        log.info("Changed privilege of user {} to {}", userId, privilege);
    }

    /**
     * Replaces the login secret after checking the current one.
     *
     * @throws InvalidCredentialsException if {@code currentSecret} is wrong
     */
    public void changeSecret(String userId, String currentSecret, String newSecret) {
        User user = repository.findById(userId)
                .filter(u -> !u.disabled())
                .orElseThrow(InvalidCredentialsException::new);
        if (currentSecret == null || exceedsMaxBytes(currentSecret)
                || !passwordEncoder.matches(currentSecret, user.secretHash())) {
            throw new InvalidCredentialsException();
        }
        requireAcceptableSecret(newSecret);
        repository.updateSecretHash(userId, passwordEncoder.encode(newSecret));
        log.info("Changed secret of user {}", userId);
    }

    /**
     * Soft-disables a user. Their secret, API key and refresh tokens stop working.
     *
     * @return false if the user does not exist
     */
    public boolean disableUser(String userId) {
        boolean disabled = repository.disable(userId);
        if (disabled) {
            log.info("Disabled user {}", userId);
        }
        return disabled;
    }

    @Override
    public Optional<Identity> findActiveIdentity(String userId) {
        return repository.findById(userId)
                .filter(u -> !u.disabled())
                .map(User::toIdentity);
    }

    static String normaliseEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        return email.strip().toLowerCase(Locale.ROOT);
    }

    private static void requireAcceptableSecret(String secret) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "secret must be at least %d characters".formatted(MIN_SECRET_LENGTH));
        }
        if (exceedsMaxBytes(secret)) {
            throw new IllegalArgumentException(
                    "secret must be at most %d bytes".formatted(MAX_SECRET_BYTES));
        }
    }

    private static boolean exceedsMaxBytes(String secret) {
        return secret.getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES;
    }

    private ApiKey generateApiKey() {
        byte[] random = new byte[API_KEY_RANDOM_BYTES];
        secureRandom.nextBytes(random);
        return new ApiKey(ApiKey.PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(random));
    }
}
