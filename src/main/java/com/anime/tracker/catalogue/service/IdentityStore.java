package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.exception.DuplicateKeyConflictException;
import com.anime.tracker.catalogue.exception.ForeignKeyViolationException;
import com.anime.tracker.catalogue.exception.InvalidTokenException;
import com.anime.tracker.catalogue.exception.TokenAlreadyUsedException;
import com.anime.tracker.catalogue.exception.TokenExpiredException;
import com.anime.tracker.catalogue.model.TokenType;
import com.anime.tracker.catalogue.model.UserAccount;
import com.anime.tracker.catalogue.model.VerificationToken;
import com.anime.tracker.catalogue.repository.UserAccountRepository;
import com.anime.tracker.catalogue.repository.VerificationTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Users and their single-use verification tokens. Password hashes are opaque here;
 * hashing and token delivery belong to the auth subsystem.
 */
@Slf4j
@Service
public class IdentityStore {
    private static final int TOKEN_BYTES = 32;

    private final UserAccountRepository userAccountRepository;
    private final VerificationTokenRepository verificationTokenRepository;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Value("${app.tokens.email-verification-ttl-hours:24}")
    private long emailVerificationTtlHours;

    @Value("${app.tokens.password-reset-ttl-minutes:60}")
    private long passwordResetTtlMinutes;

    public IdentityStore(UserAccountRepository userAccountRepository,
                         VerificationTokenRepository verificationTokenRepository,
                         Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.verificationTokenRepository = verificationTokenRepository;
        this.clock = clock;
    }

    @Transactional
    public UserAccount registerUser(String email, String passwordHash, String name) {
        String normalizedEmail = normalizeEmail(email);
        if (userAccountRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw new DuplicateKeyConflictException("E-mail already registered: " + normalizedEmail);
        }
        UserAccount user = newUser(normalizedEmail, name);
        user.setPasswordHash(passwordHash);
        return userAccountRepository.save(user);
    }

    /**
     * Registers an account backed by Google sign-in. The e-mail counts as verified.
     */
    @Transactional
    public UserAccount registerGoogleUser(String email, String googleId, String name, String avatar) {
        if (googleId == null || googleId.isBlank()) {
            throw new IllegalArgumentException("Google id must not be blank");
        }
        String normalizedEmail = normalizeEmail(email);
        if (userAccountRepository.existsByGoogleId(googleId)) {
            throw new DuplicateKeyConflictException("Google account already registered: " + googleId);
        }
        if (userAccountRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw new DuplicateKeyConflictException("E-mail already registered: " + normalizedEmail);
        }
        UserAccount user = newUser(normalizedEmail, name);
        user.setGoogleId(googleId);
        user.setAvatar(avatar);
        user.setEmailVerified(true);
        return userAccountRepository.save(user);
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findUser(Long userId) {
        return userAccountRepository.findById(userId);
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findUserByEmail(String email) {
        return userAccountRepository.findByEmailIgnoreCase(normalizeEmail(email));
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findUserByGoogleId(String googleId) {
        return userAccountRepository.findByGoogleId(googleId);
    }

    @Transactional
    public Optional<UserAccount> markEmailVerified(Long userId) {
        return userAccountRepository.findById(userId).map(user -> {
            user.setEmailVerified(true);
            user.setUpdatedAt(clock.instant());
            return userAccountRepository.save(user);
        });
    }

    @Transactional
    public Optional<UserAccount> updatePasswordHash(Long userId, String passwordHash) {
        return userAccountRepository.findById(userId).map(user -> {
            user.setPasswordHash(passwordHash);
            user.setUpdatedAt(clock.instant());
            return userAccountRepository.save(user);
        });
    }

    @Transactional
    public VerificationToken issueToken(Long userId, TokenType type) {
        Duration ttl = type == TokenType.PASSWORD_RESET
                ? Duration.ofMinutes(passwordResetTtlMinutes)
                : Duration.ofHours(emailVerificationTtlHours);
        return issueToken(userId, type, ttl);
    }

    @Transactional
    public VerificationToken issueToken(Long userId, TokenType type, Duration ttl) {
        if (userId == null || !userAccountRepository.existsById(userId)) {
            throw new ForeignKeyViolationException("No user with id " + userId);
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);

        Instant now = clock.instant();
        VerificationToken token = new VerificationToken();
        token.setUserId(userId);
        token.setToken(HexFormat.of().formatHex(bytes));
        token.setTokenType(type);
        token.setCreatedAt(now);
        token.setExpiresAt(now.plus(ttl));
        return verificationTokenRepository.save(token);
    }

    /**
     * Marks a token used. The conditional update lets exactly one of several concurrent
     * consumers win; the others see {@link TokenAlreadyUsedException}.
     *
     * @return the consumed token, carrying the user id it was issued for
     */
    @Transactional
    public VerificationToken consumeToken(String tokenValue, TokenType expectedType) {
        VerificationToken token = verificationTokenRepository.findByToken(tokenValue)
                .orElseThrow(() -> new InvalidTokenException("Unknown token"));
        if (token.getTokenType() != expectedType) {
            throw new InvalidTokenException("Token is not a " + expectedType + " token");
        }
        Instant now = clock.instant();
        if (token.getExpiresAt().isBefore(now)) {
            throw new TokenExpiredException("Token expired at " + token.getExpiresAt());
        }
        if (token.getUsedAt() != null || verificationTokenRepository.markUsed(tokenValue, now) == 0) {
            throw new TokenAlreadyUsedException("Token already used");
        }
        token.setUsedAt(now);
        return token;
    }

    @Transactional
    public int purgeExpiredTokens() {
        int purged = verificationTokenRepository.deleteExpiredOrUsed(clock.instant());
        if (purged > 0) {
            log.info("Purged {} expired or used verification tokens", purged);
        }
        return purged;
    }

    /**
     * Deletes the user; the database cascades to history, favorites, subscriptions
     * and tokens of that user only.
     */
    @Transactional
    public boolean deleteUser(Long userId) {
        boolean deleted = userAccountRepository.deleteByIdCascading(userId) > 0;
        if (deleted) {
            log.info("Deleted user {}", userId);
        }
        return deleted;
    }

    private UserAccount newUser(String email, String name) {
        Instant now = clock.instant();
        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setName(name);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        return user;
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("E-mail must not be blank");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
