package com.tasklane.backend.modules.auth.application;

import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted one-way password hashing on top of the configured bcrypt {@link PasswordEncoder}.
 * Every {@link #hash} call draws a fresh salt; {@link #verify} compares digests in
 * constant time.
 */
@Component
public class PasswordHasher {

    private static final Pattern BCRYPT_DIGEST = Pattern.compile("\\A\\$2[aby]?\\$(0[4-9]|[12]\\d|3[01])\\$[./0-9A-Za-z]{53}\\z");

    private final PasswordEncoder passwordEncoder;
    private final String decoyDigest;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.decoyDigest = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String digest) {
        if (digest == null || !BCRYPT_DIGEST.matcher(digest).matches()) {
            throw new CorruptCredentialException();
        }
        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException ex) {
            throw new CorruptCredentialException(ex);
        }
    }

    /**
     * Burns one comparison's worth of time for a login handle that does not exist, so
     * unknown handles and wrong passwords take the same time to reject.
     */
    public void verifyAgainstDecoy(String plaintext) {
        passwordEncoder.matches(plaintext, decoyDigest);
    }
}
