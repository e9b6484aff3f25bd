package com.authplatform.personaldata.shared.crypto;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Password hashing using Argon2id with OWASP-recommended parameters.
 * Every hash carries its own random salt, so hashing one password twice gives two digests.
 */
@Service
public class PasswordService {

    private static final String ARGON2ID_PREFIX = "$argon2id$";

    private final Argon2 argon2;
    private final int iterations;
    private final int memoryKb;
    private final int parallelism;

    public PasswordService(
            @Value("${app.argon2.iterations:2}") int iterations,
            @Value("${app.argon2.memory-kb:19456}") int memoryKb,
            @Value("${app.argon2.parallelism:1}") int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id);
        this.iterations = iterations;
        this.memoryKb = memoryKb;
        this.parallelism = parallelism;
    }

    /**
     * Hashes a password. Returns a string starting with $argon2id$ containing algorithm parameters.
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.hash(iterations, memoryKb, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Checks a plain-text password against a stored digest in constant time.
     * Returns false for null input or a digest that cannot be parsed.
     */
    public boolean verify(String hash, String password) {
        if (hash == null || password == null) {
            return false;
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.verify(hash, chars);
        } catch (IllegalArgumentException | IllegalStateException e) {
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }

    public boolean isArgon2idHash(String hash) {
        return hash != null && hash.startsWith(ARGON2ID_PREFIX);
    }
}
