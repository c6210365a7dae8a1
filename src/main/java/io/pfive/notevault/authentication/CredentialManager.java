// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.authentication;

import com.google.common.base.Stopwatch;
import io.pfive.notevault.exception.RequirementsNotMetException;
import io.pfive.notevault.util.Ret;
import org.bouncycastle.crypto.generators.SCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.random.RandomGenerator;

import static io.pfive.notevault.util.Ret.err;
import static io.pfive.notevault.util.Ret.ok;

/// Password rules, salt generation, key derivation and password verification. Holds no state
/// besides the fixed KDF parameters, so all methods are static.
///
/// Derivation uses scrypt (N = 2^14, r = 8, p = 1, 32 bytes out) from BouncyCastle. Unlike the
/// PBKDF2 built into the JDK, scrypt needs a lot of memory per guess (about 16 MiB with these
/// parameters), which is what makes it expensive on purpose-built cracking hardware. The cost is
/// paid once per login or registration attempt: use authenticate() rather than verify() followed by
/// deriveKey() when the key is needed afterward.
public abstract class CredentialManager {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    // "SecureRandom objects are safe for use by multiple concurrent threads." - Javadoc
    private static final RandomGenerator randomGenerator = new SecureRandom();

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_LENGTH = 32;
    public static final int SALT_LENGTH_BYTES = 16;

    static final int SCRYPT_COST = 1 << 14;
    static final int SCRYPT_BLOCK_SIZE = 8;
    static final int SCRYPT_PARALLELISM = 1;

    /// The ASCII punctuation symbols allowed in passwords, the same set as C's ispunct().
    public static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    public static final String REQUIREMENTS = String.join("\n",
          "Password requirements:",
          "   * Length between %d and %d".formatted(MIN_PASSWORD_LENGTH, MAX_PASSWORD_LENGTH),
          "   * Upper and lowercase Latin letters,",
          "     numbers and any of the following symbols:",
          "     " + PUNCTUATION
    );

    /// True if the password may be used as a new vault password: between 8 and 32 characters, each
    /// one an ASCII letter, digit or punctuation symbol. Spaces and all non-ASCII text are refused.
    public static boolean meetsRequirements (String password) {
        if (password == null) return false;
        if (password.length() < MIN_PASSWORD_LENGTH || password.length() > MAX_PASSWORD_LENGTH) {
            return false;
        }
        for (int i = 0; i < password.length(); i++) {
            if (!isAllowedCharacter(password.charAt(i))) return false;
        }
        return true;
    }

    /// Same rule as meetsRequirements, for callers that treat a weak password as a failure.
    public static void checkRequirements (String password) {
        if (!meetsRequirements(password)) {
            throw new RequirementsNotMetException("The new password does not meet the requirements.\n" + REQUIREMENTS);
        }
    }

    private static boolean isAllowedCharacter (char c) {
        if (c >= 'a' && c <= 'z') return true;
        if (c >= 'A' && c <= 'Z') return true;
        if (c >= '0' && c <= '9') return true;
        return PUNCTUATION.indexOf(c) >= 0;
    }

    /// A new random salt for a vault: 16 bytes, as unpadded URL-safe Base64 (22 characters).
    public static String generateSalt () {
        byte[] salt = new byte[SALT_LENGTH_BYTES];
        randomGenerator.nextBytes(salt);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(salt);
    }

    /// Deterministically derive the credential for a password under the given salt. The salt string
    /// is used as-is (its UTF-8 bytes), it is not Base64-decoded.
    public static Credential deriveKey (String password, String salt) {
        if (password == null || salt == null) {
            throw new IllegalArgumentException("Password and salt are both required.");
        }
        Stopwatch timer = Stopwatch.createStarted();
        byte[] secret = SCrypt.generate(
              password.getBytes(StandardCharsets.UTF_8),
              salt.getBytes(StandardCharsets.UTF_8),
              SCRYPT_COST, SCRYPT_BLOCK_SIZE, SCRYPT_PARALLELISM,
              Credential.LENGTH_BYTES
        );
        LOG.debug("Time to derive key: {}", timer);
        return new Credential(secret);
    }

    /// Derive the credential and compare its verifier with the expected one in constant time. On
    /// success the credential is returned so the caller does not have to derive it again. On failure
    /// the derived material is wiped and the message deliberately gives no detail.
    public static Ret<Credential> authenticate (String password, String salt, byte[] expectedVerifier) {
        if (password == null || expectedVerifier == null) {
            return err("Invalid password.");
        }
        Credential credential = deriveKey(password, salt);
        byte[] verifier = credential.verifier();
        if (!MessageDigest.isEqual(verifier, expectedVerifier)) {
            credential.close();
            return err("Invalid password.");
        }
        return ok(credential);
    }

    /// True if the password produces the expected verifier under the salt. Never throws on mismatch.
    public static boolean verify (String password, String salt, byte[] expectedVerifier) {
        Ret<Credential> result = authenticate(password, salt, expectedVerifier);
        if (result.isOk()) {
            result.get().close();
            return true;
        }
        return false;
    }

}
