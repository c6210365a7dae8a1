// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.cipher;

import com.google.common.base.Preconditions;
import io.pfive.notevault.authentication.Credential;
import io.pfive.notevault.exception.CipherException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.random.RandomGenerator;

/// Authenticated encryption of note bodies under the cipher key of one session's Credential.
///
/// Tokens are text so they can be stored like any other string: the version prefix "v1." followed by
/// unpadded URL-safe Base64 of nonce, ciphertext and GCM tag. A new scheme would get a new prefix.
/// Every call to encrypt() draws a fresh 96-bit nonce, so encrypting the same text twice gives
/// different tokens. With random nonces a single key should not be used for more than about 2^32
/// encryptions, far beyond what a personal note vault will do.
///
/// Not threadsafe. Javax Cipher instances are stateful, so one is created per operation.
public final class NoteCipher implements AutoCloseable {

    public static final String TOKEN_PREFIX = "v1.";

    private static final String AES_GCM_NO_PADDING = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int MIN_PAYLOAD_BYTES = NONCE_LENGTH_BYTES + TAG_LENGTH_BITS / 8;

    private static final RandomGenerator randomGenerator = new SecureRandom();
    private static final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder decoder = Base64.getUrlDecoder();

    private final byte[] key;
    private boolean closed = false;

    public NoteCipher (Credential credential) {
        this.key = credential.cipherKey();
    }

    public String encrypt (String plaintext) {
        Preconditions.checkNotNull(plaintext);
        checkOpen();
        byte[] nonce = new byte[NONCE_LENGTH_BYTES];
        randomGenerator.nextBytes(nonce);
        try {
            Cipher cipher = aesGcm(Cipher.ENCRYPT_MODE, nonce);
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] payload = new byte[NONCE_LENGTH_BYTES + sealed.length];
            System.arraycopy(nonce, 0, payload, 0, NONCE_LENGTH_BYTES);
            System.arraycopy(sealed, 0, payload, NONCE_LENGTH_BYTES, sealed.length);
            return TOKEN_PREFIX + encoder.encodeToString(payload);
        } catch (GeneralSecurityException e) {
            // AES-GCM is mandatory in every JDK, so this indicates a broken runtime rather than bad input.
            throw new IllegalStateException("AES-GCM encryption unavailable.", e);
        }
    }

    /// Decrypt a token produced by encrypt() under the same key. Any alteration of the token, a
    /// token from a different key, or a token that is not in the expected format raises
    /// CipherException. No plaintext is returned unless the authentication tag verifies.
    public String decrypt (String token) {
        checkOpen();
        if (token == null || !token.startsWith(TOKEN_PREFIX)) {
            throw new CipherException("Unrecognized token format.");
        }
        String encoded = token.substring(TOKEN_PREFIX.length());
        byte[] payload;
        try {
            payload = decoder.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CipherException("Token is not valid Base64.", e);
        }
        // The decoder ignores unused trailing bits, so two different strings can decode to the same
        // bytes. Only the canonical encoding is accepted, so any change to the text is detected.
        if (!encoder.encodeToString(payload).equals(encoded)) {
            throw new CipherException("Token is not canonically encoded.");
        }
        if (payload.length < MIN_PAYLOAD_BYTES) {
            throw new CipherException("Token is too short.");
        }
        byte[] nonce = Arrays.copyOfRange(payload, 0, NONCE_LENGTH_BYTES);
        try {
            Cipher cipher = aesGcm(Cipher.DECRYPT_MODE, nonce);
            byte[] plaintext = cipher.doFinal(payload, NONCE_LENGTH_BYTES, payload.length - NONCE_LENGTH_BYTES);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new CipherException("Token failed authentication.", e);
        } catch (GeneralSecurityException e) {
            throw new CipherException("Token could not be decrypted.", e);
        }
    }

    private Cipher aesGcm (int mode, byte[] nonce) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(AES_GCM_NO_PADDING);
        cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
        return cipher;
    }

    private void checkOpen () {
        Preconditions.checkState(!closed, "Cipher has been closed at the end of its session.");
    }

    public boolean isClosed () {
        return closed;
    }

    /// Wipe the key. Copies held inside short-lived SecretKeySpec instances are left to the garbage
    /// collector.
    @Override
    public void close () {
        Arrays.fill(key, (byte) 0);
        closed = true;
    }

}
