// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.authentication;

import com.google.common.base.Preconditions;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// The 32-byte secret derived from a password and salt by CredentialManager. It is never written
/// anywhere. Two subkeys are expanded from it with HKDF-SHA256 under different labels: the
/// verifier, which is persisted and compared on login, and the cipher key, which encrypts note
/// bodies. The labels keep the two independent, so the stored verifier says nothing about the
/// cipher key.
///
/// Close the credential as soon as the subkeys have been taken from it. Wiping the array is best
/// effort: the JVM may have copied it, and the password String it came from cannot be wiped at all.
public final class Credential implements AutoCloseable {

    public static final int LENGTH_BYTES = 32;

    private static final byte[] VERIFIER_INFO = "notevault/verifier/v1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] CIPHER_INFO = "notevault/cipher/v1".getBytes(StandardCharsets.UTF_8);

    private final byte[] secret;
    private boolean destroyed = false;

    // package private, only CredentialManager derives these
    Credential (byte[] secret) {
        Preconditions.checkArgument(secret != null && secret.length == LENGTH_BYTES,
              "Credential must be exactly %s bytes.", LENGTH_BYTES);
        this.secret = secret;
    }

    /// The value stored in the vault configuration and compared on every login.
    public byte[] verifier () {
        return expand(VERIFIER_INFO);
    }

    /// The key for authenticated encryption of note bodies during a session.
    public byte[] cipherKey () {
        return expand(CIPHER_INFO);
    }

    /// A copy of the raw derived secret. Only used to check that derivation is deterministic.
    byte[] encoded () {
        checkNotDestroyed();
        return secret.clone();
    }

    private byte[] expand (byte[] info) {
        checkNotDestroyed();
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(secret, null, info));
        byte[] subkey = new byte[LENGTH_BYTES];
        hkdf.generateBytes(subkey, 0, LENGTH_BYTES);
        return subkey;
    }

    private void checkNotDestroyed () {
        Preconditions.checkState(!destroyed, "Credential has already been wiped.");
    }

    public boolean isDestroyed () {
        return destroyed;
    }

    @Override
    public void close () {
        Arrays.fill(secret, (byte) 0);
        destroyed = true;
    }

    @Override
    public String toString () {
        return destroyed ? "Credential[wiped]" : "Credential[32 bytes]";
    }
}
