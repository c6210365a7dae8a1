// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

/// A token could not be decrypted: it was tampered with, corrupted, or produced under another key.
/// These cases are deliberately not distinguished.
public class CipherException extends VaultException {
    public CipherException (String message) {
        super(message);
    }

    public CipherException (String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.CIPHER;
    }
}
