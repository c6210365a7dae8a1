// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.access;

import com.google.common.base.Preconditions;
import io.pfive.notevault.authentication.Credential;
import io.pfive.notevault.cipher.NoteCipher;

/// The capability to read and write notes, created on successful login. It holds the only cipher
/// in the process. Closing the session wipes the key, and a closed session cannot be reopened: the
/// user has to log in again, which creates a new one.
// package private, only AccessStateMachine creates and holds sessions
final class Session implements AutoCloseable {

    private final NoteCipher cipher;

    /// Takes the cipher key from the credential. The credential itself is not retained and should be
    /// closed by the caller.
    Session (Credential credential) {
        this.cipher = new NoteCipher(credential);
    }

    NoteCipher cipher () {
        Preconditions.checkState(!cipher.isClosed(), "Session has ended.");
        return cipher;
    }

    boolean isOpen () {
        return !cipher.isClosed();
    }

    @Override
    public void close () {
        cipher.close();
    }
}
