// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

/// The message never says why authentication failed beyond the password being invalid.
public class AuthenticationFailedException extends VaultException {
    public AuthenticationFailedException (String message) {
        super("Authentication: " + message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.AUTHENTICATION_FAILED;
    }
}
