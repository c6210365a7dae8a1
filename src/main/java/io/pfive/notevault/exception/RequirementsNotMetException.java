// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

/// A new password was rejected by the password rules. The user can simply try again.
public class RequirementsNotMetException extends VaultException {
    public RequirementsNotMetException (String message) {
        super(message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.REQUIREMENTS_NOT_MET;
    }
}
