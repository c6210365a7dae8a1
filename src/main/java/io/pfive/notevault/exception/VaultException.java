// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

/// Superclass for every failure the vault reports as an exception. Each subclass names one kind of
/// error through its ErrorType, so a caller handling VaultException generically (the entry point, or
/// the access state machine turning failures into messages) can decide what to do without a chain
/// of instanceof checks. Only fatal kinds end the process, and only the entry point decides that.
public abstract class VaultException extends RuntimeException {

    public VaultException (String message) {
        super(message);
    }

    public VaultException (String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType errorType ();

    public boolean isFatal () {
        return errorType().fatal;
    }

    public enum ErrorType {
        CONFIG_PARSE(true),
        CONFIG_IO(true),
        REQUIREMENTS_NOT_MET(false),
        AUTHENTICATION_FAILED(false),
        DUPLICATE_TITLE(false),
        CIPHER(false),
        // A failed write leaves the vault usable for reads, so this is not fatal inside a session.
        STORAGE_IO(false);

        public final boolean fatal;

        ErrorType (boolean fatal) {
            this.fatal = fatal;
        }
    }
}
