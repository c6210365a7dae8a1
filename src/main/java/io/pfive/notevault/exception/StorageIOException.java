// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

public class StorageIOException extends VaultException {
    public StorageIOException (String message, Throwable cause) {
        super("Record storage failure: " + message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.STORAGE_IO;
    }
}
