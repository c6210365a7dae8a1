// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

public class ConfigIOException extends VaultException {
    public ConfigIOException (String message, Throwable cause) {
        super("Cannot access vault configuration: " + message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.CONFIG_IO;
    }
}
