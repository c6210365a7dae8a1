// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

/// The vault configuration exists but is malformed, incomplete, or inconsistent with the verifier file.
public class ConfigParseException extends VaultException {
    public ConfigParseException (String message) {
        super("Invalid vault configuration: " + message);
    }

    public ConfigParseException (String message, Throwable cause) {
        super("Invalid vault configuration: " + message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.CONFIG_PARSE;
    }
}
