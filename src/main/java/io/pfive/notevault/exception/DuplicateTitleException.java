// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.exception;

public class DuplicateTitleException extends VaultException {

    public final String title;

    public DuplicateTitleException (String title) {
        super(String.format("A note titled '%s' already exists.", title));
        this.title = title;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.DUPLICATE_TITLE;
    }
}
