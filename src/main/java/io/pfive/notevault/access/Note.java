// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.access;

/// A decrypted note as shown to the user. Only exists in memory while a session is open.
public record Note (String title, String body) {

    /// Leaves out the body so a note can be logged without leaking its contents.
    @Override
    public String toString () {
        return "Note[title=" + title + "]";
    }
}
