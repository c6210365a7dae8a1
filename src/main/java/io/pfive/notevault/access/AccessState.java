// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.access;

/// The states of AccessStateMachine. Each constant states outright whether it counts as
/// authenticated and whether a session is held, so adding or reordering constants cannot change
/// either answer. Never compare states by ordinal.
///
/// Authenticated states are the ones from which the note operations and the change password and
/// reset intents may be chosen. The password change and reset dialogs are not authenticated in that
/// sense, but the session stays open through them so the user can return to LOGGED_ON.
public enum AccessState {

    EMPTY (false, false),
    INVALID_NEW_PASSWORD (false, false),
    LOGGED_OFF (false, false),
    INVALID_PASSWORD (false, false),

    LOGGED_ON (true, true),
    ADD_RECORD (true, true),
    FIND_RECORD (true, true),
    DELETE_RECORD (true, true),
    RECORD_FOUND (true, true),
    RECORD_NOT_FOUND (true, true),

    CHANGE_PASSWORD (false, true),
    CHANGE_PASSWORD_FAILED (false, true),
    CONFIRM_HARD_RESET (false, true),
    CONFIRM_HARD_RESET_FAILED (false, true),
    HARD_RESET (false, false);

    private final boolean authenticated;
    private final boolean sessionHeld;

    AccessState (boolean authenticated, boolean sessionHeld) {
        this.authenticated = authenticated;
        this.sessionHeld = sessionHeld;
    }

    public boolean isAuthenticated () {
        return authenticated;
    }

    public boolean holdsSession () {
        return sessionHeld;
    }

    public static boolean isAuthenticated (AccessState state) {
        return state != null && state.authenticated;
    }

}
