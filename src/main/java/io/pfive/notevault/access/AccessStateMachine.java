// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.access;

import com.google.common.base.Preconditions;
import io.pfive.notevault.authentication.Credential;
import io.pfive.notevault.authentication.CredentialManager;
import io.pfive.notevault.cipher.NoteCipher;
import io.pfive.notevault.exception.AuthenticationFailedException;
import io.pfive.notevault.exception.CipherException;
import io.pfive.notevault.exception.ConfigIOException;
import io.pfive.notevault.exception.DuplicateTitleException;
import io.pfive.notevault.exception.RequirementsNotMetException;
import io.pfive.notevault.exception.StorageIOException;
import io.pfive.notevault.exception.VaultException;
import io.pfive.notevault.store.RecordStore;
import io.pfive.notevault.store.VaultConfig;
import io.pfive.notevault.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Decides which vault operations are allowed, given whether the user has logged in, and carries
/// them out. A front end calls one intent method per user action and then reads back state(),
/// message() and foundNote() to decide what to show. Calling an intent that is not allowed in the
/// current state is a bug in the front end and throws IllegalStateException.
///
/// The session (and with it the only decryption key in the process) exists exactly while the state
/// holds one. Every transition goes through one method that closes the session when the new state
/// does not hold one, so no exit path from the logged-in states can leave a key behind.
///
/// Expected failures (wrong password, duplicate title, undecryptable note, failed writes) become
/// transitions with a message. Nothing here ends the process. Confine an instance to one thread.
public class AccessStateMachine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final int DEFAULT_MAX_TITLE_LENGTH = 256;

    private final RecordStore store;
    private final int maxTitleLength;
    // Replaced by a fresh configuration (new salt, no verifier) after a hard reset.
    private VaultConfig config;

    private AccessState state;
    private Session session;
    private Note foundNote;
    private String message;

    public AccessStateMachine (VaultConfig config, RecordStore store) {
        this(config, store, DEFAULT_MAX_TITLE_LENGTH);
    }

    public AccessStateMachine (VaultConfig config, RecordStore store, int maxTitleLength) {
        Preconditions.checkArgument(maxTitleLength > 0, "Maximum title length must be positive.");
        this.config = Preconditions.checkNotNull(config);
        this.store = Preconditions.checkNotNull(store);
        this.maxTitleLength = maxTitleLength;
        reconcileVerifier();
        this.state = config.hasVerifier() ? AccessState.LOGGED_OFF : AccessState.EMPTY;
    }

    /// A crash after a password change was committed but before the verifier file was rewritten
    /// leaves the file one password behind the notes. The verifier committed with the notes wins.
    private void reconcileVerifier () {
        if (!config.hasVerifier()) return;
        Optional<byte[]> committed = store.committedVerifier();
        if (committed.isEmpty() || Arrays.equals(committed.get(), config.passwordVerifier())) return;
        LOG.warn("Password verifier file is older than the last committed password change, repairing it.");
        config.setVerifier(committed.get());
        config.save();
    }

    public AccessState state () {
        return state;
    }

    /// Status or error text produced by the most recent intent, for display to the user.
    public Optional<String> message () {
        return Optional.ofNullable(message);
    }

    /// The decrypted note, only present in RECORD_FOUND.
    public Optional<Note> foundNote () {
        return Optional.ofNullable(foundNote);
    }

    public boolean hasSession () {
        return session != null;
    }

    public VaultConfig config () {
        return config;
    }

    // ─── First password ─────────────────────────────────────────────────────────

    public void submitNewPassword (String password) {
        expectState("set a new password", AccessState.EMPTY);
        if (!CredentialManager.meetsRequirements(password)) {
            LOG.debug("New password rejected, it does not meet the requirements.");
            transition(AccessState.INVALID_NEW_PASSWORD, CredentialManager.REQUIREMENTS);
            return;
        }
        try (Credential credential = CredentialManager.deriveKey(password, config.passwordSalt())) {
            config.setVerifier(credential.verifier());
        }
        try {
            config.save();
        } catch (ConfigIOException e) {
            LOG.error("Could not save the new password.", e);
            // Remove whatever part was written, so the vault is still uninitialized on disk and in memory.
            try {
                config.erase();
            } catch (ConfigIOException eraseFailure) {
                e.addSuppressed(eraseFailure);
                LOG.error("Could not remove partially written configuration.", eraseFailure);
            }
            transition(AccessState.EMPTY, "The password could not be saved: " + e.getMessage());
            return;
        }
        LOG.info("Vault password has been set.");
        transition(AccessState.LOGGED_OFF, "Password set. Log in to continue.");
    }

    // ─── Login and logoff ───────────────────────────────────────────────────────

    public void submitPassword (String password) {
        expectState("log in", AccessState.LOGGED_OFF);
        Ret<Credential> authenticated = CredentialManager.authenticate(
              password, config.passwordSalt(), config.passwordVerifier());
        if (authenticated.isErr()) {
            LOG.info("Login failed: incorrect password provided.");
            transition(AccessState.INVALID_PASSWORD, authenticated.errorMessage());
            return;
        }
        try (Credential credential = authenticated.get()) {
            session = new Session(credential);
        }
        LOG.info("Login successful.");
        transition(AccessState.LOGGED_ON, null);
    }

    /// End the session from any state that holds one. Does nothing in other states, so it is safe to
    /// call on exit whatever the state.
    public void logoff () {
        if (!state.holdsSession()) return;
        transition(AccessState.LOGGED_OFF, null);
        LOG.info("Logged off.");
    }

    // ─── Acknowledging and cancelling ──────────────────────────────────────────

    /// Dismiss an error or result and move on.
    public void acknowledge () {
        AccessState next = switch (state) {
            case INVALID_NEW_PASSWORD, HARD_RESET -> AccessState.EMPTY;
            case INVALID_PASSWORD -> AccessState.LOGGED_OFF;
            case RECORD_FOUND, RECORD_NOT_FOUND, CHANGE_PASSWORD_FAILED, CONFIRM_HARD_RESET_FAILED -> AccessState.LOGGED_ON;
            default -> throw illegalIntent("acknowledge");
        };
        transition(next, null);
    }

    /// Leave an operation dialog without doing anything.
    public void cancel () {
        expectState("cancel", AccessState.ADD_RECORD, AccessState.FIND_RECORD, AccessState.DELETE_RECORD,
              AccessState.CHANGE_PASSWORD, AccessState.CONFIRM_HARD_RESET);
        transition(AccessState.LOGGED_ON, null);
    }

    // ─── Note operations ────────────────────────────────────────────────────────

    public void selectAddRecord () {
        expectAuthenticated("add a note");
        transition(AccessState.ADD_RECORD, null);
    }

    public void selectFindRecord () {
        expectAuthenticated("find a note");
        transition(AccessState.FIND_RECORD, null);
    }

    public void selectDeleteRecord () {
        expectAuthenticated("delete a note");
        transition(AccessState.DELETE_RECORD, null);
    }

    /// Encrypt and store a new note. Stays in ADD_RECORD with an error message if the title or body
    /// is empty, the title is too long, or a note with the same title exists.
    public void addRecord (String title, String body) {
        expectState("add a note", AccessState.ADD_RECORD);
        if (title == null || title.isEmpty() || body == null || body.isEmpty()) {
            message = "A note needs both a title and a body.";
            return;
        }
        if (title.length() > maxTitleLength) {
            message = "Titles are limited to %d characters.".formatted(maxTitleLength);
            return;
        }
        String token = session.cipher().encrypt(body);
        try {
            store.put(title, token);
        } catch (DuplicateTitleException e) {
            message = e.getMessage() + " Choose a different title.";
            return;
        } catch (StorageIOException e) {
            storageFailure("add a note", e);
            return;
        }
        LOG.debug("Added a note.");
        transition(AccessState.LOGGED_ON, "Note '%s' saved.".formatted(title));
    }

    /// Look up a note by exact title and decrypt it. A note that fails to decrypt is reported as not
    /// found, and the ciphertext is never shown.
    public void findRecord (String title) {
        expectState("find a note", AccessState.FIND_RECORD);
        Optional<String> token;
        try {
            token = store.get(Preconditions.checkNotNull(title));
        } catch (StorageIOException e) {
            storageFailure("find a note", e);
            return;
        }
        if (token.isEmpty()) {
            transition(AccessState.RECORD_NOT_FOUND, "No note titled '%s'.".formatted(title));
            return;
        }
        String body;
        try {
            body = session.cipher().decrypt(token.get());
        } catch (CipherException e) {
            LOG.warn("Stored note failed to decrypt, it may have been tampered with or corrupted: {}", e.getMessage());
            transition(AccessState.RECORD_NOT_FOUND, "The note titled '%s' could not be decrypted.".formatted(title));
            return;
        }
        transition(AccessState.RECORD_FOUND, null);
        foundNote = new Note(title, body);
    }

    public void deleteRecord (String title) {
        expectState("delete a note", AccessState.DELETE_RECORD);
        boolean deleted;
        try {
            deleted = store.delete(Preconditions.checkNotNull(title));
        } catch (StorageIOException e) {
            storageFailure("delete a note", e);
            return;
        }
        transition(AccessState.LOGGED_ON, deleted
              ? "Note '%s' deleted.".formatted(title)
              : "No note titled '%s', nothing deleted.".formatted(title));
    }

    // ─── Password change ────────────────────────────────────────────────────────

    public void requestChangePassword () {
        expectAuthenticated("change the password");
        transition(AccessState.CHANGE_PASSWORD, null);
    }

    /// Replace the vault password. The current password is checked again, then every note is
    /// re-encrypted under a key derived from the new password (with the same salt) so that no note
    /// is left readable only by the old one. The re-encrypted notes and the new verifier are
    /// committed in one record store transaction, which decides whether the change happened.
    public void changePassword (String currentPassword, String newPassword) {
        expectState("change the password", AccessState.CHANGE_PASSWORD);
        boolean verifierFileSaved;
        try {
            CredentialManager.checkRequirements(newPassword);
            CredentialManager.authenticate(currentPassword, config.passwordSalt(), config.passwordVerifier())
                  .getOrThrow(AuthenticationFailedException::new)
                  .close();
            verifierFileSaved = reencryptAll(newPassword);
        } catch (RequirementsNotMetException | AuthenticationFailedException e) {
            LOG.info("Password change refused: {}", e.errorType());
            transition(AccessState.CHANGE_PASSWORD_FAILED, e.getMessage());
            return;
        } catch (CipherException e) {
            LOG.warn("Password change aborted, a stored note failed to decrypt: {}", e.getMessage());
            transition(AccessState.CHANGE_PASSWORD_FAILED,
                  "A stored note could not be decrypted, the password was not changed.");
            return;
        } catch (StorageIOException e) {
            LOG.error("Password change failed.", e);
            transition(AccessState.CHANGE_PASSWORD_FAILED, "The password was not changed: " + e.getMessage());
            return;
        }
        LOG.info("Vault password changed.");
        transition(AccessState.LOGGED_ON, verifierFileSaved
              ? "Password changed."
              : "Password changed. The verifier file could not be updated, it will be repaired on next start.");
    }

    /// Returns false if the change was committed but the verifier file could not be rewritten.
    private boolean reencryptAll (String newPassword) {
        Session newSession;
        byte[] newVerifier;
        try (Credential credential = CredentialManager.deriveKey(newPassword, config.passwordSalt())) {
            newSession = new Session(credential);
            newVerifier = credential.verifier();
        }
        boolean committed = false;
        try {
            NoteCipher oldCipher = session.cipher();
            NoteCipher newCipher = newSession.cipher();
            Map<String, String> bodies = new LinkedHashMap<>();
            for (String title : store.titles()) {
                String token = store.get(title).orElseThrow();
                bodies.put(title, newCipher.encrypt(oldCipher.decrypt(token)));
            }
            store.replaceAll(bodies, newVerifier);
            committed = true;
            LOG.debug("Re-encrypted {} notes under the new password.", bodies.size());
        } finally {
            if (!committed) {
                newSession.close();
                Arrays.fill(newVerifier, (byte) 0);
            }
        }
        session.close();
        session = newSession;
        config.setVerifier(newVerifier);
        Arrays.fill(newVerifier, (byte) 0);
        try {
            config.save();
            return true;
        } catch (ConfigIOException e) {
            LOG.error("Password changed, but the verifier file could not be rewritten.", e);
            return false;
        }
    }

    // ─── Hard reset ─────────────────────────────────────────────────────────────

    public void requestHardReset () {
        expectAuthenticated("delete all data");
        transition(AccessState.CONFIRM_HARD_RESET, null);
    }

    /// Delete every note and the password, after the user confirms by entering the password again.
    /// Afterward the vault is as if newly created, with a new salt.
    public void confirmHardReset (String password) {
        expectState("delete all data", AccessState.CONFIRM_HARD_RESET);
        Ret<Credential> authenticated = CredentialManager.authenticate(
              password, config.passwordSalt(), config.passwordVerifier());
        if (authenticated.isErr()) {
            LOG.info("Hard reset not confirmed: incorrect password provided.");
            transition(AccessState.CONFIRM_HARD_RESET_FAILED, "Incorrect password, nothing was deleted.");
            return;
        }
        authenticated.get().close();
        try {
            store.clear();
            config.erase();
        } catch (StorageIOException | ConfigIOException e) {
            LOG.error("Hard reset failed.", e);
            transition(AccessState.CONFIRM_HARD_RESET_FAILED, "Not all data could be deleted: " + e.getMessage());
            return;
        }
        config = VaultConfig.initialize(config.storagePath(), CredentialManager.generateSalt());
        LOG.info("Hard reset: all notes and the password have been deleted.");
        transition(AccessState.HARD_RESET, "All notes and the password have been deleted.");
    }

    // ─── Shutdown ───────────────────────────────────────────────────────────────

    /// Log off and release the record store. Used when the process exits.
    @Override
    public void close () {
        logoff();
        store.close();
    }

    // ─── Internals ──────────────────────────────────────────────────────────────

    private void transition (AccessState next, String newMessage) {
        if (!next.holdsSession() && session != null) {
            session.close();
            session = null;
        }
        Preconditions.checkState(!next.holdsSession() || session != null,
              "State %s requires a session but none is open.", next);
        LOG.trace("State {} -> {}", state, next);
        state = next;
        message = newMessage;
        foundNote = null;
    }

    /// In-session storage failures abandon the operation and return to the main menu. A failed write
    /// was rolled back by the store, so the vault remains usable.
    private void storageFailure (String intent, VaultException e) {
        LOG.error("Could not {}.", intent, e);
        transition(AccessState.LOGGED_ON, "Could not %s: %s".formatted(intent, e.getMessage()));
    }

    private void expectState (String intent, AccessState... allowed) {
        for (AccessState s : allowed) {
            if (state == s) return;
        }
        throw illegalIntent(intent);
    }

    private void expectAuthenticated (String intent) {
        if (!state.isAuthenticated()) throw illegalIntent(intent);
    }

    private IllegalStateException illegalIntent (String intent) {
        return new IllegalStateException("Cannot %s in state %s.".formatted(intent, state));
    }
}
