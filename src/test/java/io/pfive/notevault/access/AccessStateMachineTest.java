// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.access;

import io.pfive.notevault.exception.ConfigIOException;
import io.pfive.notevault.exception.StorageIOException;
import io.pfive.notevault.store.RecordStore;
import io.pfive.notevault.store.VaultConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static io.pfive.notevault.access.AccessState.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

/// Drives the state machine through complete user sessions against a real vault in a temporary
/// directory. Failures are injected with a mocked record store, or with spies wrapping the real
/// store and configuration.
@ExtendWith(MockitoExtension.class)
class AccessStateMachineTest {

    private static final String PASSWORD = "Str0ng!Pass";
    private static final String NEW_PASSWORD = "N3w&Better";

    @TempDir
    Path dir;

    @Mock
    RecordStore failingStore;

    private RecordStore store;
    private AccessStateMachine machine;

    @BeforeEach
    void openVault() {
        store = RecordStore.open(dir);
        machine = new AccessStateMachine(VaultConfig.openOrInitialize(dir), store);
    }

    @AfterEach
    void closeVault() {
        machine.close();
    }

    /// Open the vault directory again, as a new process would.
    private void reopenVault() {
        store = RecordStore.open(dir);
        machine = new AccessStateMachine(VaultConfig.openOrInitialize(dir), store);
    }

    private byte[] verifierOnDisk() throws IOException {
        return Files.readAllBytes(dir.resolve(VaultConfig.VERIFIER_FILE_NAME));
    }

    private void setPasswordAndLogIn() {
        machine.submitNewPassword(PASSWORD);
        machine.submitPassword(PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
    }

    private void addNote(String title, String body) {
        machine.selectAddRecord();
        machine.addRecord(title, body);
        assertEquals(LOGGED_ON, machine.state(), () -> machine.message().orElse(""));
    }

    private Optional<Note> find(String title) {
        machine.selectFindRecord();
        machine.findRecord(title);
        Optional<Note> note = machine.foundNote();
        machine.acknowledge();
        return note;
    }

    // ─── First password ─────────────────────────────────────────────────────────

    @Test
    void newVaultStartsEmpty() {
        assertEquals(EMPTY, machine.state());
        assertFalse(machine.hasSession());
    }

    @Test
    void weakPasswordIsRefused() {
        machine.submitNewPassword("short");
        assertEquals(INVALID_NEW_PASSWORD, machine.state());
        assertFalse(machine.config().hasVerifier());
        assertFalse(VaultConfig.exists(dir), "Nothing may be written for a refused password");
        machine.acknowledge();
        assertEquals(EMPTY, machine.state());
    }

    @Test
    void strongPasswordIsSavedAndUserMustLogIn() {
        machine.submitNewPassword(PASSWORD);
        assertEquals(LOGGED_OFF, machine.state());
        assertTrue(machine.config().hasVerifier());
        assertTrue(VaultConfig.exists(dir));
        assertFalse(machine.hasSession(), "Setting a password does not log the user in");
    }

    @Test
    void reopenedVaultStartsLoggedOff() {
        machine.submitNewPassword(PASSWORD);
        machine.close();
        store = RecordStore.open(dir);
        machine = new AccessStateMachine(VaultConfig.openOrInitialize(dir), store);
        assertEquals(LOGGED_OFF, machine.state());
        machine.submitPassword(PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
    }

    // ─── Login ──────────────────────────────────────────────────────────────────

    @Test
    void correctPasswordOpensSession() {
        setPasswordAndLogIn();
        assertTrue(machine.hasSession());
        assertTrue(machine.state().isAuthenticated());
    }

    @Test
    void wrongPasswordChangesNothing() throws IOException {
        machine.submitNewPassword(PASSWORD);
        byte[] configBefore = Files.readAllBytes(dir.resolve(VaultConfig.CONFIG_FILE_NAME));
        byte[] verifierBefore = Files.readAllBytes(dir.resolve(VaultConfig.VERIFIER_FILE_NAME));

        machine.submitPassword("Wr0ng!Pass");
        assertEquals(INVALID_PASSWORD, machine.state());
        assertFalse(machine.hasSession());
        assertTrue(machine.message().isPresent());
        assertArrayEquals(configBefore, Files.readAllBytes(dir.resolve(VaultConfig.CONFIG_FILE_NAME)));
        assertArrayEquals(verifierBefore, Files.readAllBytes(dir.resolve(VaultConfig.VERIFIER_FILE_NAME)));
        assertEquals(0, store.size());

        machine.acknowledge();
        assertEquals(LOGGED_OFF, machine.state());
    }

    @Test
    void logoffDestroysSession() {
        setPasswordAndLogIn();
        machine.logoff();
        assertEquals(LOGGED_OFF, machine.state());
        assertFalse(machine.hasSession());
        assertThrows(IllegalStateException.class, machine::selectAddRecord);
    }

    @Test
    void logoffWithoutSessionDoesNothing() {
        machine.logoff();
        assertEquals(EMPTY, machine.state());
    }

    // ─── Notes ──────────────────────────────────────────────────────────────────

    @Test
    void addedNoteCanBeFoundAndIsStoredEncrypted() {
        setPasswordAndLogIn();
        addNote("groceries", "milk, eggs, flour");

        String stored = store.get("groceries").orElseThrow();
        assertFalse(stored.contains("milk"), "Bodies must be encrypted at rest");

        machine.selectFindRecord();
        machine.findRecord("groceries");
        assertEquals(RECORD_FOUND, machine.state());
        assertEquals(new Note("groceries", "milk, eggs, flour"), machine.foundNote().orElseThrow());
        machine.acknowledge();
        assertEquals(LOGGED_ON, machine.state());
        assertTrue(machine.foundNote().isEmpty(), "The decrypted note is dropped on leaving RECORD_FOUND");
    }

    @Test
    void missingNoteIsReportedNotFound() {
        setPasswordAndLogIn();
        machine.selectFindRecord();
        machine.findRecord("nope");
        assertEquals(RECORD_NOT_FOUND, machine.state());
        assertTrue(machine.foundNote().isEmpty());
        machine.acknowledge();
        assertEquals(LOGGED_ON, machine.state());
    }

    @Test
    void duplicateTitleStaysInAddDialog() {
        setPasswordAndLogIn();
        addNote("todo", "first");
        machine.selectAddRecord();
        machine.addRecord("todo", "second");
        assertEquals(ADD_RECORD, machine.state());
        assertTrue(machine.message().orElseThrow().contains("todo"));
        machine.cancel();
        assertEquals("first", find("todo").orElseThrow().body());
    }

    @Test
    void emptyOrOversizedInputStaysInAddDialog() {
        machine = new AccessStateMachine(machine.config(), store, 10);
        setPasswordAndLogIn();
        machine.selectAddRecord();
        machine.addRecord("", "body");
        assertEquals(ADD_RECORD, machine.state());
        machine.addRecord("title", "");
        assertEquals(ADD_RECORD, machine.state());
        machine.addRecord("a title that is too long", "body");
        assertEquals(ADD_RECORD, machine.state());
        assertTrue(machine.message().orElseThrow().contains("10"));
        assertEquals(0, store.size());
    }

    @Test
    void deleteRemovesNote() {
        setPasswordAndLogIn();
        addNote("old", "stuff");
        machine.selectDeleteRecord();
        machine.deleteRecord("old");
        assertEquals(LOGGED_ON, machine.state());
        assertTrue(store.get("old").isEmpty());

        machine.selectDeleteRecord();
        machine.deleteRecord("old");
        assertEquals(LOGGED_ON, machine.state());
        assertTrue(machine.message().orElseThrow().contains("nothing deleted"));
    }

    @Test
    void tamperedNoteIsNotFoundAndCiphertextNeverShown() {
        setPasswordAndLogIn();
        addNote("secret", "the plan");
        String token = store.get("secret").orElseThrow();
        store.delete("secret");
        char last = token.charAt(token.length() - 10);
        store.put("secret", token.substring(0, token.length() - 10) + (last == 'A' ? 'B' : 'A')
              + token.substring(token.length() - 9));

        machine.selectFindRecord();
        machine.findRecord("secret");
        assertEquals(RECORD_NOT_FOUND, machine.state());
        assertTrue(machine.foundNote().isEmpty());
        assertFalse(machine.message().orElseThrow().contains("v1."));
    }

    @Test
    void cancelReturnsToMenu() {
        setPasswordAndLogIn();
        for (Runnable select : new Runnable[]{machine::selectAddRecord, machine::selectFindRecord,
              machine::selectDeleteRecord, machine::requestChangePassword, machine::requestHardReset}) {
            select.run();
            machine.cancel();
            assertEquals(LOGGED_ON, machine.state());
            assertTrue(machine.hasSession());
        }
    }

    // ─── Illegal intents ────────────────────────────────────────────────────────

    @Test
    void intentsOutsideTheirStatesAreProgrammingErrors() {
        assertThrows(IllegalStateException.class, () -> machine.submitPassword(PASSWORD));
        assertThrows(IllegalStateException.class, machine::acknowledge);
        assertThrows(IllegalStateException.class, machine::cancel);
        assertThrows(IllegalStateException.class, machine::selectFindRecord);

        setPasswordAndLogIn();
        assertThrows(IllegalStateException.class, () -> machine.submitNewPassword(PASSWORD));
        assertThrows(IllegalStateException.class, () -> machine.addRecord("t", "b"));
        assertThrows(IllegalStateException.class, () -> machine.findRecord("t"));
        assertThrows(IllegalStateException.class, () -> machine.confirmHardReset(PASSWORD));
        assertThrows(IllegalStateException.class, machine::acknowledge);

        machine.requestChangePassword();
        assertThrows(IllegalStateException.class, machine::selectAddRecord,
              "Note operations are not available inside the password dialog");
    }

    // ─── Password change ────────────────────────────────────────────────────────

    @Test
    void changedPasswordStillDecryptsOldNotes() {
        setPasswordAndLogIn();
        addNote("a", "alpha");
        addNote("b", "beta");
        String oldToken = store.get("a").orElseThrow();

        machine.requestChangePassword();
        machine.changePassword(PASSWORD, NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state(), () -> machine.message().orElse(""));
        assertNotEquals(oldToken, store.get("a").orElseThrow(), "Notes are re-encrypted under the new key");
        assertEquals("alpha", find("a").orElseThrow().body(), "The swapped session must read the new tokens");

        machine.logoff();
        machine.submitPassword(PASSWORD);
        assertEquals(INVALID_PASSWORD, machine.state());
        machine.acknowledge();
        machine.submitPassword(NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
        assertEquals("alpha", find("a").orElseThrow().body());
        assertEquals("beta", find("b").orElseThrow().body());
        assertArrayEquals(machine.config().passwordVerifier(), VaultConfig.load(dir).passwordVerifier(),
              "The new verifier must be on disk");
    }

    @Test
    void wrongCurrentPasswordRefusesChange() {
        setPasswordAndLogIn();
        machine.requestChangePassword();
        machine.changePassword("Wr0ng!Pass", NEW_PASSWORD);
        assertEquals(CHANGE_PASSWORD_FAILED, machine.state());
        assertTrue(machine.hasSession());
        machine.acknowledge();
        assertEquals(LOGGED_ON, machine.state());
        machine.logoff();
        machine.submitPassword(PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
    }

    @Test
    void weakNewPasswordRefusesChange() {
        setPasswordAndLogIn();
        machine.requestChangePassword();
        machine.changePassword(PASSWORD, "weak");
        assertEquals(CHANGE_PASSWORD_FAILED, machine.state());
        assertTrue(machine.message().orElseThrow().contains("requirements"));
    }

    @Test
    void undecryptableNoteAbortsChangeWithNothingModified() {
        setPasswordAndLogIn();
        addNote("good", "fine");
        store.put("bad", "v1.AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA");
        String goodToken = store.get("good").orElseThrow();
        byte[] verifier = machine.config().passwordVerifier();

        machine.requestChangePassword();
        machine.changePassword(PASSWORD, NEW_PASSWORD);
        assertEquals(CHANGE_PASSWORD_FAILED, machine.state());
        assertEquals(goodToken, store.get("good").orElseThrow());
        assertArrayEquals(verifier, VaultConfig.load(dir).passwordVerifier());
        machine.acknowledge();
        assertEquals("fine", find("good").orElseThrow().body(), "The old session must still work");
    }

    // ─── Password change failures ──────────────────────────────────────────────

    @Test
    void failedCommitLeavesOldPasswordAndNotes() throws IOException {
        machine.submitNewPassword(PASSWORD);
        RecordStore spiedStore = spy(store);
        machine = new AccessStateMachine(machine.config(), spiedStore);
        machine.submitPassword(PASSWORD);
        addNote("a", "alpha");
        byte[] verifierBefore = verifierOnDisk();
        doThrow(new StorageIOException("commit failed", null)).when(spiedStore).replaceAll(anyMap(), any(byte[].class));

        machine.requestChangePassword();
        machine.changePassword(PASSWORD, NEW_PASSWORD);
        assertEquals(CHANGE_PASSWORD_FAILED, machine.state());
        assertTrue(machine.message().orElseThrow().contains("commit failed"));
        assertArrayEquals(verifierBefore, verifierOnDisk(), "The verifier file must not change");
        assertArrayEquals(verifierBefore, machine.config().passwordVerifier());

        machine.acknowledge();
        assertEquals("alpha", find("a").orElseThrow().body(), "The old session must still decrypt");
        machine.logoff();
        machine.submitPassword(PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
        assertEquals("alpha", find("a").orElseThrow().body());
    }

    @Test
    void verifierFileWriteFailureAfterCommitIsRepairedOnNextStart() throws IOException {
        machine.submitNewPassword(PASSWORD);
        VaultConfig spiedConfig = spy(machine.config());
        machine = new AccessStateMachine(spiedConfig, store);
        machine.submitPassword(PASSWORD);
        addNote("a", "alpha");
        doThrow(new ConfigIOException("disk full", null)).when(spiedConfig).save();

        machine.requestChangePassword();
        machine.changePassword(PASSWORD, NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state(), "The committed change stands");
        assertTrue(machine.message().orElseThrow().contains("repaired"));
        assertEquals("alpha", find("a").orElseThrow().body());

        machine.close();
        reopenVault();
        machine.submitPassword(PASSWORD);
        assertEquals(INVALID_PASSWORD, machine.state());
        machine.acknowledge();
        machine.submitPassword(NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
        assertEquals("alpha", find("a").orElseThrow().body());
        assertArrayEquals(machine.config().passwordVerifier(), verifierOnDisk(), "The verifier file was rewritten");
    }

    @Test
    void processDeathAfterCommitKeepsNotesReadableWithNewPassword() {
        machine.submitNewPassword(PASSWORD);
        VaultConfig spiedConfig = spy(machine.config());
        machine = new AccessStateMachine(spiedConfig, store);
        machine.submitPassword(PASSWORD);
        addNote("a", "alpha");
        addNote("b", "beta");
        doThrow(new Error("process killed")).when(spiedConfig).save();

        machine.requestChangePassword();
        assertThrows(Error.class, () -> machine.changePassword(PASSWORD, NEW_PASSWORD));
        store.close();

        reopenVault();
        machine.submitPassword(PASSWORD);
        assertEquals(INVALID_PASSWORD, machine.state());
        machine.acknowledge();
        machine.submitPassword(NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
        assertEquals("alpha", find("a").orElseThrow().body());
        assertEquals("beta", find("b").orElseThrow().body());
    }

    @Test
    void processDeathWhileWritingVerifierFileKeepsNotesReadable() {
        machine.submitNewPassword(PASSWORD);
        VaultConfig spiedConfig = spy(machine.config());
        machine = new AccessStateMachine(spiedConfig, store);
        machine.submitPassword(PASSWORD);
        addNote("a", "alpha");
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new Error("process killed");
        }).when(spiedConfig).save();

        machine.requestChangePassword();
        assertThrows(Error.class, () -> machine.changePassword(PASSWORD, NEW_PASSWORD));
        store.close();

        reopenVault();
        machine.submitPassword(NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
        assertEquals("alpha", find("a").orElseThrow().body());
    }

    @Test
    void processDeathBeforeCommitKeepsOldPassword() {
        machine.submitNewPassword(PASSWORD);
        RecordStore spiedStore = spy(store);
        machine = new AccessStateMachine(machine.config(), spiedStore);
        machine.submitPassword(PASSWORD);
        addNote("a", "alpha");
        doThrow(new Error("process killed")).when(spiedStore).replaceAll(anyMap(), any(byte[].class));

        machine.requestChangePassword();
        assertThrows(Error.class, () -> machine.changePassword(PASSWORD, NEW_PASSWORD));
        spiedStore.close();

        reopenVault();
        machine.submitPassword(NEW_PASSWORD);
        assertEquals(INVALID_PASSWORD, machine.state());
        machine.acknowledge();
        machine.submitPassword(PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
        assertEquals("alpha", find("a").orElseThrow().body());
    }

    @Test
    void failedFirstPasswordSaveLeavesVaultUninitialized() {
        VaultConfig spiedConfig = spy(machine.config());
        machine = new AccessStateMachine(spiedConfig, store);
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new ConfigIOException("disk full", null);
        }).when(spiedConfig).save();

        machine.submitNewPassword(PASSWORD);
        assertEquals(EMPTY, machine.state());
        assertTrue(machine.message().orElseThrow().contains("could not be saved"));
        assertFalse(machine.config().hasVerifier());
        assertFalse(VaultConfig.exists(dir), "Partially written files must be removed");
    }

    // ─── Hard reset ─────────────────────────────────────────────────────────────

    @Test
    void hardResetDeletesEverythingAndStartsOver() {
        setPasswordAndLogIn();
        addNote("a", "alpha");
        String oldSalt = machine.config().passwordSalt();

        machine.requestHardReset();
        machine.confirmHardReset(PASSWORD);
        assertEquals(HARD_RESET, machine.state());
        assertFalse(machine.hasSession());
        assertEquals(0, store.size());
        assertFalse(VaultConfig.exists(dir));

        machine.acknowledge();
        assertEquals(EMPTY, machine.state());
        assertNotEquals(oldSalt, machine.config().passwordSalt(), "A reset vault gets a new salt");
        machine.submitNewPassword(NEW_PASSWORD);
        machine.submitPassword(NEW_PASSWORD);
        assertEquals(LOGGED_ON, machine.state());
    }

    @Test
    void hardResetNeedsTheRightPassword() {
        setPasswordAndLogIn();
        addNote("a", "alpha");
        machine.requestHardReset();
        machine.confirmHardReset("Wr0ng!Pass");
        assertEquals(CONFIRM_HARD_RESET_FAILED, machine.state());
        assertEquals(1, store.size());
        assertTrue(VaultConfig.exists(dir));
        machine.acknowledge();
        assertEquals(LOGGED_ON, machine.state());
    }

    // ─── Storage failures ───────────────────────────────────────────────────────

    @Test
    void storageFailureReturnsToMenuWithSessionIntact() {
        machine.submitNewPassword(PASSWORD);
        VaultConfig config = machine.config();
        machine.close();

        doThrow(new StorageIOException("disk full", null)).when(failingStore).put(anyString(), anyString());
        when(failingStore.get(anyString())).thenThrow(new StorageIOException("disk gone", null));
        machine = new AccessStateMachine(config, failingStore);
        machine.submitPassword(PASSWORD);

        machine.selectAddRecord();
        machine.addRecord("t", "b");
        assertEquals(LOGGED_ON, machine.state());
        assertTrue(machine.message().orElseThrow().contains("disk full"));
        assertTrue(machine.hasSession());

        machine.selectFindRecord();
        machine.findRecord("t");
        assertEquals(LOGGED_ON, machine.state());
        assertTrue(machine.message().orElseThrow().contains("disk gone"));
    }

    @Test
    void closeLogsOffAndClosesStore() {
        setPasswordAndLogIn();
        machine.close();
        assertFalse(machine.hasSession());
        assertEquals(LOGGED_OFF, machine.state());
        assertTrue(store.isClosed());
    }
}
