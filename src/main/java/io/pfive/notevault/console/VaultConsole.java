// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.console;

import io.pfive.notevault.access.AccessState;
import io.pfive.notevault.access.AccessStateMachine;
import io.pfive.notevault.access.Note;
import io.pfive.notevault.authentication.CredentialManager;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/// Line-oriented front end for the vault. Each pass of the loop shows the prompt for the current
/// state of the AccessStateMachine, reads what the user types, and forwards it as one intent. All
/// decisions are made by the state machine, this class only reads and prints.
///
/// Passwords are read through java.io.Console without echo when a console is supplied. Otherwise
/// (tests, redirected input) they are read as ordinary lines.
public class VaultConsole {

    public static final String APP_NAME = "NoteVault";
    private static final String END_OF_BODY = ".";

    private final AccessStateMachine machine;
    private final BufferedReader in;
    private final PrintStream out;
    private final Console console; // Null when passwords are read from the line reader.

    public VaultConsole (AccessStateMachine machine, BufferedReader in, PrintStream out, Console console) {
        this.machine = machine;
        this.in = in;
        this.out = out;
        this.console = console;
    }

    /// A console on the process's standard streams. Password echo is suppressed if requested and the
    /// process is attached to a terminal.
    public static VaultConsole forTerminal (AccessStateMachine machine, boolean hidePasswordInput) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Console console = hidePasswordInput ? System.console() : null;
        return new VaultConsole(machine, in, System.out, console);
    }

    /// Run until the user quits or input ends.
    public void run () throws IOException {
        out.printf("%s -- a minimalistic secure notes storage app%n", APP_NAME);
        while (step()) {
            machine.message().ifPresent(out::println);
        }
        out.println("Bye.");
    }

    /// Handle one prompt. Returns false when the user has asked to quit or input has ended.
    private boolean step () throws IOException {
        AccessState state = machine.state();
        switch (state) {
            case EMPTY -> {
                return setNewPassword();
            }
            case LOGGED_OFF -> {
                String password = readPassword("Welcome to " + APP_NAME + "! Please enter your password (or 'quit'): ");
                if (password == null || password.equals("quit")) return false;
                if (!password.isEmpty()) machine.submitPassword(password);
                return true;
            }
            case INVALID_NEW_PASSWORD -> {
                out.println("Error: provided password did not satisfy requirements!");
                return acknowledge("Try again");
            }
            case INVALID_PASSWORD -> {
                out.println("Error: wrong password! The app remains locked.");
                return acknowledge("Try again");
            }
            case RECORD_FOUND -> {
                Note note = machine.foundNote().orElseThrow();
                out.printf("=== %s ===%n%s%n", note.title(), note.body());
                machine.acknowledge();
                return true;
            }
            case RECORD_NOT_FOUND -> {
                machine.acknowledge();
                return true;
            }
            case LOGGED_ON -> {
                return mainMenu();
            }
            case ADD_RECORD -> {
                return addNote();
            }
            case FIND_RECORD -> {
                String title = readLine("Title of the note to find (empty to cancel): ");
                if (title == null) return false;
                if (title.isEmpty()) machine.cancel();
                else machine.findRecord(title);
                return true;
            }
            case DELETE_RECORD -> {
                String title = readLine("Title of the note to delete (empty to cancel): ");
                if (title == null) return false;
                if (title.isEmpty()) machine.cancel();
                else machine.deleteRecord(title);
                return true;
            }
            case CHANGE_PASSWORD -> {
                return changePassword();
            }
            case CONFIRM_HARD_RESET -> {
                out.println("This deletes all notes and the password.");
                String password = readPassword("Enter your password to confirm (empty to cancel): ");
                if (password == null) return false;
                if (password.isEmpty()) machine.cancel();
                else machine.confirmHardReset(password);
                return true;
            }
            case CHANGE_PASSWORD_FAILED, CONFIRM_HARD_RESET_FAILED, HARD_RESET -> {
                return acknowledge("Continue");
            }
            default -> throw new IllegalStateException("No prompt for state " + state);
        }
    }

    private boolean setNewPassword () throws IOException {
        out.println("Set a new password to begin.");
        out.println(CredentialManager.REQUIREMENTS);
        String password = readPassword("New password: ");
        if (password == null) return false;
        if (password.isEmpty()) return true;
        String confirmation = readPassword("Confirm new password: ");
        if (confirmation == null) return false;
        if (!password.equals(confirmation)) {
            out.println("The passwords do not match.");
            return true;
        }
        machine.submitNewPassword(password);
        return true;
    }

    private boolean mainMenu () throws IOException {
        String choice = readLine("[a]dd  [f]ind  [d]elete  [c]hange password  [r]eset  [l]og off  [q]uit > ");
        if (choice == null) return false;
        switch (choice.trim()) {
            case "a" -> machine.selectAddRecord();
            case "f" -> machine.selectFindRecord();
            case "d" -> machine.selectDeleteRecord();
            case "c" -> machine.requestChangePassword();
            case "r" -> machine.requestHardReset();
            case "l" -> machine.logoff();
            case "q" -> {
                return false;
            }
            default -> out.println("Unknown option: " + choice);
        }
        return true;
    }

    private boolean addNote () throws IOException {
        String title = readLine("Note title (empty to cancel): ");
        if (title == null) return false;
        if (title.isEmpty()) {
            machine.cancel();
            return true;
        }
        out.printf("Note body, end with a line containing only '%s':%n", END_OF_BODY);
        StringBuilder body = new StringBuilder();
        for (String line = in.readLine(); line != null && !line.equals(END_OF_BODY); line = in.readLine()) {
            if (body.length() > 0) body.append('\n');
            body.append(line);
        }
        machine.addRecord(title, body.toString());
        return true;
    }

    private boolean changePassword () throws IOException {
        String current = readPassword("Current password (empty to cancel): ");
        if (current == null) return false;
        if (current.isEmpty()) {
            machine.cancel();
            return true;
        }
        out.println(CredentialManager.REQUIREMENTS);
        String replacement = readPassword("New password: ");
        if (replacement == null) return false;
        String confirmation = readPassword("Confirm new password: ");
        if (confirmation == null) return false;
        if (!replacement.equals(confirmation)) {
            out.println("The passwords do not match, password unchanged.");
            machine.cancel();
            return true;
        }
        machine.changePassword(current, replacement);
        return true;
    }

    private boolean acknowledge (String label) throws IOException {
        if (readLine("[" + label + "] ") == null) return false;
        machine.acknowledge();
        return true;
    }

    private String readLine (String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        return in.readLine();
    }

    private String readPassword (String prompt) throws IOException {
        if (console == null) {
            return readLine(prompt);
        }
        char[] chars = console.readPassword("%s", prompt);
        return chars == null ? null : new String(chars);
    }
}
