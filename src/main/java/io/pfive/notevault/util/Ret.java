// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.util;

import java.util.function.Function;

/// The return value of an operation, containing either a result or an error message.
///
/// Optional only says that something is missing, not why. Ret carries a message on failure, which
/// is what the vault needs for expected, recoverable failures like a mistyped password: the caller
/// turns the message into a state transition instead of catching an exception. Failures that are
/// exceptional (unreadable files, corrupt tokens) are still thrown as VaultException subclasses.
///
/// Ok and Err are subclasses of abstract Ret, so neither carries an empty field for the other.
public abstract class Ret<T> {

    public boolean isErr () {
        return false;
    }

    public boolean isOk () {
        return false;
    }

    /// If the return value is Ok, returns the value. Calling this on an error is a programming error:
    /// check isOk() first, or use getOrThrow().
    public final T get () {
        return getOrThrow(message -> new IllegalStateException("No value present, error was: " + message));
    }

    /// Unwrap the value, turning an error message into the exception of the caller's choosing.
    /// Typically used with a VaultException constructor reference, e.g.
    /// `ret.getOrThrow(AuthenticationFailedException::new)`.
    public abstract T getOrThrow (Function<String, ? extends RuntimeException> exceptionFactory);

    /// Returns the error message. Will throw an exception if a return value is present instead of error.
    public abstract String errorMessage ();

    // Factory methods to allow static imports: return ok(x); or return err("Description");

    public static <T> Ret<T> ok (T result) {
        return new Ok<>(result);
    }

    public static <T> Ret<T> err (String message) {
        return new Err<>(message);
    }

    /// An Ok or Err instance should never wrap a null reference.
    private static void checkNotNull (Object o) {
        if (o == null) {
            throw new IllegalArgumentException("Supplied result or error must not be null.");
        }
    }

    // Java already defines an Error type. Use Err, scoped inside Ret, to avoid confusion.

    public static final class Err<T> extends Ret<T> {
        public final String message; // Cannot be null.

        private Err (String message) {
            checkNotNull(message);
            this.message = message;
        }

        @Override
        public boolean isErr () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, ? extends RuntimeException> exceptionFactory) {
            throw exceptionFactory.apply(message);
        }

        @Override
        public String errorMessage () {
            return message;
        }

        @Override
        public String toString () {
            return "Err<%s>".formatted(message);
        }
    }

    public static final class Ok<T> extends Ret<T> {
        public final T result; // Cannot be null.

        private Ok (T result) {
            checkNotNull(result);
            this.result = result;
        }

        @Override
        public boolean isOk () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, ? extends RuntimeException> exceptionFactory) {
            return result;
        }

        @Override
        public String errorMessage () {
            throw new IllegalStateException("This is not an error, so has no error message.");
        }

        /// Does not print the wrapped value, which may be key material.
        @Override
        public String toString () {
            return "Ok<%s>".formatted(result.getClass().getSimpleName());
        }
    }

}
