// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Kinds of failure reported by the vault. Configuration failures are fatal at startup, everything
/// else is recoverable and ends up as a state transition with a message for the user.
package io.pfive.notevault.exception;
