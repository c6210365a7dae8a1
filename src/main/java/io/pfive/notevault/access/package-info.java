// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// The access state machine and the session it guards. Front ends drive AccessStateMachine with
/// intents and render its state. They never touch keys, ciphers or the record store directly.
package io.pfive.notevault.access;
