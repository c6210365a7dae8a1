// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Persistent state of a vault, all of it inside one storage directory: the configuration (salt and
/// password verifier) and the record database. Nothing in this package encrypts or decrypts.
package io.pfive.notevault.store;
