// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.store;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.pfive.notevault.exception.DuplicateTitleException;
import io.pfive.notevault.exception.StorageIOException;
import org.mapdb.BTreeMap;
import org.mapdb.DB;
import org.mapdb.DBException;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Persistent map from note title to note body, kept in a MapDB file database in the storage
/// directory. The store knows nothing about encryption: bodies arrive here already encrypted and
/// are handed back unchanged. Titles are stored in the clear and are unique. Next to the records it
/// keeps the verifier committed by the last password change, see committedVerifier().
///
/// Transactions are enabled, so every write is committed to the write-ahead log before the call
/// returns and a failed write is rolled back. Not threadsafe, and only one process may have the
/// database open at a time (MapDB locks the file).
public class RecordStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String RECORDS_FILE_NAME = "records.db";
    private static final String MAP_NAME = "records";
    private static final String META_NAME = "meta";
    private static final String VERIFIER_KEY = "verifier";

    private DB db;
    private BTreeMap<String, String> records;
    // Bookkeeping committed together with the records. Holds the verifier after a password change.
    private BTreeMap<String, byte[]> meta;

    private RecordStore (DB db, BTreeMap<String, String> records, BTreeMap<String, byte[]> meta) {
        this.db = db;
        this.records = records;
        this.meta = meta;
    }

    /// Open the record database in the given directory, creating the file and map if absent.
    public static RecordStore open (Path storagePath) {
        Path dbPath = storagePath.resolve(RECORDS_FILE_NAME);
        try {
            DB db = DBMaker.fileDB(dbPath.toFile())
                  .transactionEnable()
                  .make();
            BTreeMap<String, String> records = db.treeMap(MAP_NAME, Serializer.STRING, Serializer.STRING)
                  .createOrOpen();
            BTreeMap<String, byte[]> meta = db.treeMap(META_NAME, Serializer.STRING, Serializer.BYTE_ARRAY)
                  .createOrOpen();
            LOG.debug("Opened record store {} with {} records.", dbPath, records.size());
            return new RecordStore(db, records, meta);
        } catch (DBException e) {
            throw new StorageIOException("cannot open " + dbPath, e);
        }
    }

    public Optional<String> get (String title) {
        checkOpen();
        Preconditions.checkNotNull(title);
        try {
            return Optional.ofNullable(records.get(title));
        } catch (DBException e) {
            throw new StorageIOException("cannot read record", e);
        }
    }

    /// Insert a new record. An existing title is never overwritten: DuplicateTitleException is
    /// thrown and the store is left unchanged.
    public void put (String title, String body) {
        checkOpen();
        Preconditions.checkNotNull(title);
        Preconditions.checkNotNull(body);
        String existing;
        try {
            existing = records.putIfAbsent(title, body);
            if (existing == null) {
                db.commit();
            }
        } catch (DBException e) {
            throw rollback("cannot write record", e);
        }
        if (existing != null) {
            throw new DuplicateTitleException(title);
        }
    }

    /// Remove the record with the given title. Returns false, without error, if there was none.
    public boolean delete (String title) {
        checkOpen();
        Preconditions.checkNotNull(title);
        try {
            boolean removed = records.remove(title) != null;
            if (removed) {
                db.commit();
            }
            return removed;
        } catch (DBException e) {
            throw rollback("cannot delete record", e);
        }
    }

    /// All titles in ascending order.
    public List<String> titles () {
        checkOpen();
        try {
            return ImmutableList.copyOf(records.keySet());
        } catch (DBException e) {
            throw new StorageIOException("cannot list records", e);
        }
    }

    public int size () {
        checkOpen();
        return records.size();
    }

    /// The password verifier committed by the last password change, if any. The record database is
    /// the authority on which key its bodies are encrypted under: a verifier file that disagrees
    /// with this value is stale.
    public Optional<byte[]> committedVerifier () {
        checkOpen();
        try {
            return Optional.ofNullable(meta.get(VERIFIER_KEY)).map(byte[]::clone);
        } catch (DBException e) {
            throw new StorageIOException("cannot read committed verifier", e);
        }
    }

    /// Replace the bodies of existing records and record the verifier of the key they are now
    /// encrypted under, in a single transaction. The commit is the moment the password change
    /// happens: if it fails, everything is rolled back and the store is as it was.
    public void replaceAll (Map<String, String> bodies, byte[] verifier) {
        checkOpen();
        Preconditions.checkNotNull(verifier);
        for (String title : bodies.keySet()) {
            Preconditions.checkArgument(records.containsKey(title), "No record to replace for title '%s'", title);
        }
        try {
            for (Map.Entry<String, String> entry : bodies.entrySet()) {
                records.put(entry.getKey(), Preconditions.checkNotNull(entry.getValue()));
            }
            meta.put(VERIFIER_KEY, verifier.clone());
            db.commit();
        } catch (DBException e) {
            throw rollback("cannot commit replacement records", e);
        }
        LOG.debug("Replaced {} record bodies.", bodies.size());
    }

    /// Remove every record in one transaction.
    public void clear () {
        checkOpen();
        try {
            int n = records.size();
            records.clear();
            meta.clear();
            db.commit();
            LOG.info("Cleared {} records.", n);
        } catch (DBException e) {
            throw rollback("cannot clear records", e);
        }
    }

    /// Release the database. Any later call other than close() is a programming error.
    @Override
    public void close () {
        if (db == null) return;
        try {
            db.close();
        } catch (DBException e) {
            throw new StorageIOException("cannot close record store", e);
        } finally {
            db = null;
            records = null;
            meta = null;
        }
    }

    public boolean isClosed () {
        return db == null;
    }

    private void checkOpen () {
        Preconditions.checkState(db != null, "Record store has been closed.");
    }

    private StorageIOException rollback (String message, DBException cause) {
        StorageIOException exception = new StorageIOException(message, cause);
        try {
            db.rollback();
        } catch (DBException e) {
            exception.addSuppressed(e);
        }
        return exception;
    }
}
