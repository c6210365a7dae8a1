// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/// Static helpers for the small files that make up the vault configuration. Every write goes to a
/// temporary file in the target's own directory, is flushed to disk, and is then renamed over the
/// target. A crash at any point leaves either the old or the new file, never a truncated one.
/// All methods throw IOException and leave it to the caller to decide what kind of failure it is.
public abstract class FileStore {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    // ObjectMapper is threadsafe once configured.
    public static final ObjectMapper objectMapper = new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT);

    public static void storeJson (Object object, Path target) throws IOException {
        storeBytes(objectMapper.writeValueAsBytes(object), target);
    }

    public static void storeBytes (byte[] bytes, Path target) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Path tempFile = Files.createTempFile(directory, target.getFileName().toString() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tempFile, WRITE, TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(tempFile, target);
        } finally {
            // Only still present if something above failed.
            Files.deleteIfExists(tempFile);
        }
    }

    private static void moveIntoPlace (Path source, Path target) throws IOException {
        try {
            Files.move(source, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Filesystem does not support atomic rename, replacing {} non-atomically.", target);
            Files.move(source, target, REPLACE_EXISTING);
        }
    }

    public static <T> T readJson (Path path, Class<T> type) throws IOException {
        return objectMapper.readValue(path.toFile(), type);
    }

    public static byte[] readBytes (Path path) throws IOException {
        return Files.readAllBytes(path);
    }

    /// Delete each of the given files, ignoring any that do not exist.
    public static void deleteAll (Path... paths) throws IOException {
        for (Path path : paths) {
            if (Files.deleteIfExists(path)) {
                LOG.debug("Deleted {}", path);
            }
        }
    }
}
