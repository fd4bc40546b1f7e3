package com.eyelevel.bordereaux.service.storage;

import com.eyelevel.bordereaux.exception.BlobStorageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Stores blobs under a local directory, fanned out by the first two hex characters of the hash.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "filesystem", matchIfMissing = true)
public class FileSystemBlobStore implements BlobStore {

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final Path root;

    public FileSystemBlobStore(@Value("${app.storage.filesystem.root:./data/blobs}") final String root) {
        this.root = Path.of(root).toAbsolutePath().normalize();
        log.info("FileSystemBlobStore initialized at '{}'.", this.root);
    }

    @Override
    public StoredBlob store(final byte[] content) {
        final String hash = DigestUtils.sha256Hex(content);
        final File target = locate(hash);
        if (target.isFile()) {
            log.debug("Blob {} already stored.", hash);
            return new StoredBlob(hash, content.length, true);
        }
        try {
            FileUtils.writeByteArrayToFile(target, content);
        } catch (IOException e) {
            throw new BlobStorageException("Failed to write blob " + hash, e);
        }
        log.info("Stored blob {} ({} bytes).", hash, content.length);
        return new StoredBlob(hash, content.length, false);
    }

    @Override
    @Retryable(
            retryFor = {UncheckedIOException.class},
            noRetryFor = {BlobStorageException.class},
            maxAttemptsExpression = "#{${app.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.storage.retry.delay-ms:500}}"),
            listeners = {"blobStoreRetryListener"}
    )
    public byte[] fetch(final String contentHash) {
        final File source = locate(contentHash);
        if (!source.isFile()) {
            throw new BlobStorageException("No blob stored for hash " + contentHash);
        }
        try {
            return FileUtils.readFileToByteArray(source);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read blob " + contentHash, e);
        }
    }

    @Override
    public boolean exists(final String contentHash) {
        return locate(contentHash).isFile();
    }

    private File locate(final String contentHash) {
        if (contentHash == null || !SHA256_HEX.matcher(contentHash).matches()) {
            throw new BlobStorageException("Not a SHA-256 content hash: " + contentHash);
        }
        return root.resolve(contentHash.substring(0, 2)).resolve(contentHash).toFile();
    }
}
