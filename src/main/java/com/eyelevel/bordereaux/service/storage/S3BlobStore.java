package com.eyelevel.bordereaux.service.storage;

import com.eyelevel.bordereaux.exception.BlobStorageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Stores blobs in S3 under {@code blobs/<sha256>}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class S3BlobStore implements BlobStore {

    private static final String KEY_PREFIX = "blobs/";

    private final S3Client s3Client;
    private final String bucketName;

    public S3BlobStore(final S3Client s3Client, @Value("${aws.s3.bucket}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3BlobStore initialized for bucket '{}'.", bucketName);
    }

    @Override
    public StoredBlob store(final byte[] content) {
        final String hash = DigestUtils.sha256Hex(content);
        if (exists(hash)) {
            log.debug("Blob {} already present in bucket '{}'.", hash, bucketName);
            return new StoredBlob(hash, content.length, true);
        }
        try {
            s3Client.putObject(PutObjectRequest.builder().bucket(bucketName).key(key(hash)).build(),
                               RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to upload blob " + hash, e);
        }
        log.info("Uploaded blob {} ({} bytes) to S3.", hash, content.length);
        return new StoredBlob(hash, content.length, false);
    }

    @Override
    @Retryable(
            retryFor = {SdkException.class},
            noRetryFor = {NoSuchKeyException.class},
            maxAttemptsExpression = "#{${app.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.storage.retry.delay-ms:500}}"),
            listeners = {"blobStoreRetryListener"}
    )
    public byte[] fetch(final String contentHash) {
        log.debug("Downloading blob {} from S3.", contentHash);
        final GetObjectRequest request = GetObjectRequest.builder().bucket(bucketName).key(key(contentHash)).build();
        return s3Client.getObjectAsBytes(request).asByteArray();
    }

    @Override
    public boolean exists(final String contentHash) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key(contentHash)).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        }
    }

    private static String key(final String contentHash) {
        return KEY_PREFIX + contentHash;
    }
}
