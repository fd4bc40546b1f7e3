package com.eyelevel.bordereaux.service.storage;

/**
 * Content-addressed storage for raw bordereau bytes. Storing the same content twice keeps one copy.
 */
public interface BlobStore {

    StoredBlob store(byte[] content);

    /**
     * @throws com.eyelevel.bordereaux.exception.BlobStorageException if no blob exists for the hash
     */
    byte[] fetch(String contentHash);

    boolean exists(String contentHash);
}
