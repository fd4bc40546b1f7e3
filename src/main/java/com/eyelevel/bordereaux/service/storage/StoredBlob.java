package com.eyelevel.bordereaux.service.storage;

/**
 * @param contentHash SHA-256 hex of the content, the blob's address
 * @param duplicate   the store already held this content before the call
 */
public record StoredBlob(String contentHash, long size, boolean duplicate) {
}
