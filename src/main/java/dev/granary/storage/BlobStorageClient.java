package dev.granary.storage;

/**
 * Container-scoped blob access. Puts overwrite; no versioning is assumed.
 *
 * <p>Implementations wrap transport failures in {@link StorageException}.
 */
public interface BlobStorageClient {

    void put(String container, String path, byte[] content, String contentType);

    byte[] get(String container, String path);
}
