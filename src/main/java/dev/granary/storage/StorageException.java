package dev.granary.storage;

/** Blob write, blob read or metadata insert failed for a reason other than a duplicate. */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
