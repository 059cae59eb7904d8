package net.findmytask.exception;

/**
 * Reading or writing the key-value store that backs search history failed.
 * RETRYABLE: Yes for I/O errors, No for a corrupt store file
 */
public class KeyValueStoreException extends RuntimeException {

    private final String key;

    public KeyValueStoreException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /** Key being accessed when the failure occurred, or null for whole-store operations. */
    public String getKey() {
        return key;
    }
}
