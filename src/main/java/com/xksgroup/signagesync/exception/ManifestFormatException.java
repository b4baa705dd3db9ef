package com.xksgroup.signagesync.exception;

/**
 * The manifest or changelog document does not have any of the supported shapes.
 * The sync is aborted and the previous catalog stays in place.
 */
public class ManifestFormatException extends RuntimeException {

    public ManifestFormatException(String message) {
        super(message);
    }

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
