package com.xksgroup.signagesync.exception;

/**
 * A network call to the content API or a media host failed or answered with a non-2xx status.
 */
public class TransportException extends RuntimeException {

    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
