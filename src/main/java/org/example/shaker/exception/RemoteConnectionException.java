package org.example.shaker.exception;

/**
 * Exception thrown when the remote repository host is unreachable
 * or refuses the supplied credentials.
 */
public class RemoteConnectionException extends ShakerException {

    private final int statusCode;

    public RemoteConnectionException(String message) {
        this(message, -1);
    }

    public RemoteConnectionException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteConnectionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the remote, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
