package me.internalizable.socialflood.transport;

/**
 * An outbound request that did not produce a usable response.
 */
public class TransportException extends Exception {

    /** Status code used when no response was received. */
    public static final int NO_STATUS = 0;

    private final int status;

    public TransportException(String message, int status) {
        super(message);
        this.status = status;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_STATUS;
    }

    public int getStatus() {
        return status;
    }

    public boolean hasStatus() {
        return status != NO_STATUS;
    }
}
