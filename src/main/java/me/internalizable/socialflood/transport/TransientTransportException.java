package me.internalizable.socialflood.transport;

/**
 * A failure worth retrying: connect or read errors, timeouts and 5xx responses.
 */
public class TransientTransportException extends TransportException {

    public TransientTransportException(String message, int status) {
        super(message, status);
    }

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
