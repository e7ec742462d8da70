package com.collabrouter.common;

import java.io.IOException;

/**
 * A frame arrived that could not be turned into an {@link Envelope}. Always fatal to the
 * connection it was read from.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
