package com.eyelevel.jobengine.exception;

import java.io.Serial;

/**
 * A failure reported by the message broker.
 */
public class QueueBackendException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6107524402870137712L;

    public QueueBackendException(String message) {
        super(message);
    }

    public QueueBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
