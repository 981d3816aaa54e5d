package com.eyelevel.jobengine.exception;

import java.io.Serial;

/**
 * Thrown by the delivery handler when a processor fails, after the ledger has been updated.
 * The worker hands the message back to the broker, whose retry policy decides on redelivery.
 * NOTE: This is an internal exception and never reaches API callers.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
