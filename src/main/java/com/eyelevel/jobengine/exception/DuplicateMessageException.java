package com.eyelevel.jobengine.exception;

import java.io.Serial;

/**
 * Thrown when a message id is already known to a queue. Brokers never accept the same id twice,
 * which is why recovery always mints a new job id.
 */
public class DuplicateMessageException extends QueueBackendException {
    @Serial
    private static final long serialVersionUID = -8993016220417536950L;

    public DuplicateMessageException(String queueName, String messageId) {
        super("Message " + messageId + " already exists in queue " + queueName);
    }
}
