package com.eyelevel.jobengine.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the message broker is unavailable (HTTP 503).
 *
 * <p>Thrown when no broker is configured at all, or when the broker rejects an enqueue. The caller
 * is expected to resubmit later; the engine does not retry on its behalf.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2812514621225838422L;

    /**
     * Constructs a new ServiceUnavailableException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public ServiceUnavailableException(String message) {
        super(message, 503);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
