package com.eyelevel.jobengine.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a resource was not found (HTTP 404).
 *
 * <p>Also raised when the resource exists but belongs to another tenant, so callers cannot learn
 * which foreign ids exist.
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    /**
     * Constructs a new NotFoundException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public NotFoundException(String message) {
        super(message, 404);
    }
}
