package com.eyelevel.jobengine.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a request cannot be honoured as submitted (HTTP 400), for example a
 * malformed submission or an attempt to cancel a job that already finished.
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4414516763190851688L;

    /**
     * Constructs a new BadRequestException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public BadRequestException(String message) {
        super(message, 400);
    }
}
