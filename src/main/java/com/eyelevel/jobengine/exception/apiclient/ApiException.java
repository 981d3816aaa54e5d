package com.eyelevel.jobengine.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors the engine reports to its callers.
 *
 * <p>Carries an HTTP-like status code so the API collaborator can translate the error without
 * inspecting its type.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
