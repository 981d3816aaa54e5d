package com.eyelevel.jobengine.exception.json;

import java.io.Serial;

/**
 * Raised when a broker payload or one of the ledger's JSON columns cannot be converted between
 * its text form and Java objects.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2270385361427790851L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
