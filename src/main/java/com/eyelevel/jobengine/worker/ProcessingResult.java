package com.eyelevel.jobengine.worker;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Outcome of a {@link JobProcessor} run.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessingResult {
    private final boolean success;
    private final Map<String, Object> data;
    private final String error;

    public static ProcessingResult success(final Map<String, Object> data) {
        return new ProcessingResult(true, data == null ? Map.of() : data, null);
    }

    public static ProcessingResult failure(final String error) {
        return new ProcessingResult(false, null, error);
    }
}
