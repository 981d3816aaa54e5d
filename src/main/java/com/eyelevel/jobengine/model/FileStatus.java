package com.eyelevel.jobengine.model;

/**
 * Processing state of an uploaded {@link StoredFile}.
 */
public enum FileStatus {
    UPLOADED,
    PROCESSING,
    PROCESSED,
    ERROR
}
