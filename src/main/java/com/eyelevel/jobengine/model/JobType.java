package com.eyelevel.jobengine.model;

/**
 * The kinds of document-processing work the engine can schedule. Each type is routed to a queue
 * by the {@link com.eyelevel.jobengine.broker.QueueRegistry}; a type without a queue is accepted
 * but immediately cancelled.
 */
public enum JobType {
    PDF_ACCESSIBILITY,
    EPUB_ACCESSIBILITY,
    VPAT_GENERATION,
    ALT_TEXT_GENERATION,
    METADATA_EXTRACTION,
    BATCH_VALIDATION,
    ACR_WORKFLOW,
    PLAGIARISM_CHECK,
    CITATION_VALIDATION,
    CITATION_DETECTION,
    STYLE_VALIDATION,
    EDITORIAL_FULL
}
