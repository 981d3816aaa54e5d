package com.eyelevel.jobengine.worker;

public enum WorkerEventType {
    COMPLETED,
    FAILED,
    PROGRESS,
    STALLED,
    ERROR
}
