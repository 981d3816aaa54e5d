package com.eyelevel.jobengine.scheduler;

/**
 * Outcome of one watchdog tick.
 *
 * @param skipped   true if the tick did nothing because another tick was running or no broker is configured.
 * @param scanned   stale entities found.
 * @param recovered entities handed a fresh job.
 * @param failed    entities given up on after too many recoveries.
 * @param errors    entities whose recovery threw; they are retried on a later tick.
 */
public record RecoveryReport(boolean skipped, int scanned, int recovered, int failed, int errors) {

    static RecoveryReport skippedRun() {
        return new RecoveryReport(true, 0, 0, 0, 0);
    }
}
