package de.jwiegmann.archive.control.worker;

public enum ProcessingOutcome {
    PROCESSED,
    FAILED,
    // bereits von einem anderen Durchlauf übernommen
    SKIPPED
}
