package de.jwiegmann.archive.control.worker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerCycleReport {
    private int manifestsReconciled;
    private int filesSeen;
    private int skippedExisting;
    private int processed;
    private int errors;
    private boolean stoppedByBackpressure;
    private boolean stoppedByCycleLimit;
}
