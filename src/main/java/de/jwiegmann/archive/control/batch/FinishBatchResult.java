package de.jwiegmann.archive.control.batch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class FinishBatchResult {
    private String batchId;
    private String manifestFileId;
    private int totalProcessedCount;
    private boolean alreadyFinished;
}
