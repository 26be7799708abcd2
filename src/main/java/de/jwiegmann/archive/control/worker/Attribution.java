package de.jwiegmann.archive.control.worker;

import de.jwiegmann.archive.entity.BatchContext;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Herkunft einer Datei laut Manifest bzw. offenem Batch.
 */
@Getter
@ToString
@AllArgsConstructor
public class Attribution {

    private final String batchId;
    private final String contributorToken;
    private final BatchContext context;

    public static Attribution none() {
        return new Attribution(null, null, BatchContext.empty());
    }
}
