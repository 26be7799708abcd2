package de.jwiegmann.archive.boundary.dto.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchFinishResponse {

    private boolean ack;

    @JsonProperty("batchID")
    private String batchId;

    private String manifestFileId;
    private int totalProcessedCount;
    private boolean alreadyFinished;
}
