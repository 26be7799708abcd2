package de.jwiegmann.archive.boundary;

import de.jwiegmann.archive.boundary.dto.batch.BatchCreateRequest;
import de.jwiegmann.archive.boundary.dto.batch.BatchCreateResponse;
import de.jwiegmann.archive.boundary.dto.batch.BatchFinishRequest;
import de.jwiegmann.archive.boundary.dto.batch.BatchFinishResponse;
import de.jwiegmann.archive.control.batch.FinishBatchResult;
import de.jwiegmann.archive.control.batch.ManifestBatcher;
import de.jwiegmann.archive.entity.Batch;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/batch")
public class BatchRestController {

    private final ManifestBatcher batcher;

    public BatchRestController(ManifestBatcher batcher) {
        this.batcher = batcher;
    }

    @PostMapping("/create")
    public ResponseEntity<BatchCreateResponse> create(@RequestBody BatchCreateRequest req) {
        Batch batch = batcher.createBatch(req.getContributorToken());
        return ResponseEntity
                .created(URI.create("/batch/" + batch.getBatchId()))
                .body(BatchCreateResponse.builder()
                        .batchId(batch.getBatchId())
                        .createdAt(batch.getCreatedAt())
                        .build());
    }

    /**
     * POST /batch/finish: schreibt das Manifest. Wiederholte Aufrufe liefern das bestehende Ergebnis.
     */
    @PostMapping("/finish")
    public ResponseEntity<BatchFinishResponse> finish(@RequestBody BatchFinishRequest req) {
        FinishBatchResult result = batcher.finishBatch(req.getContributorToken(), req.getBatchId(),
                req.getFiles(), req.getContext());
        return ResponseEntity.ok(BatchFinishResponse.builder()
                .ack(true)
                .batchId(result.getBatchId())
                .manifestFileId(result.getManifestFileId())
                .totalProcessedCount(result.getTotalProcessedCount())
                .alreadyFinished(result.isAlreadyFinished())
                .build());
    }
}
