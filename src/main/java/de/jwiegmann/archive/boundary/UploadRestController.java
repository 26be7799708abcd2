package de.jwiegmann.archive.boundary;

import de.jwiegmann.archive.boundary.dto.chunk.ChunkResponse;
import de.jwiegmann.archive.boundary.dto.init.UploadInitRequest;
import de.jwiegmann.archive.boundary.dto.init.UploadInitResponse;
import de.jwiegmann.archive.boundary.dto.status.UploadStatusResponse;
import de.jwiegmann.archive.control.UploadErrorFactory;
import de.jwiegmann.archive.control.upload.ChunkResult;
import de.jwiegmann.archive.control.upload.ContentRange;
import de.jwiegmann.archive.control.upload.UploadSessionManager;
import de.jwiegmann.archive.entity.UploadSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/upload")
public class UploadRestController {

    public static final String SESSION_HEADER = "X-Upload-Session-ID";

    private final UploadSessionManager sessionManager;

    public UploadRestController(UploadSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * POST /upload/init
     */
    @PostMapping("/init")
    public ResponseEntity<UploadInitResponse> init(@RequestBody UploadInitRequest req) {
        if (req.getSizeBytes() == null) {
            throw UploadErrorFactory.invalidInitPayload("sizeBytes is required");
        }
        UploadSession s = sessionManager.initUpload(req.getContributorToken(), req.getFilename(),
                req.getMimeType(), req.getSizeBytes(), req.getBatchId());

        return ResponseEntity
                .created(URI.create("/upload/" + s.getSessionId()))
                .body(UploadInitResponse.builder()
                        .sessionId(s.getSessionId())
                        .batchId(s.getBatchId())
                        .chunkSizeHint(sessionManager.chunkSizeHint())
                        .totalSize(s.getTotalSize())
                        .createdAt(s.getCreatedAt())
                        .build());
    }

    /**
     * PUT /upload/chunk: Rohbytes eines Chunks, oder leerer Body mit {@code bytes * /total} als Status-Probe.
     * 200 mit originFileID wenn die Datei vollständig ist, sonst 308 mit dem nächsten erwarteten Offset.
     */
    @PutMapping("/chunk")
    public ResponseEntity<ChunkResponse> chunk(
            @RequestHeader(SESSION_HEADER) String sessionId,
            @RequestHeader(HttpHeaders.CONTENT_RANGE) String contentRange,
            @RequestBody(required = false) byte[] body) {

        ChunkResult result = sessionManager.putChunk(sessionId, ContentRange.parse(contentRange), body);

        if (result.isComplete()) {
            return ResponseEntity.ok(ChunkResponse.builder()
                    .originFileId(result.getOriginFileId())
                    .build());
        }

        ResponseEntity.BodyBuilder resume = ResponseEntity.status(HttpStatus.PERMANENT_REDIRECT);
        if (result.getNextOffset() > 0) {
            resume.header(HttpHeaders.RANGE, "bytes=0-" + (result.getNextOffset() - 1));
        }
        return resume.body(ChunkResponse.builder()
                .nextOffset(result.getNextOffset())
                .status(result.getOutcome().name())
                .build());
    }

    /**
     * GET /upload/{sessionId}: bestätigter Offset einer laufenden Session
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<UploadStatusResponse> status(@PathVariable String sessionId) {
        UploadSession s = sessionManager.find(sessionId)
                .orElseThrow(() -> UploadErrorFactory.sessionNotFound(sessionId));
        return ResponseEntity.ok(UploadStatusResponse.builder()
                .sessionId(s.getSessionId())
                .filename(s.getFilename())
                .totalSize(s.getTotalSize())
                .committedOffset(s.getCommittedOffset())
                .batchId(s.getBatchId())
                .createdAt(s.getCreatedAt())
                .updatedAt(s.getUpdatedAt())
                .build());
    }
}
