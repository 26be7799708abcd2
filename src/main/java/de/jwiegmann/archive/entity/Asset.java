package de.jwiegmann.archive.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Eine Mediendatei auf ihrem Weg durch die Pipeline. Wird nie gelöscht, nur umgeroutet.
 * Eindeutig über originFileId.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Asset {

    private String assetId;
    private String originFileId;

    // Zuordnung aus dem Manifest, leer wenn keines existiert
    private String contributorToken;
    private String batchId;
    private String event;
    private String notes;

    private String originalFilename;
    private String mimeType;
    private long sizeBytes;

    private String sha256;
    private String phash;           // 16 Hex-Zeichen, nur bei Bildern

    @Builder.Default
    private AssetStatus status = AssetStatus.UPLOADED;

    private String duplicateOf;
    private DedupMethod duplicateMethod;

    private String decadeEstimate;
    private Double decadeConfidence;    // 1.0 aus dem Manifest, 0.6 aus EXIF

    private LocalDateTime exifDate;
    private Double gpsLat;
    private Double gpsLon;
    private Double durationSeconds;

    private Integer faceCount;
    private String caption;
    private String embeddingRef;
    private String transcriptRef;

    @Builder.Default
    private List<String> enrichmentErrors = new ArrayList<>();

    private String errorMessage;
    private StorageLocation location;

    private LocalDateTime createdAt;
    private LocalDateTime processedAt;
    private LocalDateTime updatedAt;

    @JsonIgnore
    public AssetType getAssetType() {
        return AssetType.fromMimeType(mimeType);
    }
}
