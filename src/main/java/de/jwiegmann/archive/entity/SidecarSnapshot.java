package de.jwiegmann.archive.entity;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Denormalisierte Kopie eines Assets inkl. Enrichment-Ausgaben.
 * Ein Snapshot pro abgeschlossenem Pipeline-Durchlauf, bei Neuverarbeitung überschrieben.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SidecarSnapshot {

    private int snapshotVersion;
    private LocalDateTime writtenAt;

    @JsonUnwrapped
    private Asset asset;

    private List<DetectedFace> faces;
    private Integer duplicateDistance;
    private boolean transcriptionDeferred;
}
