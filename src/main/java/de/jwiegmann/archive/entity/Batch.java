package de.jwiegmann.archive.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ein Batch während des Uploads. Die Dateiliste wird nur erweitert, bis der Batch abgeschlossen ist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Batch {

    private String batchId;
    private String contributorToken;

    @Builder.Default
    private Status status = Status.OPEN;

    @Builder.Default
    private List<ManifestFile> files = new ArrayList<>();

    private BatchContext context;    // erst beim Abschluss bekannt
    private String manifestFileId;   // gesetzt sobald das Manifest geschrieben ist
    private LocalDateTime createdAt;
    private LocalDateTime finishedAt;

    public enum Status {OPEN, FINISHED}
}
