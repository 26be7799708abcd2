package de.jwiegmann.archive.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Unveränderliches Manifest eines abgeschlossenen Batches.
 * Einziger Weg, über den Kontext (Jahrzehnt, Anlass, Notizen) in die Pipeline gelangt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Manifest {
    private String batchId;
    private String contributorToken;
    private String contributorDisplayName;
    private LocalDateTime createdAt;
    private LocalDateTime finishedAt;
    private BatchContext context;
    private List<ManifestFile> files;
    private int totalFiles;
    private long totalBytes;
}
