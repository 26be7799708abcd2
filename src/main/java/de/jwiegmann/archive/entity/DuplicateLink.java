package de.jwiegmann.archive.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Verknüpfung eines Assets mit einem früher angelegten Asset. Wird genau einmal geschrieben.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateLink {
    private String assetId;
    private String duplicateOf;
    private DedupMethod method;
    private Integer distance;   // Hamming-Distanz, nur bei NEAR
    private LocalDateTime createdAt;
}
