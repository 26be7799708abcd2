package de.jwiegmann.archive.control.storage;

import de.jwiegmann.archive.entity.StorageLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadaten, mit denen eine resumable Session im Remote-Store eröffnet wird.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumableUploadRequest {
    private String name;
    private String mimeType;
    private long totalSize;
    private StorageLocation location;
}
