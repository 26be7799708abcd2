package de.jwiegmann.archive.boundary.dto.init;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitRequest {
    private String contributorToken;
    private String filename;
    private Long sizeBytes;
    private String mimeType;
    private String batchId;     // optional, Datei wird beim Abschluss diesem Batch zugeordnet
}
