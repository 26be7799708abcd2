package de.jwiegmann.archive.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadSession {

    private String sessionId;
    private String remoteSessionHandle;

    private String contributorToken;
    private String batchId;           // optional
    private String filename;
    private String mimeType;

    // Fortschritt: committedOffset <= totalSize, nie fallend
    private long totalSize;
    private long committedOffset;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
