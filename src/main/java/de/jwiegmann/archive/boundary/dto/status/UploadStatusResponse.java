package de.jwiegmann.archive.boundary.dto.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadStatusResponse {

    @JsonProperty("sessionID")
    private String sessionId;

    private String filename;
    private long totalSize;
    private long committedOffset;

    @JsonProperty("batchID")
    private String batchId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
