package de.jwiegmann.archive.boundary.dto.init;

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
public class UploadInitResponse {

    @JsonProperty("sessionID")
    private String sessionId;

    @JsonProperty("batchID")
    private String batchId;

    private long chunkSizeHint;
    private long totalSize;
    private LocalDateTime createdAt;
}
