package de.jwiegmann.archive.boundary.dto.batch;

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
public class BatchCreateResponse {

    @JsonProperty("batchID")
    private String batchId;

    private LocalDateTime createdAt;
}
