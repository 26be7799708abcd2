package de.jwiegmann.archive.boundary.dto.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 200: originFileID gesetzt. 308: nextOffset und status (ACCEPTED | RESUME).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChunkResponse {

    @JsonProperty("originFileID")
    private String originFileId;

    private Long nextOffset;
    private String status;
}
