package de.jwiegmann.archive.boundary.dto.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.jwiegmann.archive.entity.BatchContext;
import de.jwiegmann.archive.entity.ManifestFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchFinishRequest {

    private String contributorToken;

    @JsonProperty("batchID")
    private String batchId;

    // leer: es gelten die über die Upload-Sessions gesammelten Dateien
    private List<ManifestFile> files;

    private BatchContext context;
}
