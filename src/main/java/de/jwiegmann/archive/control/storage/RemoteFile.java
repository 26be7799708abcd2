package de.jwiegmann.archive.control.storage;

import de.jwiegmann.archive.entity.StorageLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteFile {
    private String id;
    private String name;
    private String mimeType;
    private long size;
    private StorageLocation location;
    private LocalDateTime createdTime;
}
