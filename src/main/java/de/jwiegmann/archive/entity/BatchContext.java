package de.jwiegmann.archive.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchContext {
    private String decade;   // z.B. "1980s"
    private String event;
    private String notes;

    public static BatchContext empty() {
        return new BatchContext();
    }
}
