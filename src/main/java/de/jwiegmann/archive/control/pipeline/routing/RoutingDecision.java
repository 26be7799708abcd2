package de.jwiegmann.archive.control.pipeline.routing;

import de.jwiegmann.archive.entity.AssetStatus;
import de.jwiegmann.archive.entity.StorageLocation;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RoutingDecision {
    private final AssetStatus status;
    private final StorageLocation location;
}
