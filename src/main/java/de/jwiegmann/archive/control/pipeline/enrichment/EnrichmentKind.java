package de.jwiegmann.archive.control.pipeline.enrichment;

import de.jwiegmann.archive.entity.AssetType;

import java.util.EnumSet;
import java.util.Set;

public enum EnrichmentKind {
    FACES(EnumSet.of(AssetType.IMAGE)),
    CAPTION(EnumSet.of(AssetType.IMAGE)),
    EMBEDDING(EnumSet.of(AssetType.IMAGE)),
    TRANSCRIPT(EnumSet.of(AssetType.VIDEO, AssetType.AUDIO));

    private final Set<AssetType> types;

    EnrichmentKind(Set<AssetType> types) {
        this.types = types;
    }

    public boolean appliesTo(AssetType type) {
        return types.contains(type);
    }
}
