package de.jwiegmann.archive.control.pipeline.routing;

import de.jwiegmann.archive.control.pipeline.dedup.DedupMatch;
import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.AssetStatus;
import de.jwiegmann.archive.entity.AssetType;
import de.jwiegmann.archive.entity.StorageLocation;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Leitet Haltestatus und Zielort eines Assets ab. Reihenfolge:
 * Duplikat vor zurückgestellter Transkription vor Review.
 */
@Component
public class RoutingStateMachine {

    public RoutingDecision route(Optional<DedupMatch> duplicate, AssetType assetType, boolean transcriptionDeferred) {
        if (duplicate.isPresent()) {
            return new RoutingDecision(AssetStatus.POSSIBLE_DUPLICATE, StorageLocation.HOLDING_DUPLICATES);
        }
        if (assetType.isTimeBased() && transcriptionDeferred) {
            return new RoutingDecision(AssetStatus.TRANSCRIBE_LATER, StorageLocation.HOLDING_TRANSCRIBE_LATER);
        }
        return new RoutingDecision(AssetStatus.NEEDS_REVIEW, StorageLocation.HOLDING_NEEDS_REVIEW);
    }

    /**
     * Fehler bleiben zur manuellen Prüfung dort liegen, wo die Verarbeitung abgebrochen ist.
     */
    public RoutingDecision failure() {
        return new RoutingDecision(AssetStatus.ERROR, StorageLocation.PROCESSING);
    }

    public void transition(Asset asset, AssetStatus target) {
        AssetStatus current = asset.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("asset " + asset.getAssetId() + ": " + current + " -> " + target + " not allowed");
        }
        asset.setStatus(target);
    }

    /**
     * Übernimmt eine Entscheidung der Kuratierung (approved, archived, rejected, ...).
     */
    public AssetStatus applyCurationDecision(Asset asset, String label) {
        AssetStatus target = AssetStatus.fromCurationLabel(label);
        if (!target.isTerminal()) {
            throw new IllegalArgumentException("curation may only approve, archive or reject, got " + label);
        }
        transition(asset, target);
        return target;
    }
}
