package de.jwiegmann.archive.control.pipeline.dedup;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.pipeline.fingerprint.PerceptualHash;
import de.jwiegmann.archive.control.repository.AssetRepository;
import de.jwiegmann.archive.entity.Asset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Sucht ein früher angelegtes Asset, das dem gegebenen entspricht.
 * 1. exakt über SHA-256 (ältestes Asset gewinnt),
 * 2. nahe über pHash-Hamming-Distanz &lt;= Schwelle. Bei mehreren Kandidaten gewinnt die kleinste Distanz,
 *    bei Gleichstand das älteste Asset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DedupResolver {

    private final AssetRepository assetRepository;
    private final VaultProperties properties;

    public Optional<DedupMatch> resolve(Asset asset) {
        if (asset.getSha256() == null) {
            throw new IllegalArgumentException("asset " + asset.getAssetId() + " has not been fingerprinted");
        }

        Optional<Asset> exact = assetRepository.findEarliestBySha256(asset.getSha256(), asset.getAssetId());
        if (exact.isPresent() && createdBefore(exact.get(), asset)) {
            return Optional.of(DedupMatch.exact(exact.get().getAssetId()));
        }

        if (asset.getPhash() == null) {
            return Optional.empty();
        }
        PerceptualHash own = PerceptualHash.fromHex(asset.getPhash());
        int threshold = properties.getDedup().getPhashThreshold();

        DedupMatch best = null;
        // findWithPhash liefert in Anlagereihenfolge, daher gewinnt bei gleicher Distanz das ältere Asset
        for (Asset candidate : assetRepository.findWithPhash()) {
            if (candidate.getAssetId().equals(asset.getAssetId()) || !createdBefore(candidate, asset)) {
                continue;
            }
            int distance;
            try {
                distance = own.distanceTo(PerceptualHash.fromHex(candidate.getPhash()));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed phash of asset {}: {}", candidate.getAssetId(), e.getMessage());
                continue;
            }
            if (distance <= threshold && (best == null || distance < best.getDistance())) {
                best = DedupMatch.near(candidate.getAssetId(), distance);
            }
        }
        return Optional.ofNullable(best);
    }

    // Links zeigen nur auf früher angelegte Assets
    private static boolean createdBefore(Asset candidate, Asset asset) {
        if (candidate.getCreatedAt() == null || asset.getCreatedAt() == null) {
            return true;
        }
        int cmp = candidate.getCreatedAt().compareTo(asset.getCreatedAt());
        return cmp < 0 || (cmp == 0 && candidate.getAssetId().compareTo(asset.getAssetId()) < 0);
    }
}
