package de.jwiegmann.archive.control.repository;

import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.AssetStatus;

import java.util.List;
import java.util.Optional;

public interface AssetRepository {

    /**
     * Legt das Asset nur an, wenn für dessen originFileId noch keines existiert (Unique-Constraint).
     *
     * @return true wenn angelegt, false wenn die originFileId bereits vergeben ist
     */
    boolean createIfAbsent(Asset asset);

    /**
     * Upsert über die assetId. Das Asset muss zuvor über {@link #createIfAbsent(Asset)} angelegt worden sein.
     */
    Asset save(Asset asset);

    Optional<Asset> find(String assetId);

    Optional<Asset> findByOriginFileId(String originFileId);

    /**
     * Ältestes Asset mit diesem SHA-256, ohne das Asset selbst.
     */
    Optional<Asset> findEarliestBySha256(String sha256, String excludeAssetId);

    List<Asset> findWithPhash();

    long countByStatus(AssetStatus status);

    List<Asset> findAll();
}
