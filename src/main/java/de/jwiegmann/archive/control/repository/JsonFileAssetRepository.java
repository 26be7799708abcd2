package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.AssetStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Asset-Tabelle: Map nach assetId plus eindeutiger Index originFileId → assetId.
 * Die Reihenfolge für Scans ist (createdAt, assetId), damit Ergebnisse bei gleichem Bestand reproduzierbar sind.
 */
@Slf4j
@Repository
public class JsonFileAssetRepository implements AssetRepository {

    private static final Comparator<Asset> CREATION_ORDER = Comparator
            .comparing(Asset::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(Asset::getAssetId);

    private final Map<String, Asset> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByOrigin = new ConcurrentHashMap<>();
    private final JsonFileStore<Asset> files;

    public JsonFileAssetRepository(VaultProperties properties, ObjectMapper objectMapper) {
        this.files = new JsonFileStore<>(properties.getStorage().getRoot().resolve("assets"), Asset.class, objectMapper);
        for (Asset asset : files.readAll()) {
            byId.put(asset.getAssetId(), asset);
            idByOrigin.put(asset.getOriginFileId(), asset.getAssetId());
        }
        log.info("Loaded {} assets", byId.size());
    }

    @Override
    public boolean createIfAbsent(Asset asset) {
        Objects.requireNonNull(asset.getOriginFileId(), "originFileId");
        if (idByOrigin.putIfAbsent(asset.getOriginFileId(), asset.getAssetId()) != null) {
            return false;
        }
        Asset stored = copyOf(asset);
        try {
            files.write(stored.getAssetId(), stored);
        } catch (RuntimeException e) {
            // ohne Datensatz darf die originFileId nicht belegt bleiben
            idByOrigin.remove(asset.getOriginFileId(), asset.getAssetId());
            throw e;
        }
        byId.put(stored.getAssetId(), stored);
        return true;
    }

    @Override
    public Asset save(Asset asset) {
        String owner = idByOrigin.get(asset.getOriginFileId());
        if (!asset.getAssetId().equals(owner)) {
            throw new IllegalStateException("asset " + asset.getAssetId() + " does not own origin file " + asset.getOriginFileId());
        }
        Asset stored = copyOf(asset);
        files.write(stored.getAssetId(), stored);
        byId.put(stored.getAssetId(), stored);
        return asset;
    }

    @Override
    public Optional<Asset> find(String assetId) {
        return Optional.ofNullable(byId.get(assetId)).map(JsonFileAssetRepository::copyOf);
    }

    @Override
    public Optional<Asset> findByOriginFileId(String originFileId) {
        String assetId = idByOrigin.get(originFileId);
        return assetId == null ? Optional.empty() : find(assetId);
    }

    @Override
    public Optional<Asset> findEarliestBySha256(String sha256, String excludeAssetId) {
        return byId.values().stream()
                .filter(a -> sha256.equals(a.getSha256()))
                .filter(a -> !a.getAssetId().equals(excludeAssetId))
                .min(CREATION_ORDER)
                .map(JsonFileAssetRepository::copyOf);
    }

    @Override
    public List<Asset> findWithPhash() {
        return byId.values().stream()
                .filter(a -> a.getPhash() != null)
                .sorted(CREATION_ORDER)
                .map(JsonFileAssetRepository::copyOf)
                .toList();
    }

    @Override
    public long countByStatus(AssetStatus status) {
        return byId.values().stream().filter(a -> a.getStatus() == status).count();
    }

    @Override
    public List<Asset> findAll() {
        List<Asset> all = new ArrayList<>();
        for (Asset asset : byId.values()) {
            all.add(copyOf(asset));
        }
        all.sort(CREATION_ORDER);
        return all;
    }

    /**
     * Gespeicherte Instanzen verlassen das Repository nie; Änderungen werden erst mit save() sichtbar.
     */
    private static Asset copyOf(Asset asset) {
        return asset.toBuilder()
                .enrichmentErrors(asset.getEnrichmentErrors() == null ? new ArrayList<>() : new ArrayList<>(asset.getEnrichmentErrors()))
                .build();
    }
}
