package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.entity.SidecarSnapshot;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Metadaten-Sidecars (ein JSON pro Asset) und Enrichment-Artefakte (Embedding, Transkript) daneben.
 */
@Repository
public class SidecarRepository {

    private final JsonFileStore<SidecarSnapshot> snapshots;
    private final Path directory;
    private final ObjectMapper objectMapper;

    public SidecarRepository(VaultProperties properties, ObjectMapper objectMapper) {
        this.directory = properties.getStorage().getRoot().resolve("sidecars");
        this.snapshots = new JsonFileStore<>(directory, SidecarSnapshot.class, objectMapper);
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Schreibt den Snapshot und vergibt die nächste Versionsnummer.
     */
    public synchronized SidecarSnapshot write(SidecarSnapshot snapshot) {
        String assetId = snapshot.getAsset().getAssetId();
        int previous = snapshots.read(assetId).map(SidecarSnapshot::getSnapshotVersion).orElse(0);
        snapshot.setSnapshotVersion(previous + 1);
        snapshots.write(assetId, snapshot);
        return snapshot;
    }

    public Optional<SidecarSnapshot> find(String assetId) {
        return snapshots.read(assetId);
    }

    /**
     * @return Referenz (Dateiname) des geschriebenen Artefakts
     */
    public String writeArtifact(String assetId, String suffix, Object content) {
        String name = assetId + "_" + suffix + ".json";
        try {
            objectMapper.writeValue(directory.resolve(name).toFile(), content);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write artifact " + name, e);
        }
        return name;
    }

    public Path resolveArtifact(String ref) {
        return directory.resolve(ref);
    }
}
