package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.entity.DuplicateLink;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DuplicateLinks sind unveränderlich: pro Asset höchstens ein Link.
 */
@Repository
public class DuplicateLinkRepository {

    private final Map<String, DuplicateLink> store = new ConcurrentHashMap<>();
    private final JsonFileStore<DuplicateLink> files;

    public DuplicateLinkRepository(VaultProperties properties, ObjectMapper objectMapper) {
        this.files = new JsonFileStore<>(properties.getStorage().getRoot().resolve("duplicates"), DuplicateLink.class, objectMapper);
        files.readAll().forEach(l -> store.put(l.getAssetId(), l));
    }

    public boolean saveIfAbsent(DuplicateLink link) {
        boolean inserted = store.putIfAbsent(link.getAssetId(), link) == null;
        if (inserted) {
            files.write(link.getAssetId(), link);
        }
        return inserted;
    }

    public Optional<DuplicateLink> find(String assetId) {
        return Optional.ofNullable(store.get(assetId));
    }
}
