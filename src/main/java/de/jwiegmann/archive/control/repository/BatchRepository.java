package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.entity.Batch;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class BatchRepository {

    private final Map<String, Batch> store = new ConcurrentHashMap<>();
    private final JsonFileStore<Batch> files;

    public BatchRepository(VaultProperties properties, ObjectMapper objectMapper) {
        this.files = new JsonFileStore<>(properties.getStorage().getRoot().resolve("batches"), Batch.class, objectMapper);
        files.readAll().forEach(b -> store.put(b.getBatchId(), b));
    }

    /**
     * Idempotent save: true wenn der Batch neu angelegt wurde, false wenn er bereits existierte.
     */
    public boolean saveIfAbsent(Batch batch) {
        boolean inserted = store.putIfAbsent(batch.getBatchId(), batch) == null;
        if (inserted) {
            files.write(batch.getBatchId(), batch);
        }
        return inserted;
    }

    public Batch save(Batch batch) {
        store.put(batch.getBatchId(), batch);
        files.write(batch.getBatchId(), batch);
        return batch;
    }

    public Optional<Batch> find(String batchId) {
        return Optional.ofNullable(store.get(batchId));
    }

    public List<Batch> findAll() {
        return new ArrayList<>(store.values());
    }
}
