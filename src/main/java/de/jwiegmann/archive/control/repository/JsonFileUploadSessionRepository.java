package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.entity.UploadSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Upload-Sessions im Speicher, bei jeder Änderung zusätzlich als JSON auf Platte geschrieben.
 * Nach einem Neustart werden alle offenen Sessions wieder geladen.
 */
@Slf4j
@Repository
public class JsonFileUploadSessionRepository implements UploadSessionRepository {

    private final Map<String, UploadSession> store = new ConcurrentHashMap<>();
    private final JsonFileStore<UploadSession> files;

    public JsonFileUploadSessionRepository(VaultProperties properties, ObjectMapper objectMapper) {
        this.files = new JsonFileStore<>(properties.getStorage().getRoot().resolve("sessions"), UploadSession.class, objectMapper);
        files.readAll().forEach(s -> store.put(s.getSessionId(), s));
        if (!store.isEmpty()) {
            log.info("Restored {} upload sessions", store.size());
        }
    }

    @Override
    public UploadSession save(UploadSession session) {
        files.write(session.getSessionId(), session);
        store.put(session.getSessionId(), session);
        return session;
    }

    @Override
    public Optional<UploadSession> find(String sessionId) {
        return Optional.ofNullable(store.get(sessionId));
    }

    @Override
    public List<UploadSession> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public void delete(String sessionId) {
        store.remove(sessionId);
        files.delete(sessionId);
    }
}
