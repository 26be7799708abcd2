package de.jwiegmann.archive.control.repository;

import de.jwiegmann.archive.entity.UploadSession;

import java.util.List;
import java.util.Optional;

public interface UploadSessionRepository {

    UploadSession save(UploadSession session);

    Optional<UploadSession> find(String sessionId);

    List<UploadSession> findAll();

    void delete(String sessionId);
}
