package de.jwiegmann.archive.control.upload;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.UploadErrorFactory;
import de.jwiegmann.archive.control.batch.ManifestBatcher;
import de.jwiegmann.archive.control.exception.TransientStorageException;
import de.jwiegmann.archive.control.repository.UploadSessionRepository;
import de.jwiegmann.archive.control.storage.ChunkAck;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.control.storage.ResumableUploadRequest;
import de.jwiegmann.archive.entity.ManifestFile;
import de.jwiegmann.archive.entity.StorageLocation;
import de.jwiegmann.archive.entity.UploadSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Verwaltet resumable Upload-Sessions: Init, Chunk-Annahme, Wiederaufnahme nach Abbruch und Aufräumen.
 * Chunks derselben Session werden serialisiert, verschiedene Sessions laufen parallel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadSessionManager {

    private final UploadSessionRepository sessionRepository;
    private final RemoteBlobStore blobStore;
    private final ContributorRegistry contributors;
    private final ContributorRateLimiter rateLimiter;
    private final ManifestBatcher manifestBatcher;
    private final VaultProperties properties;
    private final Clock clock;

    private final Map<String, Object> sessionLocks = new ConcurrentHashMap<>();

    /**
     * Eröffnet eine Session im Remote-Store und persistiert sie.
     *
     * @param batchId optional; die fertige Datei wird diesem offenen Batch angehängt
     */
    public UploadSession initUpload(String contributorToken, String filename, String mimeType,
                                    long sizeBytes, String batchId) {

        // 1. Validierung, bevor irgendein Zustand entsteht
        contributors.requireKnown(contributorToken);
        if (filename == null || filename.isBlank()) {
            throw UploadErrorFactory.invalidInitPayload("filename is required");
        }
        if (sizeBytes <= 0) {
            throw UploadErrorFactory.invalidInitPayload("sizeBytes must be positive");
        }
        long maxSize = properties.getUpload().getMaxSizeBytes();
        if (sizeBytes > maxSize) {
            throw UploadErrorFactory.fileTooLarge(sizeBytes, maxSize);
        }
        if (batchId != null) {
            manifestBatcher.requireOpenBatch(batchId, contributorToken);
        }
        if (!rateLimiter.tryAcquire(contributorToken)) {
            throw UploadErrorFactory.rateLimited(properties.getUpload().getRateLimitPerHour());
        }

        // 2. Remote-Session eröffnen
        String handle = blobStore.openResumableSession(ResumableUploadRequest.builder()
                .name(filename)
                .mimeType(mimeType)
                .totalSize(sizeBytes)
                .location(StorageLocation.INBOX_UPLOADS)
                .build());

        // 3. Session persistieren
        LocalDateTime now = LocalDateTime.now(clock);
        UploadSession session = UploadSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .remoteSessionHandle(handle)
                .contributorToken(contributorToken)
                .batchId(batchId)
                .filename(filename)
                .mimeType(mimeType)
                .totalSize(sizeBytes)
                .committedOffset(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessionRepository.save(session);

        log.info("Initialized upload session {} for {} ({} bytes, contributor {})",
                session.getSessionId(), filename, sizeBytes, contributorToken);
        return session;
    }

    public long chunkSizeHint() {
        return properties.getUpload().getChunkSizeBytes();
    }

    public Optional<UploadSession> find(String sessionId) {
        return sessionRepository.find(sessionId);
    }

    /**
     * Nimmt einen Chunk an. Passt der Start nicht zum bestätigten Offset, wird der Remote-Store nach seinem
     * Stand gefragt und der Client mit RESUME auf den richtigen Offset verwiesen.
     *
     * @throws de.jwiegmann.archive.control.exception.TransientStorageException wenn der Remote-Store
     *         vorübergehend nicht antwortet; der Offset bleibt dann unverändert
     */
    public ChunkResult putChunk(String sessionId, ContentRange range, byte[] payload) {
        sessionRepository.find(sessionId).orElseThrow(() -> UploadErrorFactory.sessionNotFound(sessionId));

        synchronized (lockFor(sessionId)) {
            // erneut lesen: eine parallele Anfrage kann die Session inzwischen abgeschlossen haben
            UploadSession session = sessionRepository.find(sessionId)
                    .orElseThrow(() -> UploadErrorFactory.sessionNotFound(sessionId));

            if (range.getTotal() != session.getTotalSize()) {
                throw UploadErrorFactory.invalidContentRange(range.toString(),
                        "total " + range.getTotal() + " does not match declared size " + session.getTotalSize());
            }
            if (range.isProbe()) {
                return resumeFromRemote(session);
            }
            byte[] body = payload == null ? new byte[0] : payload;
            if (body.length != range.length()) {
                throw UploadErrorFactory.invalidContentRange(range.toString(),
                        "body has " + body.length + " bytes, range declares " + range.length());
            }
            if (range.getStart() != session.getCommittedOffset()) {
                log.info("Session {}: chunk starts at {} but committed offset is {}, probing remote store",
                        sessionId, range.getStart(), session.getCommittedOffset());
                return resumeFromRemote(session);
            }

            ChunkAck ack = blobStore.uploadChunk(session.getRemoteSessionHandle(), range.getStart(), body, session.getTotalSize());
            if (ack.completedFileId().isPresent()) {
                return complete(session, ack.getFileId());
            }
            advance(session, ack.getReceivedBytes());
            if (ack.getReceivedBytes() != range.getStart() + body.length) {
                return ChunkResult.resume(session.getCommittedOffset());
            }
            return ChunkResult.accepted(session.getCommittedOffset());
        }
    }

    /**
     * Entfernt Sessions, die länger als die TTL nicht mehr angefasst wurden, und verwirft deren Remote-Session.
     *
     * @return Anzahl entfernter Sessions
     */
    public int reapExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getUpload().getSessionTtl());
        int reaped = 0;
        for (UploadSession candidate : sessionRepository.findAll()) {
            if (!candidate.getUpdatedAt().isBefore(cutoff)) {
                continue;
            }
            synchronized (lockFor(candidate.getSessionId())) {
                Optional<UploadSession> current = sessionRepository.find(candidate.getSessionId());
                if (current.isEmpty() || !current.get().getUpdatedAt().isBefore(cutoff)) {
                    continue;
                }
                try {
                    blobStore.abandon(candidate.getRemoteSessionHandle());
                } catch (RuntimeException e) {
                    log.warn("Could not abandon remote session {} of upload {}: {}",
                            candidate.getRemoteSessionHandle(), candidate.getSessionId(), e.getMessage());
                }
                sessionRepository.delete(candidate.getSessionId());
                reaped++;
            }
            sessionLocks.remove(candidate.getSessionId());
        }
        if (reaped > 0) {
            log.warn("Reaped {} abandoned upload sessions older than {}", reaped, cutoff);
        }
        return reaped;
    }

    private ChunkResult resumeFromRemote(UploadSession session) {
        String handle = session.getRemoteSessionHandle();
        long remote = blobStore.queryReceivedBytes(handle);
        Optional<String> finished = blobStore.completedFileId(handle);
        if (finished.isPresent()) {
            return complete(session, finished.get());
        }
        if (remote < session.getCommittedOffset()) {
            throw new IllegalStateException("remote store reports " + remote + " bytes for session "
                    + session.getSessionId() + " but " + session.getCommittedOffset() + " were committed");
        }
        advance(session, remote);
        return ChunkResult.resume(remote);
    }

    private void advance(UploadSession session, long offset) {
        if (offset > session.getTotalSize()) {
            throw new IllegalStateException("offset " + offset + " exceeds total size of session " + session.getSessionId());
        }
        if (offset == session.getCommittedOffset()) {
            return;
        }
        session.setCommittedOffset(offset);
        session.setUpdatedAt(LocalDateTime.now(clock));
        sessionRepository.save(session);
    }

    /**
     * Hängt die fertige Datei an ihren Batch und entfernt erst danach die Session. Scheitert das Anhängen,
     * bleibt die Session bestehen und der nächste Chunk oder Probe schließt erneut ab.
     */
    private ChunkResult complete(UploadSession session, String originFileId) {
        if (session.getBatchId() != null) {
            try {
                manifestBatcher.appendFile(session.getBatchId(), ManifestFile.builder()
                        .remoteFileId(originFileId)
                        .originalName(session.getFilename())
                        .sizeBytes(session.getTotalSize())
                        .build());
            } catch (UncheckedIOException e) {
                throw new TransientStorageException("could not append " + originFileId + " to batch " + session.getBatchId(), e);
            }
        }
        sessionRepository.delete(session.getSessionId());
        sessionLocks.remove(session.getSessionId());

        log.info("Upload session {} complete: {} -> remote file {}", session.getSessionId(), session.getFilename(), originFileId);
        return ChunkResult.complete(session.getTotalSize(), originFileId);
    }

    private Object lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, k -> new Object());
    }
}
