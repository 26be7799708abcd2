package de.jwiegmann.archive.control.storage;

import de.jwiegmann.archive.entity.StorageLocation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Entfernter Objektspeicher (Drive/R2). Bündelt die Operationen, die Upload und Worker benötigen.
 */
public interface RemoteBlobStore {

    RemoteFile upload(StorageLocation location, String name, String mimeType, byte[] content);

    InputStream openStream(String fileId) throws IOException;

    void downloadTo(String fileId, Path target) throws IOException;

    void move(String fileId, StorageLocation target);

    List<RemoteFile> list(StorageLocation location);

    String openResumableSession(ResumableUploadRequest request);

    /**
     * Schreibt einen Chunk ab {@code offset}. Stimmt der Offset nicht mit dem Stand des Stores überein,
     * wird nichts geschrieben und der maßgebliche Stand zurückgegeben.
     *
     * @throws de.jwiegmann.archive.control.exception.TransientStorageException bei vorübergehenden Fehlern
     */
    ChunkAck uploadChunk(String sessionHandle, long offset, byte[] payload, long totalSize);

    /**
     * Status-Probe (entspricht einem PUT mit leerem Body und {@code Content-Range: bytes * /total}).
     */
    long queryReceivedBytes(String sessionHandle);

    Optional<String> completedFileId(String sessionHandle);

    void abandon(String sessionHandle);
}
