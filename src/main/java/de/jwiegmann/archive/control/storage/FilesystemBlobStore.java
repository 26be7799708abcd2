package de.jwiegmann.archive.control.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.exception.TransientStorageException;
import de.jwiegmann.archive.control.repository.JsonFileStore;
import de.jwiegmann.archive.entity.StorageLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Verzeichnisbasierter Remote-Store.
 * Layout: objects/&lt;id&gt; (Inhalt), meta/&lt;id&gt;.json (RemoteFile), resumable/&lt;handle&gt;.part|.json|.done.
 * Die Größe der .part-Datei ist der maßgebliche Empfangsstand einer resumable Session, auch nach einem Neustart.
 */
@Slf4j
@Component
public class FilesystemBlobStore implements RemoteBlobStore {

    private final Path objectsDir;
    private final Path resumableDir;
    private final JsonFileStore<RemoteFile> meta;
    private final JsonFileStore<ResumableUploadRequest> pending;
    private final JsonFileStore<RemoteFile> completed;
    private final Map<String, Object> sessionLocks = new ConcurrentHashMap<>();

    public FilesystemBlobStore(VaultProperties properties, ObjectMapper objectMapper) {
        Path root = properties.getStorage().getBlobRoot();
        this.objectsDir = root.resolve("objects");
        this.resumableDir = root.resolve("resumable");
        this.meta = new JsonFileStore<>(root.resolve("meta"), RemoteFile.class, objectMapper);
        this.pending = new JsonFileStore<>(resumableDir, ResumableUploadRequest.class, objectMapper);
        this.completed = new JsonFileStore<>(root.resolve("resumable-done"), RemoteFile.class, objectMapper);
        try {
            Files.createDirectories(objectsDir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create blob store at " + root, e);
        }
    }

    @Override
    public RemoteFile upload(StorageLocation location, String name, String mimeType, byte[] content) {
        String id = UUID.randomUUID().toString();
        try {
            Files.write(objectsDir.resolve(id), content);
        } catch (IOException e) {
            throw new TransientStorageException("upload of " + name + " failed", e);
        }
        RemoteFile file = RemoteFile.builder()
                .id(id)
                .name(name)
                .mimeType(mimeType)
                .size(content.length)
                .location(location)
                .createdTime(LocalDateTime.now())
                .build();
        meta.write(id, file);
        return file;
    }

    @Override
    public InputStream openStream(String fileId) throws IOException {
        requireFile(fileId);
        return Files.newInputStream(objectsDir.resolve(fileId));
    }

    @Override
    public void downloadTo(String fileId, Path target) throws IOException {
        requireFile(fileId);
        Files.copy(objectsDir.resolve(fileId), target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void move(String fileId, StorageLocation target) {
        RemoteFile file = meta.read(fileId)
                .orElseThrow(() -> new NoSuchElementException("unknown remote file " + fileId));
        file.setLocation(target);
        meta.write(fileId, file);
    }

    @Override
    public List<RemoteFile> list(StorageLocation location) {
        return meta.readAll().stream()
                .filter(f -> f.getLocation() == location)
                .sorted(Comparator.comparing(RemoteFile::getCreatedTime).thenComparing(RemoteFile::getId))
                .toList();
    }

    @Override
    public String openResumableSession(ResumableUploadRequest request) {
        String handle = UUID.randomUUID().toString();
        pending.write(handle, request);
        try {
            Files.createFile(partFile(handle));
        } catch (IOException e) {
            pending.delete(handle);
            throw new TransientStorageException("cannot open resumable session", e);
        }
        log.debug("Opened resumable session {} for {}", handle, request.getName());
        return handle;
    }

    @Override
    public ChunkAck uploadChunk(String sessionHandle, long offset, byte[] payload, long totalSize) {
        synchronized (lockFor(sessionHandle)) {
            Optional<RemoteFile> done = completed.read(sessionHandle);
            if (done.isPresent()) {
                return ChunkAck.complete(done.get().getSize(), done.get().getId());
            }
            ResumableUploadRequest request = pending.read(sessionHandle)
                    .orElseThrow(() -> new NoSuchElementException("unknown resumable session " + sessionHandle));
            if (totalSize != request.getTotalSize()) {
                throw new IllegalArgumentException("total size " + totalSize + " does not match session size " + request.getTotalSize());
            }

            Path part = partFile(sessionHandle);
            long received = sizeOf(part);
            if (offset != received) {
                return ChunkAck.partial(received);
            }
            if (received + payload.length > totalSize) {
                throw new IllegalArgumentException("chunk exceeds declared total size");
            }

            try (FileChannel channel = FileChannel.open(part, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            } catch (IOException e) {
                truncate(part, received);
                throw new TransientStorageException("chunk write failed at offset " + offset, e);
            }

            received += payload.length;
            if (received < totalSize) {
                return ChunkAck.partial(received);
            }
            return ChunkAck.complete(received, finalizeSession(sessionHandle, request).getId());
        }
    }

    @Override
    public long queryReceivedBytes(String sessionHandle) {
        synchronized (lockFor(sessionHandle)) {
            Optional<RemoteFile> done = completed.read(sessionHandle);
            if (done.isPresent()) {
                return done.get().getSize();
            }
            if (pending.read(sessionHandle).isEmpty()) {
                throw new NoSuchElementException("unknown resumable session " + sessionHandle);
            }
            return sizeOf(partFile(sessionHandle));
        }
    }

    @Override
    public Optional<String> completedFileId(String sessionHandle) {
        return completed.read(sessionHandle).map(RemoteFile::getId);
    }

    @Override
    public void abandon(String sessionHandle) {
        synchronized (lockFor(sessionHandle)) {
            try {
                Files.deleteIfExists(partFile(sessionHandle));
            } catch (IOException e) {
                throw new UncheckedIOException("cannot remove partial upload " + sessionHandle, e);
            }
            pending.delete(sessionHandle);
            completed.delete(sessionHandle);
        }
        sessionLocks.remove(sessionHandle);
    }

    private RemoteFile finalizeSession(String sessionHandle, ResumableUploadRequest request) {
        String id = UUID.randomUUID().toString();
        try {
            Files.move(partFile(sessionHandle), objectsDir.resolve(id));
        } catch (IOException e) {
            throw new TransientStorageException("cannot finalize upload " + sessionHandle, e);
        }
        RemoteFile file = RemoteFile.builder()
                .id(id)
                .name(request.getName())
                .mimeType(request.getMimeType())
                .size(request.getTotalSize())
                .location(request.getLocation())
                .createdTime(LocalDateTime.now())
                .build();
        meta.write(id, file);
        completed.write(sessionHandle, file);
        pending.delete(sessionHandle);
        log.info("Finalized resumable upload {} as file {}", sessionHandle, id);
        return file;
    }

    private void requireFile(String fileId) throws NoSuchFileException {
        if (!Files.exists(objectsDir.resolve(fileId))) {
            throw new NoSuchFileException(fileId);
        }
    }

    private Path partFile(String handle) {
        return resumableDir.resolve(handle + ".part");
    }

    private Object lockFor(String handle) {
        return sessionLocks.computeIfAbsent(handle, k -> new Object());
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot stat " + path, e);
        }
    }

    private static void truncate(Path part, long size) {
        try (FileChannel channel = FileChannel.open(part, StandardOpenOption.WRITE)) {
            channel.truncate(size);
        } catch (IOException e) {
            log.warn("Could not roll back partial chunk in {}: {}", part, e.getMessage());
        }
    }
}
