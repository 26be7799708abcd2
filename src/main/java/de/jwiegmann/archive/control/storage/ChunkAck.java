package de.jwiegmann.archive.control.storage;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Antwort des Remote-Stores auf einen Chunk: maßgebliche Anzahl empfangener Bytes,
 * und die Datei-ID sobald die Datei vollständig ist.
 */
@Getter
@ToString
@AllArgsConstructor
public class ChunkAck {

    private final long receivedBytes;
    private final String fileId;

    public static ChunkAck partial(long receivedBytes) {
        return new ChunkAck(receivedBytes, null);
    }

    public static ChunkAck complete(long receivedBytes, String fileId) {
        return new ChunkAck(receivedBytes, fileId);
    }

    public Optional<String> completedFileId() {
        return Optional.ofNullable(fileId);
    }
}
