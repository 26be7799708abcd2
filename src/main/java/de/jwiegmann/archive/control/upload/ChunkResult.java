package de.jwiegmann.archive.control.upload;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Ergebnis eines PutChunk: ACCEPTED(nextOffset), RESUME(nextOffset) oder COMPLETE(originFileId).
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChunkResult {

    public enum Outcome {ACCEPTED, RESUME, COMPLETE}

    private final Outcome outcome;
    private final long nextOffset;
    private final String originFileId;

    public static ChunkResult accepted(long nextOffset) {
        return new ChunkResult(Outcome.ACCEPTED, nextOffset, null);
    }

    public static ChunkResult resume(long nextOffset) {
        return new ChunkResult(Outcome.RESUME, nextOffset, null);
    }

    public static ChunkResult complete(long totalSize, String originFileId) {
        return new ChunkResult(Outcome.COMPLETE, totalSize, originFileId);
    }

    public boolean isComplete() {
        return outcome == Outcome.COMPLETE;
    }
}
