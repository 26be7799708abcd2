package de.jwiegmann.archive.entity;

/**
 * Bereiche im Remote-Store. Ordnernamen entsprechen der Struktur des Archivs.
 */
public enum StorageLocation {
    INBOX_UPLOADS("INBOX_UPLOADS"),
    INBOX_MANIFESTS("INBOX_UPLOADS/_MANIFESTS"),
    PROCESSING("PROCESSING"),
    HOLDING_NEEDS_REVIEW("HOLDING/Needs_Review"),
    HOLDING_DUPLICATES("HOLDING/Possible_Duplicates"),
    HOLDING_TRANSCRIBE_LATER("HOLDING/Transcribe_Later");

    private final String folder;

    StorageLocation(String folder) {
        this.folder = folder;
    }

    public String getFolder() {
        return folder;
    }
}
