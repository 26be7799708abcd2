package de.jwiegmann.archive.entity;

import java.util.Locale;

public enum AssetType {
    IMAGE,
    VIDEO,
    AUDIO,
    OTHER;

    public static AssetType fromMimeType(String mimeType) {
        if (mimeType == null) {
            return OTHER;
        }
        String m = mimeType.toLowerCase(Locale.ROOT);
        if (m.startsWith("image/")) return IMAGE;
        if (m.startsWith("video/")) return VIDEO;
        if (m.startsWith("audio/")) return AUDIO;
        return OTHER;
    }

    public boolean isTimeBased() {
        return this == VIDEO || this == AUDIO;
    }
}
