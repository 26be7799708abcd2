package de.jwiegmann.archive.entity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Geschlossene Menge der Asset-Zustände.
 * uploaded → processing → {needs_review, possible_duplicate, transcribe_later, error} → {approved, archived, rejected}
 */
public enum AssetStatus {
    UPLOADED,
    PROCESSING,
    NEEDS_REVIEW,
    POSSIBLE_DUPLICATE,
    TRANSCRIBE_LATER,
    ERROR,
    APPROVED,
    ARCHIVED,
    REJECTED;

    private static final Set<AssetStatus> HOLDING = EnumSet.of(NEEDS_REVIEW, POSSIBLE_DUPLICATE, TRANSCRIBE_LATER, ERROR);
    private static final Set<AssetStatus> TERMINAL = EnumSet.of(APPROVED, ARCHIVED, REJECTED);

    public boolean isHolding() {
        return HOLDING.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(AssetStatus target) {
        return switch (this) {
            case UPLOADED -> target == PROCESSING || target == ERROR;
            case PROCESSING -> HOLDING.contains(target);
            case NEEDS_REVIEW, POSSIBLE_DUPLICATE, TRANSCRIBE_LATER, ERROR -> TERMINAL.contains(target);
            case APPROVED, ARCHIVED, REJECTED -> false;
        };
    }

    /**
     * Bildet Status-Bezeichnungen der Kuratierungs-Oberflächen auf das Enum ab.
     * "pending" ist dort das Synonym für "needs_review".
     */
    public static AssetStatus fromCurationLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("empty status label");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "pending", "needs_review", "review" -> NEEDS_REVIEW;
            case "possible_duplicate", "possible_duplicates", "duplicate" -> POSSIBLE_DUPLICATE;
            case "transcribe_later" -> TRANSCRIBE_LATER;
            case "approved" -> APPROVED;
            case "archived" -> ARCHIVED;
            case "rejected" -> REJECTED;
            case "error", "failed" -> ERROR;
            case "processing" -> PROCESSING;
            case "uploaded" -> UPLOADED;
            default -> throw new IllegalArgumentException("unknown status label: " + label);
        };
    }
}
