package de.jwiegmann.archive.control.pipeline.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@AllArgsConstructor
public class Fingerprint {

    private final String sha256;
    private final PerceptualHash phash;   // null bei Nicht-Bildern oder unlesbaren Bildern

    public Optional<PerceptualHash> perceptualHash() {
        return Optional.ofNullable(phash);
    }
}
