package de.jwiegmann.archive.control.upload;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.UploadErrorFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Bekannte Contributor-Tokens aus der Konfiguration (token → Anzeigename).
 */
@Component
@RequiredArgsConstructor
public class ContributorRegistry {

    private final VaultProperties properties;

    public boolean isKnown(String token) {
        return token != null && properties.getContributors().containsKey(token);
    }

    public Optional<String> displayName(String token) {
        return token == null ? Optional.empty() : Optional.ofNullable(properties.getContributors().get(token));
    }

    public void requireKnown(String token) {
        if (!isKnown(token)) {
            throw UploadErrorFactory.invalidToken();
        }
    }
}
