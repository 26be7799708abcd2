package de.jwiegmann.archive.control.upload;

import de.jwiegmann.archive.config.VaultProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Gleitendes Stundenfenster pro Contributor für neue Upload-Sessions.
 */
@Component
@RequiredArgsConstructor
public class ContributorRateLimiter {

    private static final Duration WINDOW = Duration.ofHours(1);

    private final RateLimitStore store;
    private final VaultProperties properties;
    private final Clock clock;

    /**
     * @return true wenn der Aufruf erlaubt ist (und gezählt wurde)
     */
    public boolean tryAcquire(String contributorToken) {
        int limit = properties.getUpload().getRateLimitPerHour();
        if (limit <= 0) {
            return true;
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(WINDOW);
        return store.compute(contributorToken, window -> {
            while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
                window.pollFirst();
            }
            if (window.size() >= limit) {
                return false;
            }
            window.addLast(now);
            return true;
        });
    }
}
