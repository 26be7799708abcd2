package de.jwiegmann.archive.control.pipeline;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.repository.AssetRepository;
import de.jwiegmann.archive.entity.AssetStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Weiches Gate für neue Arbeit: genug freier Platz im Cache und nicht zu viele Assets in PROCESSING.
 * Ein false bedeutet nur "in diesem Zyklus nichts Neues ziehen".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackpressureGovernor {

    private final DiskSpaceProbe diskSpaceProbe;
    private final AssetRepository assetRepository;
    private final VaultProperties properties;

    public boolean allowIntake() {
        VaultProperties.Backpressure limits = properties.getBackpressure();

        long free = diskSpaceProbe.usableBytes(properties.getStorage().getCacheDir());
        if (free < limits.getMinFreeDiskBytes()) {
            log.warn("Backpressure: low disk space ({} bytes free, {} required)", free, limits.getMinFreeDiskBytes());
            return false;
        }

        long processing = assetRepository.countByStatus(AssetStatus.PROCESSING);
        if (processing > limits.getMaxProcessingBacklog()) {
            log.warn("Backpressure: backlog too high ({} assets processing, max {})", processing, limits.getMaxProcessingBacklog());
            return false;
        }
        return true;
    }
}
