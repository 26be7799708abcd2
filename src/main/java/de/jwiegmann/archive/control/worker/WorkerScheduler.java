package de.jwiegmann.archive.control.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "vault.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerScheduler {

    private final WorkerLoop workerLoop;

    @Scheduled(fixedDelayString = "${vault.worker.poll-interval-ms:300000}", initialDelayString = "${vault.worker.initial-delay-ms:10000}")
    public void poll() {
        try {
            workerLoop.runCycle();
        } catch (RuntimeException e) {
            // der nächste Zyklus versucht es erneut
            log.error("Worker cycle aborted", e);
        }
    }
}
