package de.jwiegmann.archive.control.upload;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UploadSessionReaper {

    private final UploadSessionManager uploadSessionManager;

    @Scheduled(fixedDelayString = "${vault.upload.reaper-interval-ms:600000}",
            initialDelayString = "${vault.upload.reaper-interval-ms:600000}")
    public void reap() {
        uploadSessionManager.reapExpired();
    }
}
