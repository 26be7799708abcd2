package de.jwiegmann.archive.config;

import de.jwiegmann.archive.control.pipeline.enrichment.EnrichmentKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Getter
@Setter
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    private static final long MIB = 1024L * 1024L;

    // token -> Anzeigename
    private Map<String, String> contributors = new LinkedHashMap<>();

    private Storage storage = new Storage();
    private Upload upload = new Upload();
    private BatchLimits batch = new BatchLimits();
    private Dedup dedup = new Dedup();
    private Enrichment enrichment = new Enrichment();
    private Backpressure backpressure = new Backpressure();
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Storage {
        private Path root = Path.of("vault-data");
        private Path blobRoot = Path.of("vault-data", "blobs");
        private Path cacheDir = Path.of("vault-data", "cache");
    }

    @Getter
    @Setter
    public static class Upload {
        private long maxSizeBytes = 5000 * MIB;
        private long chunkSizeBytes = 10 * MIB;
        private Duration sessionTtl = Duration.ofHours(24);
        private int rateLimitPerHour = 100;
        private long reaperIntervalMs = 600_000;
    }

    @Getter
    @Setter
    public static class BatchLimits {
        private int maxFiles = 500;
    }

    @Getter
    @Setter
    public static class Dedup {
        // Bits von 64
        private int phashThreshold = 6;
    }

    @Getter
    @Setter
    public static class Enrichment {
        private Duration transcribeMaxDuration = Duration.ofMinutes(8);
        private Set<EnrichmentKind> enabledKinds = EnumSet.allOf(EnrichmentKind.class);
    }

    @Getter
    @Setter
    public static class Backpressure {
        private long minFreeDiskBytes = 30L * 1024 * MIB;
        private long maxProcessingBacklog = 5000;
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        private long pollIntervalMs = 300_000;
        private long initialDelayMs = 10_000;
        private int maxFilesPerCycle = 0;   // 0 = unbegrenzt
    }
}
