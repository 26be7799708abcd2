package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.AssetStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileAssetRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 10, 0);

    @TempDir
    Path tmp;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private VaultProperties properties;
    private JsonFileAssetRepository repository;

    @BeforeEach
    void setUp() {
        properties = new VaultProperties();
        properties.getStorage().setRoot(tmp);
        repository = new JsonFileAssetRepository(properties, objectMapper);
    }

    @Test
    void originFileIdIsUniqueUnderConcurrentClaims() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> claims = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            String assetId = "asset-" + i;
            claims.add(pool.submit(() -> {
                start.await();
                return repository.createIfAbsent(asset(assetId, "origin-1", T0));
            }));
        }
        start.countDown();

        int created = 0;
        for (Future<Boolean> claim : claims) {
            if (claim.get(10, TimeUnit.SECONDS)) {
                created++;
            }
        }
        pool.shutdown();

        assertThat(created).isEqualTo(1);
        assertThat(repository.findAll()).hasSize(1);
    }

    @Test
    void saveRequiresOwnershipOfOrigin() {
        repository.createIfAbsent(asset("a1", "origin-1", T0));

        assertThatThrownBy(() -> repository.save(asset("a2", "origin-1", T0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void earliestBySha256AndCreationOrder() {
        Asset late = asset("a-late", "o1", T0.plusHours(1));
        Asset early = asset("a-early", "o2", T0);
        Asset self = asset("a-self", "o3", T0.plusHours(2));
        for (Asset a : List.of(late, early, self)) {
            a.setSha256("same");
            a.setPhash("0000000000000000");
            repository.createIfAbsent(a);
        }

        assertThat(repository.findEarliestBySha256("same", "a-self")).map(Asset::getAssetId).contains("a-early");
        assertThat(repository.findEarliestBySha256("same", "a-early")).map(Asset::getAssetId).contains("a-late");
        assertThat(repository.findWithPhash()).extracting(Asset::getAssetId).containsExactly("a-early", "a-late", "a-self");
    }

    @Test
    void reloadsAfterRestart() {
        Asset asset = asset("a1", "origin-1", T0);
        repository.createIfAbsent(asset);
        asset.setStatus(AssetStatus.PROCESSING);
        repository.save(asset);

        JsonFileAssetRepository restarted = new JsonFileAssetRepository(properties, objectMapper);

        assertThat(restarted.findByOriginFileId("origin-1")).map(Asset::getStatus).contains(AssetStatus.PROCESSING);
        assertThat(restarted.countByStatus(AssetStatus.PROCESSING)).isEqualTo(1);
        assertThat(restarted.createIfAbsent(asset("a2", "origin-1", T0))).isFalse();
    }

    @Test
    void failedWriteReleasesTheOriginClaim() throws Exception {
        Path assets = tmp.resolve("assets");
        Files.delete(assets);
        Files.createFile(assets);

        assertThatThrownBy(() -> repository.createIfAbsent(asset("a1", "origin-1", T0)))
                .isInstanceOf(UncheckedIOException.class);
        assertThat(repository.findByOriginFileId("origin-1")).isEmpty();

        Files.delete(assets);
        Files.createDirectory(assets);

        assertThat(repository.createIfAbsent(asset("a2", "origin-1", T0))).isTrue();
        assertThat(repository.findByOriginFileId("origin-1")).map(Asset::getAssetId).contains("a2");
    }

    @Test
    void unsavedChangesAreNotVisible() {
        Asset asset = asset("a1", "origin-1", T0);
        repository.createIfAbsent(asset);

        asset.setStatus(AssetStatus.PROCESSING);
        asset.setSha256("abc");
        assertThat(repository.countByStatus(AssetStatus.PROCESSING)).isZero();
        assertThat(repository.findEarliestBySha256("abc", "other")).isEmpty();

        repository.save(asset);
        assertThat(repository.countByStatus(AssetStatus.PROCESSING)).isEqualTo(1);

        repository.findByOriginFileId("origin-1").orElseThrow().setStatus(AssetStatus.ERROR);
        assertThat(repository.countByStatus(AssetStatus.ERROR)).isZero();
    }

    private static Asset asset(String id, String origin, LocalDateTime createdAt) {
        return Asset.builder()
                .assetId(id)
                .originFileId(origin)
                .enrichmentErrors(Collections.emptyList())
                .createdAt(createdAt)
                .build();
    }
}
