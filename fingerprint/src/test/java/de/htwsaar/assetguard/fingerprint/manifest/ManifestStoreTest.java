package de.htwsaar.assetguard.fingerprint.manifest;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetguard.fingerprint.domain.FingerprintException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestStoreTest {

    @TempDir
    Path tmp;

    @Test
    void resetWithoutRecordsPersistsEmptyManifest() {
        ManifestStore store = new ManifestStore(tmp.resolve("asset-manifest.json"));
        store.record("css/app.css", "css/app.1a2b3c4d.css");
        store.reset();
        store.persist();

        assertTrue(Files.exists(tmp.resolve("asset-manifest.json")));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void persistThenLoadRoundTrips() {
        ManifestStore writer = new ManifestStore(tmp.resolve("out/asset-manifest.json"));
        writer.reset();
        writer.record("/css/app.css", "css/app.1a2b3c4d.css");
        writer.record("js/app.js", "/js/app.5e6f7a8b.js");
        writer.persist();

        AssetManifest loaded = new ManifestStore(tmp.resolve("out/asset-manifest.json")).load();

        assertEquals(Map.of("css/app.css", "css/app.1a2b3c4d.css", "js/app.js", "js/app.5e6f7a8b.js"),
                loaded.entries());
        assertEquals(writer.snapshot(), loaded);
    }

    @Test
    void persistLeavesNoTemporaryFiles() throws Exception {
        ManifestStore store = new ManifestStore(tmp.resolve("asset-manifest.json"));
        store.record("a.css", "a.1a2b3c4d.css");
        store.persist();
        store.persist();

        try (Stream<Path> files = Files.list(tmp)) {
            assertEquals(List.of(tmp.resolve("asset-manifest.json")), files.toList());
        }
    }

    @Test
    void lookupIgnoresLeadingSlashAndKeepsUnknownPaths() {
        ManifestStore store = new ManifestStore(tmp.resolve("asset-manifest.json"));
        store.record("css/app.css", "css/app.1a2b3c4d.css");
        store.persist();

        assertEquals("css/app.1a2b3c4d.css", store.lookup("/css/app.css"));
        assertEquals("css/app.1a2b3c4d.css", store.lookup("css/app.css"));
        assertEquals("/img/unknown.png", store.lookup("/img/unknown.png"));
        assertEquals("img/unknown.png", store.lookup("img/unknown.png"));
    }

    @Test
    void missingArtifactYieldsEmptyManifest() {
        ManifestStore store = new ManifestStore(tmp.resolve("missing.json"));
        assertTrue(store.load().isEmpty());
        assertEquals("/css/app.css", store.lookup("/css/app.css"));
    }

    @Test
    void malformedArtifactYieldsEmptyManifest() throws Exception {
        Path file = tmp.resolve("asset-manifest.json");
        Files.writeString(file, "{not json");
        assertTrue(new ManifestStore(file).load().isEmpty());

        Files.writeString(file, "[\"css/app.css\"]");
        assertTrue(new ManifestStore(file).load().isEmpty());
    }

    @Test
    void loadIsCachedUntilInvalidated() throws Exception {
        Path file = tmp.resolve("asset-manifest.json");
        Files.writeString(file, "{\"a.css\":\"a.1a2b3c4d.css\"}");
        ManifestStore store = new ManifestStore(file);

        AssetManifest first = store.load();
        Files.writeString(file, "{\"a.css\":\"a.5e6f7a8b.css\"}");
        assertSame(first, store.load());

        store.invalidate();
        assertEquals("a.5e6f7a8b.css", store.lookup("a.css"));
    }

    @Test
    void persistInvalidatesLoadedView() {
        ManifestStore store = new ManifestStore(tmp.resolve("asset-manifest.json"));
        assertTrue(store.load().isEmpty());

        store.record("a.css", "a.1a2b3c4d.css");
        store.persist();

        assertEquals("a.1a2b3c4d.css", store.lookup("a.css"));
    }

    @Test
    void dropsEntriesWhoseFileIsMissing() throws Exception {
        Path publicDir = tmp.resolve("public");
        Files.createDirectories(publicDir.resolve("css"));
        Files.writeString(publicDir.resolve("css/app.1a2b3c4d.css"), "body{}");
        Path file = publicDir.resolve("asset-manifest.json");
        Files.writeString(file, "{\"css/app.css\":\"css/app.1a2b3c4d.css\",\"js/app.js\":\"js/app.5e6f7a8b.js\"}");

        AssetManifest manifest = new ManifestStore(file, publicDir).load();

        assertEquals(Map.of("css/app.css", "css/app.1a2b3c4d.css"), manifest.entries());
    }

    @Test
    void rejectsEmptyEntries() {
        ManifestStore store = new ManifestStore(tmp.resolve("asset-manifest.json"));
        assertThrows(FingerprintException.class, () -> store.record("", "a.1a2b3c4d.css"));
        assertThrows(FingerprintException.class, () -> store.record("a.css", "/"));
    }

    @Test
    void concurrentFirstLoadSharesOneSnapshot() throws Exception {
        Path file = tmp.resolve("asset-manifest.json");
        Files.writeString(file, "{\"a.css\":\"a.1a2b3c4d.css\"}");
        ManifestStore store = new ManifestStore(file);

        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AssetManifest>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.load();
                }));
            }
            start.countDown();

            AssetManifest first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<AssetManifest> f : results) {
                assertSame(first, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
