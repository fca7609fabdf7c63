package de.htwsaar.assetguard.fingerprint.discovery;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetguard.fingerprint.domain.AssetOrigin;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssetDiscoveryTest {

    @TempDir
    Path tmp;

    private final AssetDiscovery discovery = new AssetDiscovery();

    @Test
    void findsMatchingFilesAtAnyDepth() throws IOException {
        touch("app.js");
        touch("css/app.css");
        touch("css/deep/more/theme.css");
        touch("readme.txt");

        Set<String> found = relative(discovery.discover(AssetRoot.application(tmp, null)));

        assertEquals(Set.of("app.js", "css/app.css", "css/deep/more/theme.css"), found);
    }

    @Test
    void skipsExcludedDirectory() throws IOException {
        touch("css/app.css");
        touch("dist/css/app.1a2b3c4d.css");

        Set<String> found = relative(discovery.discover(AssetRoot.application(tmp, null), tmp.resolve("dist")));

        assertEquals(Set.of("css/app.css"), found);
    }

    @Test
    void customIncludesReplaceDefaults() throws IOException {
        touch("css/app.css");
        touch("js/app.js");
        AssetRoot root = new AssetRoot(tmp, AssetOrigin.APPLICATION,
                "", List.of("js/*.js"), Set.of());

        assertEquals(Set.of("js/app.js"), relative(discovery.discover(root)));
    }

    @Test
    void missingRootYieldsEmptyStream() {
        try (Stream<Path> s = discovery.discover(AssetRoot.application(tmp.resolve("nope"), null))) {
            assertEquals(0, s.count());
        }
    }

    @Test
    void everyCallWalksTheFileSystemAgain() throws IOException {
        touch("a.css");
        AssetRoot root = AssetRoot.application(tmp, null);
        assertEquals(Set.of("a.css"), relative(discovery.discover(root)));

        touch("b.css");
        assertEquals(Set.of("a.css", "b.css"), relative(discovery.discover(root)));
    }

    @Test
    void logicalPathCarriesPublicPrefix() {
        AssetRoot vendor = AssetRoot.vendored(tmp, "/vendor/");
        assertEquals("vendor", vendor.publicPrefix());
        assertEquals("vendor/fonts/a.woff2", vendor.logicalPathOf(Path.of("fonts", "a.woff2")));
        assertTrue(vendor.isPassthrough("vendor/fonts/a.woff2"));
        assertFalse(vendor.isPassthrough("vendor/govuk.css"));
        assertFalse(AssetRoot.application(tmp, null).isPassthrough("fonts/a.woff2"));
    }

    @Test
    void parsesDirectoryWithOptionalPrefix() {
        AssetRoot plain = AssetRoot.parse("public/assets", AssetOrigin.APPLICATION);
        assertEquals(Path.of("public/assets"), plain.directory());
        assertEquals("", plain.publicPrefix());

        AssetRoot vendor = AssetRoot.parse(" node_modules/govuk-frontend/dist = vendor/govuk ", AssetOrigin.VENDORED);
        assertEquals(Path.of("node_modules/govuk-frontend/dist"), vendor.directory());
        assertEquals("vendor/govuk", vendor.publicPrefix());
        assertEquals(AssetRoot.DEFAULT_VENDOR_PASSTHROUGH, vendor.passthroughExtensions());

        assertThrows(IllegalArgumentException.class, () -> AssetRoot.parse(" ", AssetOrigin.APPLICATION));
    }

    private void touch(String relative) throws IOException {
        Path file = tmp.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, relative);
    }

    private Set<String> relative(Stream<Path> stream) {
        try (stream) {
            return stream.map(p -> tmp.relativize(p).toString().replace('\\', '/')).collect(Collectors.toSet());
        }
    }
}
