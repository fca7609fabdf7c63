package de.htwsaar.assetguard.fingerprint.discovery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Findet Asset-Dateien unterhalb eines {@link AssetRoot}.
 *
 * <p>Jeder Aufruf läuft das Dateisystem neu ab, es wird kein Verzeichniszustand gecacht.
 * Der gelieferte Stream ist lazy und muss vom Aufrufer geschlossen werden.</p>
 */
public class AssetDiscovery {

    private static final Logger log = LoggerFactory.getLogger(AssetDiscovery.class);

    /**
     * Listet alle passenden regulären Dateien eines Roots.
     *
     * @param root     Quellverzeichnis mit Mustern
     * @param excluded Verzeichnis, das übersprungen wird (z. B. Build-Output im Root), darf {@code null} sein
     * @return lazy Stream absoluter Pfade; leer, wenn der Root nicht existiert
     */
    public Stream<Path> discover(AssetRoot root, Path excluded) {
        Path dir = root.directory().toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            log.warn("Asset root {} does not exist, skipping", dir);
            return Stream.empty();
        }
        List<PathMatcher> matchers = compile(root.includes());
        Path skip = excluded != null ? excluded.toAbsolutePath().normalize() : null;
        try {
            return Files.walk(dir)
                    .filter(Files::isRegularFile)
                    .filter(p -> skip == null || !p.startsWith(skip))
                    .filter(p -> matchesAny(matchers, dir.relativize(p)));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to walk asset root " + dir, e);
        }
    }

    /**
     * @param root Quellverzeichnis mit Mustern
     * @return wie {@link #discover(AssetRoot, Path)} ohne Ausschluss
     */
    public Stream<Path> discover(AssetRoot root) {
        return discover(root, null);
    }

    private static List<PathMatcher> compile(List<String> includes) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : includes) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            // "**/*.css" soll auch Dateien direkt im Root treffen
            if (pattern.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3)));
            }
        }
        return matchers;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher m : matchers) {
            if (m.matches(relative)) return true;
        }
        return false;
    }
}
