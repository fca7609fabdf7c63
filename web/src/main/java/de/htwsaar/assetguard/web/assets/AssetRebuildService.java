package de.htwsaar.assetguard.web.assets;

import de.htwsaar.assetguard.fingerprint.discovery.AssetRoot;
import de.htwsaar.assetguard.fingerprint.pipeline.FingerprintPipeline;
import de.htwsaar.assetguard.fingerprint.pipeline.FingerprintReport;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startet Fingerprint-Läufe zur Laufzeit. Es läuft höchstens ein Lauf gleichzeitig.
 */
public class AssetRebuildService {

    private static final Logger log = LoggerFactory.getLogger(AssetRebuildService.class);

    private final FingerprintPipeline pipeline;
    private final List<AssetRoot> roots;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param pipeline Pipeline mit dem Manifest-Store der Laufzeit
     * @param roots    konfigurierte Quellverzeichnisse
     */
    public AssetRebuildService(FingerprintPipeline pipeline, List<AssetRoot> roots) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.roots = List.copyOf(roots);
    }

    /**
     * @return Bericht des Laufs
     * @throws RebuildInProgressException wenn bereits ein Lauf aktiv ist
     */
    public FingerprintReport rebuild() {
        if (!lock.tryLock()) {
            throw new RebuildInProgressException();
        }
        try {
            log.info("Rebuilding fingerprinted assets from {} roots", roots.size());
            return pipeline.run(roots);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return lock.isLocked();
    }
}
