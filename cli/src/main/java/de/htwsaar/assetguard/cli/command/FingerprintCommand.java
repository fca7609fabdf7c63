package de.htwsaar.assetguard.cli.command;

import de.htwsaar.assetguard.cli.di.CliContext;
import de.htwsaar.assetguard.fingerprint.discovery.AssetDiscovery;
import de.htwsaar.assetguard.fingerprint.discovery.AssetRoot;
import de.htwsaar.assetguard.fingerprint.domain.AssetOrigin;
import de.htwsaar.assetguard.fingerprint.domain.FingerprintException;
import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import de.htwsaar.assetguard.fingerprint.pipeline.FingerprintPipeline;
import de.htwsaar.assetguard.fingerprint.pipeline.FingerprintReport;
import de.htwsaar.assetguard.fingerprint.rewrite.ReferenceRewriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Build-Schritt: fingerprintet alle Assets der angegebenen Roots und schreibt das Manifest.
 *
 * <p>Exit-Codes: {@code 0} Erfolg, {@code 1} ungültige Eingabe, {@code 2} mindestens ein Root
 * abgebrochen, {@code 3} Ausgabe oder Manifest konnte nicht geschrieben werden.</p>
 */
@Command(
        name = "fingerprint",
        description = "Fingerprint application and vendored assets and write the manifest",
        mixinStandardHelpOptions = true)
public final class FingerprintCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_ROOT_FAILED = 2;
    static final int EXIT_WRITE_FAILED = 3;

    private static final Logger log = LoggerFactory.getLogger(FingerprintCommand.class);

    private final CliContext ctx;

    @Option(names = "--app-root", paramLabel = "DIR[=PREFIX]",
            description = "Application asset directory, optionally with a public path prefix")
    List<String> appRoots = new ArrayList<>();

    @Option(names = "--vendor-root", paramLabel = "DIR[=PREFIX]",
            description = "Vendored asset directory, optionally with a public path prefix")
    List<String> vendorRoots = new ArrayList<>();

    @Option(names = "--output", required = true, paramLabel = "DIR",
            description = "Directory the fingerprinted files are written to")
    Path output;

    @Option(names = "--manifest", paramLabel = "FILE",
            description = "Manifest file (default: <output>/" + ManifestStore.DEFAULT_FILE_NAME + ")")
    Path manifest;

    @Option(names = "--include", paramLabel = "GLOB",
            description = "Glob pattern of files to fingerprint; replaces the default patterns")
    List<String> includes = new ArrayList<>();

    @Option(names = "--passthrough", paramLabel = "EXT",
            description = "Extension of vendored files that are copied under their original name only")
    List<String> passthrough = new ArrayList<>();

    public FingerprintCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx);
    }

    @Override
    public Integer call() {
        List<AssetRoot> roots;
        try {
            roots = roots();
        } catch (IllegalArgumentException e) {
            ctx.err().println("[FINGERPRINT] Invalid input: " + e.getMessage());
            ctx.err().flush();
            return EXIT_INVALID_INPUT;
        }
        if (roots.isEmpty()) {
            ctx.err().println("[FINGERPRINT] Missing --app-root or --vendor-root");
            ctx.err().flush();
            return EXIT_INVALID_INPUT;
        }

        Path manifestFile = manifest != null ? manifest : output.resolve(ManifestStore.DEFAULT_FILE_NAME);
        FingerprintPipeline pipeline = new FingerprintPipeline(
                new AssetDiscovery(), new ManifestStore(manifestFile), new ReferenceRewriter(), output, ctx.clock());

        FingerprintReport report;
        try {
            report = pipeline.run(roots);
        } catch (FingerprintException e) {
            log.error("Fingerprint build failed", e);
            ctx.err().println("[FINGERPRINT] Build failed: " + e.getMessage());
            ctx.err().flush();
            return EXIT_WRITE_FAILED;
        }

        ctx.out().printf("fingerprinted=%d rewritten=%d copied=%d skipped=%d entries=%d%n",
                report.fingerprinted(), report.rewrittenStylesheets(), report.copied(), report.skipped(),
                report.manifest().size());
        ctx.out().println("manifest: " + report.manifestFile());
        ctx.out().flush();

        if (!report.successful()) {
            for (String root : report.failedRoots()) {
                ctx.err().println("[FINGERPRINT] Aborted root: " + root);
            }
            ctx.err().flush();
            return EXIT_ROOT_FAILED;
        }
        return EXIT_OK;
    }

    private List<AssetRoot> roots() {
        List<String> patterns = includes.isEmpty() ? null : List.copyOf(includes);
        Set<String> vendorPassthrough = passthrough.isEmpty() ? null : normalizeExtensions(passthrough);

        List<AssetRoot> roots = new ArrayList<>();
        for (String root : appRoots) {
            roots.add(AssetRoot.parse(root, AssetOrigin.APPLICATION).with(patterns, null));
        }
        for (String root : vendorRoots) {
            roots.add(AssetRoot.parse(root, AssetOrigin.VENDORED).with(patterns, vendorPassthrough));
        }
        return roots;
    }

    private static Set<String> normalizeExtensions(List<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String ext : raw) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.startsWith(".")) {
                e = e.substring(1);
            }
            if (e.isEmpty()) {
                throw new IllegalArgumentException("Passthrough extension must not be blank");
            }
            out.add(e);
        }
        return out;
    }
}
