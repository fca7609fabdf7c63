package de.htwsaar.assetguard.cli.command;

import de.htwsaar.assetguard.cli.di.CliContext;
import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import de.htwsaar.assetguard.fingerprint.resolve.AssetPathResolver;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Löst logische Asset-Pfade gegen ein Manifest auf; eine Zeile {@code logisch -> aufgelöst} je Pfad.
 *
 * <p>Unbekannte Pfade und ein fehlendes Manifest sind kein Fehler, der Pfad bleibt dann unverändert.</p>
 */
@Command(
        name = "resolve",
        description = "Resolve logical asset paths against a manifest",
        mixinStandardHelpOptions = true)
public final class ResolveCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(names = "--manifest", required = true, paramLabel = "FILE", description = "Manifest file")
    Path manifest;

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Logical asset paths")
    List<String> paths;

    public ResolveCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx);
    }

    @Override
    public Integer call() {
        AssetPathResolver resolver = new AssetPathResolver(new ManifestStore(manifest));
        for (String path : paths) {
            ctx.out().println(path + " -> " + resolver.resolve(path));
        }
        ctx.out().flush();
        return 0;
    }
}
