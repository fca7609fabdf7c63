package de.htwsaar.assetguard.cli.command;

import de.htwsaar.assetguard.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command: registriert {@code fingerprint} und {@code resolve}.
 */
@Command(
        name = "assetguard",
        description = "Fingerprint static assets and resolve logical asset paths",
        mixinStandardHelpOptions = true,
        version = "assetguard 1.0.0",
        subcommands = {FingerprintCommand.class, ResolveCommand.class, HelpCommand.class})
public final class AssetGuardRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    CommandSpec spec;

    public AssetGuardRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx);
    }

    /** Ohne Subcommand wird nur die Hilfe ausgegeben. */
    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }
}
