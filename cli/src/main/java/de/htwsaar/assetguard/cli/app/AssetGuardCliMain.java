package de.htwsaar.assetguard.cli.app;

import de.htwsaar.assetguard.cli.command.AssetGuardRootCommand;
import de.htwsaar.assetguard.cli.di.CliContext;
import de.htwsaar.assetguard.cli.di.ContextFactory;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import picocli.CommandLine;

/**
 * Einstiegspunkt der AssetGuard-CLI.
 *
 * <p>Baut den Kontext, führt genau einen Befehl aus und beendet den Prozess mit dessen Exit-Code.</p>
 */
public final class AssetGuardCliMain {

    private AssetGuardCliMain() {}

    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true);
        System.exit(newCommandLine(new CliContext(out, err, Clock.systemUTC())).execute(args));
    }

    /**
     * @param ctx Kontext
     * @return konfigurierte Kommandozeile (auch für Tests)
     */
    public static CommandLine newCommandLine(CliContext ctx) {
        CommandLine cmd = new CommandLine(AssetGuardRootCommand.class, new ContextFactory(ctx));
        cmd.setOut(ctx.out());
        cmd.setErr(ctx.err());
        return cmd;
    }
}
