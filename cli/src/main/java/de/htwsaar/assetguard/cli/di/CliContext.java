package de.htwsaar.assetguard.cli.di;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Bündelt Ausgabekanäle und Uhr, damit Commands ohne statische Globals testbar bleiben.
 * Fachliche Services gehören nicht hierher.</p>
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final Clock clock;

    /**
     * @param out   Writer für normale Ausgaben
     * @param err   Writer für Fehlermeldungen
     * @param clock Uhr für Build-Zeitstempel
     */
    public CliContext(PrintWriter out, PrintWriter err, Clock clock) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.clock = Objects.requireNonNull(clock);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public Clock clock() {
        return clock;
    }
}
