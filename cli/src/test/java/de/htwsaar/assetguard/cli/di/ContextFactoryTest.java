package de.htwsaar.assetguard.cli.di;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetguard.cli.command.ResolveCommand;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ContextFactoryTest {

    private final CliContext ctx = new CliContext(
            new PrintWriter(new StringWriter()), new PrintWriter(new StringWriter()), Clock.systemUTC());

    @Test
    void injectsContextIntoCommandConstructor() throws Exception {
        ResolveCommand command = new ContextFactory(ctx).create(ResolveCommand.class);

        assertNotNull(command);
    }

    @Test
    void delegatesOtherTypesToFallback() throws Exception {
        CommandLine.IFactory fallback = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) {
                return cls.cast(new StringBuilder("fallback"));
            }
        };

        StringBuilder created = new ContextFactory(ctx, fallback).create(StringBuilder.class);

        assertEquals("fallback", created.toString());
    }

    @Test
    void rejectsNullContext() {
        assertThrows(NullPointerException.class, () -> new ContextFactory(null));
    }
}
