package de.htwsaar.assetguard.cli.di;

import java.lang.reflect.Constructor;
import java.util.Objects;
import picocli.CommandLine;

/**
 * Picocli-Factory für Constructor Injection von {@link CliContext}.
 *
 * <p>Commands mit einem Konstruktor {@code (CliContext)} bekommen den aktuellen Kontext,
 * alles andere geht an die Picocli-Default-Factory.</p>
 */
public final class ContextFactory implements CommandLine.IFactory {
    private final CliContext ctx;
    private final CommandLine.IFactory fallback;

    public ContextFactory(CliContext ctx) {
        this(ctx, CommandLine.defaultFactory());
    }

    ContextFactory(CliContext ctx, CommandLine.IFactory fallback) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        for (Constructor<?> c : cls.getDeclaredConstructors()) {
            Class<?>[] p = c.getParameterTypes();
            if (p.length == 1 && p[0].equals(CliContext.class)) {
                c.setAccessible(true);
                @SuppressWarnings("unchecked")
                K instance = (K) c.newInstance(ctx);
                return instance;
            }
        }
        return fallback.create(cls);
    }
}
