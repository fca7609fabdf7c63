package de.htwsaar.assetguard.web.headers;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.WebUtils;

/**
 * Response-Wrapper mit echtem "gleich wird gesendet"-Hook.
 *
 * <p>Registrierte Aktionen laufen genau einmal, unmittelbar bevor die Antwort committed werden kann:
 * beim ersten Schreiben in Body-Stream oder Writer, bei {@code flush}/{@code close},
 * {@link #flushBuffer()}, {@link #sendError}, {@link #sendRedirect} oder spätestens bei
 * {@link #complete()} am Ende des Filters.</p>
 *
 * <p>Zurückgehaltene Header ({@link #holdBack}) erreichen die eigentliche Response erst nach den Hooks
 * und können vorher verworfen werden. Gesperrte Header ({@link #lock}) ignorieren spätere Schreibzugriffe.</p>
 */
public class HeaderGuardResponseWrapper extends HttpServletResponseWrapper {

    private static final Logger log = LoggerFactory.getLogger(HeaderGuardResponseWrapper.class);

    private final List<Runnable> beforeCommit = new ArrayList<>();
    private final Set<String> heldNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, List<String>> held = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Set<String> locked = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    private boolean hooksRan;
    private int pendingStatus = -1;
    private ServletOutputStream outputStream;
    private PrintWriter writer;

    public HeaderGuardResponseWrapper(HttpServletResponse response) {
        super(response);
    }

    /**
     * Sucht einen bereits vorhandenen Wrapper in der Wrapper-Kette.
     *
     * @param response Response, ggf. mehrfach gewrappt
     * @return Wrapper oder {@code null}
     */
    public static HeaderGuardResponseWrapper find(ServletResponse response) {
        return WebUtils.getNativeResponse(response, HeaderGuardResponseWrapper.class);
    }

    // ---------- Steuerung ----------

    /**
     * Registriert eine Aktion, die vor dem Commit läuft. Aktionen laufen in Registrierungsreihenfolge.
     *
     * @param action Aktion
     */
    public void onBeforeCommit(Runnable action) {
        if (hooksRan) {
            log.debug("Before-commit hook registered after commit preparation, ignoring");
            return;
        }
        beforeCommit.add(action);
    }

    /** Hält die genannten Header bis nach den Hooks zurück. */
    public void holdBack(Collection<String> names) {
        if (!hooksRan) {
            heldNames.addAll(names);
        }
    }

    /** Verwirft zurückgehaltene Werte der genannten Header. */
    public void dropHeld(Collection<String> names) {
        names.forEach(held::remove);
    }

    /** Sperrt die genannten Header gegen weitere Schreibzugriffe. */
    public void lock(Collection<String> names) {
        locked.addAll(names);
    }

    /**
     * Setzt einen Header an allen Sperren vorbei und sperrt ihn anschließend.
     *
     * @param name  Header-Name
     * @param value Wert
     */
    public void setHeaderAndLock(String name, String value) {
        super.setHeader(name, value);
        locked.add(name);
    }

    /** Führt die Hooks aus, falls das noch nicht passiert ist. Idempotent. */
    public void complete() {
        runBeforeCommit();
    }

    /** @return {@code true}, sobald die Hooks gelaufen sind */
    public boolean isCompleted() {
        return hooksRan;
    }

    private void runBeforeCommit() {
        if (hooksRan) {
            return;
        }
        hooksRan = true;
        for (Runnable action : beforeCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Before-commit header hook failed", e);
            }
        }
        releaseHeld();
    }

    private void releaseHeld() {
        held.forEach((name, values) -> {
            for (int i = 0; i < values.size(); i++) {
                if (i == 0) {
                    super.setHeader(name, values.get(i));
                } else {
                    super.addHeader(name, values.get(i));
                }
            }
        });
        held.clear();
    }

    private boolean isHeld(String name) {
        return !hooksRan && name != null && heldNames.contains(name);
    }

    private boolean isLocked(String name) {
        if (name != null && locked.contains(name)) {
            log.trace("Ignoring write to locked header {}", name);
            return true;
        }
        return false;
    }

    // ---------- Header ----------

    @Override
    public void setHeader(String name, String value) {
        if (isLocked(name)) return;
        if (isHeld(name)) {
            if (value == null) {
                held.remove(name);
            } else {
                held.put(name, new ArrayList<>(List.of(value)));
            }
            return;
        }
        super.setHeader(name, value);
    }

    @Override
    public void addHeader(String name, String value) {
        if (isLocked(name)) return;
        if (isHeld(name)) {
            if (value != null) {
                held.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            }
            return;
        }
        super.addHeader(name, value);
    }

    @Override
    public void setIntHeader(String name, int value) {
        if (isLocked(name)) return;
        if (isHeld(name)) {
            setHeader(name, String.valueOf(value));
            return;
        }
        super.setIntHeader(name, value);
    }

    @Override
    public void addIntHeader(String name, int value) {
        if (isLocked(name)) return;
        if (isHeld(name)) {
            addHeader(name, String.valueOf(value));
            return;
        }
        super.addIntHeader(name, value);
    }

    @Override
    public void setDateHeader(String name, long date) {
        if (isLocked(name)) return;
        if (isHeld(name)) {
            setHeader(name, formatDate(date));
            return;
        }
        super.setDateHeader(name, date);
    }

    @Override
    public void addDateHeader(String name, long date) {
        if (isLocked(name)) return;
        if (isHeld(name)) {
            addHeader(name, formatDate(date));
            return;
        }
        super.addDateHeader(name, date);
    }

    @Override
    public boolean containsHeader(String name) {
        return held.containsKey(name) || super.containsHeader(name);
    }

    @Override
    public String getHeader(String name) {
        List<String> values = held.get(name);
        if (values != null && !values.isEmpty()) {
            return values.get(0);
        }
        return super.getHeader(name);
    }

    @Override
    public Collection<String> getHeaders(String name) {
        List<String> values = held.get(name);
        if (values != null) {
            List<String> all = new ArrayList<>(super.getHeaders(name));
            all.addAll(values);
            return all;
        }
        return super.getHeaders(name);
    }

    @Override
    public Collection<String> getHeaderNames() {
        Set<String> names = new LinkedHashSet<>(super.getHeaderNames());
        names.addAll(held.keySet());
        return names;
    }

    @Override
    public int getStatus() {
        return pendingStatus > 0 ? pendingStatus : super.getStatus();
    }

    // ---------- Commit-Auslöser ----------

    @Override
    public void flushBuffer() throws IOException {
        runBeforeCommit();
        super.flushBuffer();
    }

    @Override
    public void sendError(int sc) throws IOException {
        pendingStatus = sc;
        runBeforeCommit();
        super.sendError(sc);
    }

    @Override
    public void sendError(int sc, String msg) throws IOException {
        pendingStatus = sc;
        runBeforeCommit();
        super.sendError(sc, msg);
    }

    @Override
    public void sendRedirect(String location) throws IOException {
        pendingStatus = SC_FOUND;
        runBeforeCommit();
        super.sendRedirect(location);
    }

    @Override
    public void reset() {
        super.reset();
        held.clear();
        locked.clear();
        pendingStatus = -1;
        hooksRan = false;
    }

    @Override
    public ServletOutputStream getOutputStream() throws IOException {
        if (outputStream == null) {
            outputStream = new GuardedOutputStream(super.getOutputStream());
        }
        return outputStream;
    }

    @Override
    public PrintWriter getWriter() throws IOException {
        if (writer == null) {
            writer = new PrintWriter(new GuardedWriter(super.getWriter()));
        }
        return writer;
    }

    private static String formatDate(long epochMillis) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(Instant.ofEpochMilli(epochMillis).atOffset(ZoneOffset.UTC));
    }

    private final class GuardedOutputStream extends ServletOutputStream {

        private final ServletOutputStream delegate;

        GuardedOutputStream(ServletOutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean isReady() {
            return delegate.isReady();
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
            delegate.setWriteListener(writeListener);
        }

        @Override
        public void write(int b) throws IOException {
            runBeforeCommit();
            delegate.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            runBeforeCommit();
            delegate.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            runBeforeCommit();
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            runBeforeCommit();
            delegate.close();
        }
    }

    private final class GuardedWriter extends Writer {

        private final PrintWriter delegate;

        GuardedWriter(PrintWriter delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(char[] cbuf, int off, int len) {
            runBeforeCommit();
            delegate.write(cbuf, off, len);
        }

        @Override
        public void write(String str, int off, int len) {
            runBeforeCommit();
            delegate.write(str, off, len);
        }

        @Override
        public void flush() {
            runBeforeCommit();
            delegate.flush();
        }

        @Override
        public void close() {
            runBeforeCommit();
            delegate.close();
        }
    }
}
