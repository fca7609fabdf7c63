package de.htwsaar.assetguard.fingerprint.rewrite;

import de.htwsaar.assetguard.common.util.PathUtils;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Schreibt Referenzen in Stylesheets auf gefingerprintete Dateinamen um.
 *
 * <p>Erkannt werden {@code url(...)}, {@code @import "..."} und
 * {@code sourceMappingURL=...}. Relative Referenzen werden gegen das Verzeichnis des
 * Stylesheets aufgelöst, Referenzen mit führendem Slash gegen den öffentlichen Root.
 * Unbekannte Ziele bleiben unverändert, damit Teil-Builds funktionieren.</p>
 */
public class ReferenceRewriter {

    private static final Pattern URL_REF = Pattern.compile("url\\(\\s*(['\"]?)([^'\")\\s]+)\\1\\s*\\)");
    private static final Pattern IMPORT_REF = Pattern.compile("@import\\s+(['\"])([^'\"]+)\\1");
    private static final Pattern SOURCE_MAP_REF = Pattern.compile("(sourceMappingURL=)()([^\\s*]+)");

    private static final List<String> EXTERNAL_PREFIXES = List.of("data:", "http:", "https:", "//", "#", "about:");

    /**
     * Schreibt ein Stylesheet um.
     *
     * @param css            Inhalt des Stylesheets
     * @param stylesheetPath logischer Pfad des Stylesheets, z. B. {@code vendor/govuk.css}
     * @param knownNames     bisher erzeugte Zuordnung logischer Pfad → Fingerprint-Pfad derselben Herkunft
     * @return umgeschriebener Inhalt
     */
    public String rewrite(String css, String stylesheetPath, Map<String, String> knownNames) {
        if (css == null || css.isEmpty() || knownNames == null || knownNames.isEmpty()) {
            return css;
        }
        String baseDir = parentOf(PathUtils.toLogicalPath(stylesheetPath));
        Map<String, String> memo = new HashMap<>();

        String result = replace(URL_REF, 2, css, ref -> memo.computeIfAbsent(ref, r -> rewriteReference(r, baseDir, knownNames)));
        result = replace(IMPORT_REF, 2, result, ref -> memo.computeIfAbsent(ref, r -> rewriteReference(r, baseDir, knownNames)));
        result = replace(SOURCE_MAP_REF, 3, result, ref -> memo.computeIfAbsent(ref, r -> rewriteReference(r, baseDir, knownNames)));
        return result;
    }

    /**
     * Schreibt eine einzelne Referenz um.
     *
     * @param reference  Referenz wie im Stylesheet, ggf. mit Query oder Fragment
     * @param baseDir    logisches Verzeichnis des Stylesheets
     * @param knownNames bekannte Fingerprint-Pfade
     * @return neue Referenz oder die unveränderte Eingabe
     */
    String rewriteReference(String reference, String baseDir, Map<String, String> knownNames) {
        String ref = reference.trim();
        if (ref.isEmpty() || isExternal(ref)) {
            return reference;
        }
        String pathPart = PathUtils.stripQueryAndFragment(ref);
        String suffix = ref.substring(pathPart.length());
        if (pathPart.isEmpty()) {
            return reference;
        }

        String logical = pathPart.startsWith("/")
                ? normalize("", pathPart.substring(1))
                : normalize(baseDir, pathPart);
        if (logical == null) {
            return reference;
        }
        String fingerprinted = knownNames.get(logical);
        if (fingerprinted == null) {
            return reference;
        }
        int slash = pathPart.lastIndexOf('/');
        String dirPart = slash >= 0 ? pathPart.substring(0, slash + 1) : "";
        return dirPart + PathUtils.lastSegment(fingerprinted) + suffix;
    }

    private static String replace(Pattern pattern, int group, String input, java.util.function.UnaryOperator<String> fn) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder(input.length());
        while (m.find()) {
            String ref = m.group(group);
            String replaced = fn.apply(ref);
            String whole = m.group();
            int start = m.start(group) - m.start();
            int end = m.end(group) - m.start();
            String rebuilt = whole.substring(0, start) + replaced + whole.substring(end);
            m.appendReplacement(sb, Matcher.quoteReplacement(rebuilt));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean isExternal(String ref) {
        String lower = ref.toLowerCase();
        for (String prefix : EXTERNAL_PREFIXES) {
            if (lower.startsWith(prefix)) return true;
        }
        return false;
    }

    /**
     * Löst {@code .} und {@code ..} auf.
     *
     * @return logischer Pfad oder {@code null}, wenn der Pfad den Root verlässt
     */
    private static String normalize(String baseDir, String relative) {
        Deque<String> segments = new ArrayDeque<>();
        String joined = baseDir.isEmpty() ? relative : baseDir + "/" + relative;
        for (String segment : joined.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) return null;
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    private static String parentOf(String logicalPath) {
        int slash = logicalPath.lastIndexOf('/');
        return slash >= 0 ? logicalPath.substring(0, slash) : "";
    }
}
