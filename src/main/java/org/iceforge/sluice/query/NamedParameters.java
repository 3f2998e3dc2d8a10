package org.iceforge.sluice.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@code :name} parameter support for engines whose JDBC drivers only understand {@code ?}.
 * <p>
 * Markers inside string literals, quoted identifiers and comments are left alone, as are
 * {@code ::} casts.
 */
public final class NamedParameters {
    private NamedParameters() {
    }

    /** Parameter names in order of first appearance. */
    public static List<String> extract(String sql) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        scan(sql, null, false, names::add);
        return List.copyOf(names);
    }

    /**
     * The SQL with comments and the contents of quoted literals and identifiers replaced by
     * spaces, so keyword checks only see code. Offsets are preserved apart from markers,
     * which collapse to {@code ?}.
     */
    static String codeOnly(String sql) {
        StringBuilder out = new StringBuilder(sql == null ? 0 : sql.length());
        scan(sql, out, true, name -> { });
        return out.toString();
    }

    /**
     * Replace each marker with {@code ?} and line up values in occurrence order.
     * A parameter with no value binds as the empty string.
     */
    public static Rewritten rewrite(String sql, Map<String, ?> values) {
        Map<String, ?> v = values == null ? Map.of() : values;
        List<String> refs = new ArrayList<>();
        StringBuilder out = new StringBuilder(sql == null ? 0 : sql.length());
        scan(sql, out, false, refs::add);

        List<Object> bound = new ArrayList<>(refs.size());
        for (String name : refs) {
            bound.add(v.containsKey(name) && v.get(name) != null ? v.get(name) : "");
        }
        return new Rewritten(out.toString(), refs, bound);
    }

    /**
     * Walk the SQL once, reporting marker names; when {@code out} is non-null also copy the
     * SQL with markers replaced by {@code ?}. With {@code blankQuoted} the copy has comments and
     * quoted text blanked out.
     */
    private static void scan(String sql, StringBuilder out, boolean blankQuoted, Consumer<String> onMarker) {
        Objects.requireNonNull(onMarker, "onMarker");
        if (sql == null) return;

        boolean inSingle = false;
        boolean inDouble = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char n = (i + 1) < sql.length() ? sql.charAt(i + 1) : '\0';

            if (inLineComment) {
                append(out, blankQuoted ? ' ' : c);
                if (c == '\n') inLineComment = false;
                continue;
            }
            if (inBlockComment) {
                append(out, blankQuoted ? ' ' : c);
                if (c == '*' && n == '/') {
                    append(out, blankQuoted ? ' ' : n);
                    i++;
                    inBlockComment = false;
                }
                continue;
            }

            if (!inSingle && !inDouble) {
                if (c == '-' && n == '-') {
                    append(out, blankQuoted ? ' ' : c);
                    append(out, blankQuoted ? ' ' : n);
                    i++;
                    inLineComment = true;
                    continue;
                }
                if (c == '/' && n == '*') {
                    append(out, blankQuoted ? ' ' : c);
                    append(out, blankQuoted ? ' ' : n);
                    i++;
                    inBlockComment = true;
                    continue;
                }
            }

            if (!inDouble && c == '\'') {
                inSingle = !inSingle;
                append(out, c);
                continue;
            }
            if (!inSingle && c == '"') {
                inDouble = !inDouble;
                append(out, c);
                continue;
            }

            if (!inSingle && !inDouble && c == ':') {
                if (n == ':') {
                    // cast, e.g. x::int
                    append(out, c);
                    append(out, n);
                    i++;
                    continue;
                }
                if (isNameStart(n) && (i == 0 || sql.charAt(i - 1) != ':')) {
                    int j = i + 1;
                    while (j < sql.length() && isNamePart(sql.charAt(j))) j++;
                    onMarker.accept(sql.substring(i + 1, j));
                    append(out, '?');
                    i = j - 1;
                    continue;
                }
            }

            append(out, blankQuoted && (inSingle || inDouble) ? ' ' : c);
        }
    }

    private static void append(StringBuilder out, char c) {
        if (out != null) out.append(c);
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * @param sql    SQL with {@code ?} markers
     * @param names  parameter name for each marker, in order
     * @param values value bound to each marker, in order
     */
    public record Rewritten(String sql, List<String> names, List<Object> values) {
        public Rewritten {
            names = List.copyOf(names);
            values = List.copyOf(values);
        }
    }
}
