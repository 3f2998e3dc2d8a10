package org.iceforge.sluice.cache;

import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.jdbc.DatabaseNotFoundException;
import org.iceforge.sluice.jdbc.DatabaseProperties;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves {@code name} and {@code name-<hash>} path segments.
 * <p>
 * When the segment lacks the current hash (or carries a stale one) and hashed URLs are on,
 * or the request asked for it with {@code _hash}, the client is redirected to the hashed
 * form. Only databases with a content hash are ever redirected.
 */
public class DatabaseRouteResolver {

    private final DatabaseProperties databases;
    private final ContentHashRegistry hashes;

    public DatabaseRouteResolver(DatabaseProperties databases, ContentHashRegistry hashes) {
        this.databases = Objects.requireNonNull(databases, "databases");
        this.hashes = Objects.requireNonNull(hashes, "hashes");
    }

    /**
     * @param segment   first path segment, already URL-decoded
     * @param table     table being addressed, or null
     * @param suffix    anything after the table (e.g. a format extension), or null
     * @param forceHash the request carried {@code _hash}
     * @throws DatabaseNotFoundException neither the segment nor its name part is a database
     */
    public DatabaseRoute resolve(String segment, String table, String suffix, boolean forceHash, GovernanceConfig config) {
        Objects.requireNonNull(segment, "segment");

        String name = segment;
        String provided = null;
        if (databases.get(segment) == null) {
            int dash = segment.lastIndexOf('-');
            if (dash <= 0 || databases.get(segment.substring(0, dash)) == null) {
                throw new DatabaseNotFoundException(segment);
            }
            name = segment.substring(0, dash);
            provided = segment.substring(dash + 1);
        }

        Optional<ContentHash> hash = hashes.hashFor(name);
        String expected = hash.map(ContentHash::urlHash).orElse(null);
        boolean correct = expected != null && expected.equals(provided);

        String redirect = null;
        if (!correct && expected != null && (config.hashUrls() || forceHash)) {
            redirect = hashedPath(config, name, expected, table, suffix);
        }
        return new DatabaseRoute(name, provided, expected, correct, redirect);
    }

    static String hashedPath(GovernanceConfig config, String name, String urlHash, String table, String suffix) {
        StringBuilder sb = new StringBuilder(basePrefix(config)).append('/').append(name).append('-').append(urlHash);
        if (table != null && !table.isEmpty()) {
            sb.append('/').append(URLEncoder.encode(table, StandardCharsets.UTF_8));
        }
        if (suffix != null) {
            sb.append(suffix);
        }
        return sb.toString();
    }

    /** {@code base_url} without its trailing slash, so paths can be appended. */
    static String basePrefix(GovernanceConfig config) {
        String base = config.baseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
