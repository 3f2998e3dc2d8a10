package org.iceforge.sluice.cache;

import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.RequestOverrides;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides cache headers and the URL form of self-referential links.
 * <p>
 * A response addressed through the current content hash can be cached for
 * {@code default_cache_ttl_hashed}: the URL changes whenever the content does. Anything
 * else gets {@code default_cache_ttl}. An explicit {@code _ttl} beats both.
 */
public class CacheDirector {

    public static final String REFERRER_POLICY = "no-referrer";

    private final ContentHashRegistry hashes;

    public CacheDirector(ContentHashRegistry hashes) {
        this.hashes = Objects.requireNonNull(hashes, "hashes");
    }

    public CachePolicy cachePolicy(DatabaseRoute route, RequestOverrides overrides, GovernanceConfig config) {
        CachePolicy.UrlForm form = route.correctHashProvided() ? CachePolicy.UrlForm.HASHED : CachePolicy.UrlForm.PLAIN;
        if (overrides.ttlSeconds() != null) {
            return new CachePolicy(overrides.ttlSeconds(), form);
        }
        long ttl = form == CachePolicy.UrlForm.HASHED ? config.defaultCacheTtlHashed() : config.defaultCacheTtl();
        return new CachePolicy(Math.max(0L, ttl), form);
    }

    /** {@code /name-<hash>} when hashed URLs are on and the database has a hash, else {@code /name}. */
    public String databasePath(String database, GovernanceConfig config) {
        String prefix = DatabaseRouteResolver.basePrefix(config);
        if (config.hashUrls()) {
            Optional<ContentHash> hash = hashes.hashFor(database);
            if (hash.isPresent()) {
                return prefix + "/" + database + "-" + hash.get().urlHash();
            }
        }
        return prefix + "/" + database;
    }

    public String tablePath(String database, String table, GovernanceConfig config) {
        return databasePath(database, config) + "/" + URLEncoder.encode(table, StandardCharsets.UTF_8);
    }

    /** Rewrites {@code http://} to {@code https://} when {@code force_https_urls} is on. */
    public String absoluteUrl(String url, GovernanceConfig config) {
        if (config.forceHttpsUrls() && url != null && url.startsWith("http://")) {
            return "https://" + url.substring("http://".length());
        }
        return url;
    }
}
