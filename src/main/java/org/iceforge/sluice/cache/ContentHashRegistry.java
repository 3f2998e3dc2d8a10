package org.iceforge.sluice.cache;

import org.iceforge.sluice.jdbc.DatabaseNotFoundException;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoized content hashes, one per database.
 * <p>
 * A hash is computed on first access and kept until {@link #invalidate} is called; noticing
 * that a file changed is up to whoever calls it. Failures are not memoized.
 */
public class ContentHashRegistry {
    private static final Logger log = LoggerFactory.getLogger(ContentHashRegistry.class);

    private final DatabaseProperties databases;
    private final ContentHasher hasher;
    private final ConcurrentHashMap<String, Optional<ContentHash>> hashes = new ConcurrentHashMap<>();

    public ContentHashRegistry(DatabaseProperties databases, ContentHasher hasher) {
        this.databases = Objects.requireNonNull(databases, "databases");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    /**
     * @return the hash, or empty for databases that are not hashed (mutable or without a file)
     * @throws DatabaseNotFoundException unknown database
     */
    public Optional<ContentHash> hashFor(String databaseId) {
        DatabaseProperties.DatabaseConfig cfg = databases.get(databaseId);
        if (cfg == null) {
            throw new DatabaseNotFoundException(databaseId);
        }
        return hashes.computeIfAbsent(databaseId, id -> compute(id, cfg));
    }

    public void invalidate(String databaseId) {
        if (hashes.remove(databaseId) != null) {
            log.info("Invalidated content hash for database={}", databaseId);
        }
    }

    private Optional<ContentHash> compute(String databaseId, DatabaseProperties.DatabaseConfig cfg) {
        try {
            return hasher.hash(databaseId, cfg).map(h -> new ContentHash(databaseId, h));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash database " + databaseId, e);
        }
    }
}
