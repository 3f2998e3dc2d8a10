package org.iceforge.sluice.cache;

import org.iceforge.sluice.jdbc.DatabaseProperties;

import java.io.IOException;
import java.util.Optional;

/**
 * Produces a content hash for a database, or nothing when its content is not stable enough
 * to hash.
 */
public interface ContentHasher {

    Optional<String> hash(String database, DatabaseProperties.DatabaseConfig cfg) throws IOException;
}
