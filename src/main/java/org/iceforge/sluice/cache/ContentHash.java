package org.iceforge.sluice.cache;

import java.util.Objects;

/**
 * Fingerprint of a database's content.
 *
 * @param databaseId declared database name
 * @param hash       lowercase SHA-256 hex of the database file
 */
public record ContentHash(String databaseId, String hash) {

    /** Characters of the hash embedded in URLs. */
    public static final int URL_LENGTH = 7;

    public ContentHash {
        Objects.requireNonNull(databaseId, "databaseId");
        Objects.requireNonNull(hash, "hash");
        if (hash.length() < URL_LENGTH) {
            throw new IllegalArgumentException("hash too short: " + hash);
        }
    }

    /** The prefix used in {@code /name-<hash>} paths. */
    public String urlHash() {
        return hash.substring(0, URL_LENGTH);
    }
}
