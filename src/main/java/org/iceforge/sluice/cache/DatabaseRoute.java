package org.iceforge.sluice.cache;

/**
 * A database path segment after resolution.
 *
 * @param name                the declared database name
 * @param providedHash        hash from a {@code name-<hash>} segment, or null
 * @param expectedHash        current URL hash of the database, or null if it is not hashed
 * @param correctHashProvided the segment carried the current hash
 * @param redirectPath        where the client should go instead, or null to serve in place
 */
public record DatabaseRoute(
        String name,
        String providedHash,
        String expectedHash,
        boolean correctHashProvided,
        String redirectPath
) {
    public boolean shouldRedirect() {
        return redirectPath != null;
    }
}
