package org.iceforge.sluice.governance;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request overrides, parsed and clamped once at the HTTP boundary.
 *
 * @param size          {@code _size}; null when absent
 * @param sizeMax       {@code _size=max}
 * @param timeLimitMs   {@code _timelimit}, already clamped to {@link #MIN_TIME_LIMIT_MS}; null when absent
 * @param ttlSeconds    {@code _ttl}; null when absent or not all digits
 * @param facets        {@code _facet}, de-duplicated, in request order
 * @param facetSize     {@code _facet_size}; null when absent
 * @param facetSizeMax  {@code _facet_size=max}
 * @param forceHash     {@code _hash} present
 */
public record RequestOverrides(
        Integer size,
        boolean sizeMax,
        Long timeLimitMs,
        Long ttlSeconds,
        List<String> facets,
        Integer facetSize,
        boolean facetSizeMax,
        boolean forceHash
) {
    public static final long MIN_TIME_LIMIT_MS = 1L;

    public static final String SIZE = "_size";
    public static final String TIME_LIMIT = "_timelimit";
    public static final String TTL = "_ttl";
    public static final String FACET = "_facet";
    public static final String FACET_SIZE = "_facet_size";
    public static final String HASH = "_hash";

    public RequestOverrides {
        facets = facets == null ? List.of() : List.copyOf(facets);
    }

    public static RequestOverrides none() {
        return new RequestOverrides(null, false, null, null, List.of(), null, false, false);
    }

    /**
     * Parse overrides from request parameters.
     *
     * @throws IllegalArgumentException for a malformed {@code _size}, {@code _facet_size} or {@code _timelimit}
     */
    public static RequestOverrides from(Map<String, List<String>> params) {
        Objects.requireNonNull(params, "params");

        String rawSize = first(params, SIZE);
        boolean sizeMax = "max".equals(rawSize);
        Integer size = sizeMax ? null : parsePositive(SIZE, rawSize);

        String rawFacetSize = first(params, FACET_SIZE);
        boolean facetSizeMax = "max".equals(rawFacetSize);
        Integer facetSize = facetSizeMax ? null : parsePositive(FACET_SIZE, rawFacetSize);

        Long timeLimit = null;
        String rawTimeLimit = first(params, TIME_LIMIT);
        if (rawTimeLimit != null && !rawTimeLimit.isBlank()) {
            try {
                timeLimit = Math.max(MIN_TIME_LIMIT_MS, Long.parseLong(rawTimeLimit.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(TIME_LIMIT + " must be an integer number of milliseconds");
            }
        }

        // Non-digit TTLs fall back to the configured default rather than failing the request.
        Long ttl = null;
        String rawTtl = first(params, TTL);
        if (rawTtl != null && !rawTtl.isEmpty() && rawTtl.length() <= 18
                && rawTtl.chars().allMatch(c -> c >= '0' && c <= '9')) {
            ttl = Long.parseLong(rawTtl);
        }

        List<String> facets = new ArrayList<>();
        List<String> rawFacets = params.get(FACET);
        if (rawFacets != null) {
            for (String f : new LinkedHashSet<>(rawFacets)) {
                if (f != null && !f.isBlank()) facets.add(f);
            }
        }

        return new RequestOverrides(size, sizeMax, timeLimit, ttl, facets, facetSize, facetSizeMax,
                params.containsKey(HASH));
    }

    /** Requested page size, or null to use the configured default. */
    public Integer pageSize(GovernanceConfig config) {
        return sizeMax ? Integer.valueOf(config.maxReturnedRows()) : size;
    }

    /** Effective facet size, clamped to {@code [1, max_returned_rows]}. */
    public int facetSize(GovernanceConfig config) {
        if (facetSizeMax) return config.maxReturnedRows();
        if (facetSize == null) return Math.min(config.defaultFacetSize(), config.maxReturnedRows());
        return Math.max(1, Math.min(facetSize, config.maxReturnedRows()));
    }

    private static String first(Map<String, List<String>> params, String key) {
        List<String> values = params.get(key);
        if (values == null || values.isEmpty()) return null;
        return values.get(0);
    }

    private static Integer parsePositive(String name, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < 0) {
                throw new IllegalArgumentException(name + " must be a positive integer or 'max'");
            }
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a positive integer or 'max'");
        }
    }
}
