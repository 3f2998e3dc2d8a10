package org.iceforge.sluice.governance;

/**
 * Immutable snapshot of the governance settings.
 * <p>
 * Passed explicitly into every governed call. A reload swaps the whole snapshot
 * (see {@link GovernanceConfigHolder}); a snapshot itself never changes.
 */
public record GovernanceConfig(
        int defaultPageSize,
        int maxReturnedRows,
        long sqlTimeLimitMs,
        int numSqlThreads,
        boolean allowFacet,
        int defaultFacetSize,
        long facetTimeLimitMs,
        long facetSuggestTimeLimitMs,
        boolean suggestFacets,
        boolean allowDownload,
        boolean allowSql,
        long defaultCacheTtl,
        long defaultCacheTtlHashed,
        int cacheSizeKb,
        boolean allowCsvStream,
        int maxCsvMb,
        int truncateCellsHtml,
        boolean forceHttpsUrls,
        boolean hashUrls,
        boolean templateDebug,
        String baseUrl
) {

    public GovernanceConfig {
        // one extra row is fetched to detect truncation
        if (maxReturnedRows <= 0 || maxReturnedRows == Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "maxReturnedRows must be between 1 and " + (Integer.MAX_VALUE - 1) + ": " + maxReturnedRows);
        }
        if (numSqlThreads <= 0) {
            throw new IllegalArgumentException("numSqlThreads must be > 0: " + numSqlThreads);
        }
        if (sqlTimeLimitMs < 0 || facetTimeLimitMs < 0 || facetSuggestTimeLimitMs < 0) {
            throw new IllegalArgumentException("time limits must be >= 0");
        }
        if (defaultPageSize <= 0) defaultPageSize = 100;
        if (defaultFacetSize <= 0) defaultFacetSize = 30;
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "/";
    }

    /** Defaults as documented for the configuration surface. */
    public static GovernanceConfig defaults() {
        return new GovernanceProperties().toConfig();
    }
}
