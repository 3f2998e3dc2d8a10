package org.iceforge.sluice.governance;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Operator-facing governance settings.
 * <p>
 * Spring binds these once at startup; the rest of the application only ever sees the
 * immutable {@link GovernanceConfig} snapshot produced by {@link #toConfig()}.
 */
@ConfigurationProperties(prefix = "sluice.governance")
public class GovernanceProperties {

    /** Default number of rows returned when a request does not set {@code _size}. */
    private int defaultPageSize = 100;

    /** Hard ceiling on rows returned by any single query. */
    private int maxReturnedRows = 1000;

    /** Default deadline for a governed query. 0 disables the limit. */
    private long sqlTimeLimitMs = 1000;

    /** Worker pool size; each slot owns its own engine connections. */
    private int numSqlThreads = 3;

    /** Permit ad hoc {@code _facet=} parameters. */
    private boolean allowFacet = true;

    private int defaultFacetSize = 30;

    /** Deadline for an explicitly requested facet. */
    private long facetTimeLimitMs = 200;

    /** Deadline for each speculative facet suggestion. */
    private long facetSuggestTimeLimitMs = 50;

    private boolean suggestFacets = true;

    private boolean allowDownload = true;

    /** Permit free-form SQL. Table browsing and facets are unaffected. */
    private boolean allowSql = true;

    /** TTL in seconds for responses served from unhashed URLs. */
    private long defaultCacheTtl = 5;

    /** TTL in seconds for responses served from content-hashed URLs. */
    private long defaultCacheTtlHashed = 31_536_000L;

    /** Per-connection engine cache size. 0 keeps the engine default. */
    private int cacheSizeKb = 0;

    private boolean allowCsvStream = true;

    /** Size cap for streamed CSV exports. 0 means unlimited. */
    private int maxCsvMb = 100;

    private int truncateCellsHtml = 0;

    private boolean forceHttpsUrls = false;

    private boolean hashUrls = false;

    private boolean templateDebug = false;

    private String baseUrl = "/";

    public GovernanceConfig toConfig() {
        return new GovernanceConfig(
                defaultPageSize,
                maxReturnedRows,
                sqlTimeLimitMs,
                numSqlThreads,
                allowFacet,
                defaultFacetSize,
                facetTimeLimitMs,
                facetSuggestTimeLimitMs,
                suggestFacets,
                allowDownload,
                allowSql,
                defaultCacheTtl,
                defaultCacheTtlHashed,
                cacheSizeKb,
                allowCsvStream,
                maxCsvMb,
                truncateCellsHtml,
                forceHttpsUrls,
                hashUrls,
                templateDebug,
                baseUrl
        );
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxReturnedRows() {
        return maxReturnedRows;
    }

    public void setMaxReturnedRows(int maxReturnedRows) {
        this.maxReturnedRows = maxReturnedRows;
    }

    public long getSqlTimeLimitMs() {
        return sqlTimeLimitMs;
    }

    public void setSqlTimeLimitMs(long sqlTimeLimitMs) {
        this.sqlTimeLimitMs = sqlTimeLimitMs;
    }

    public int getNumSqlThreads() {
        return numSqlThreads;
    }

    public void setNumSqlThreads(int numSqlThreads) {
        this.numSqlThreads = numSqlThreads;
    }

    public boolean isAllowFacet() {
        return allowFacet;
    }

    public void setAllowFacet(boolean allowFacet) {
        this.allowFacet = allowFacet;
    }

    public int getDefaultFacetSize() {
        return defaultFacetSize;
    }

    public void setDefaultFacetSize(int defaultFacetSize) {
        this.defaultFacetSize = defaultFacetSize;
    }

    public long getFacetTimeLimitMs() {
        return facetTimeLimitMs;
    }

    public void setFacetTimeLimitMs(long facetTimeLimitMs) {
        this.facetTimeLimitMs = facetTimeLimitMs;
    }

    public long getFacetSuggestTimeLimitMs() {
        return facetSuggestTimeLimitMs;
    }

    public void setFacetSuggestTimeLimitMs(long facetSuggestTimeLimitMs) {
        this.facetSuggestTimeLimitMs = facetSuggestTimeLimitMs;
    }

    public boolean isSuggestFacets() {
        return suggestFacets;
    }

    public void setSuggestFacets(boolean suggestFacets) {
        this.suggestFacets = suggestFacets;
    }

    public boolean isAllowDownload() {
        return allowDownload;
    }

    public void setAllowDownload(boolean allowDownload) {
        this.allowDownload = allowDownload;
    }

    public boolean isAllowSql() {
        return allowSql;
    }

    public void setAllowSql(boolean allowSql) {
        this.allowSql = allowSql;
    }

    public long getDefaultCacheTtl() {
        return defaultCacheTtl;
    }

    public void setDefaultCacheTtl(long defaultCacheTtl) {
        this.defaultCacheTtl = defaultCacheTtl;
    }

    public long getDefaultCacheTtlHashed() {
        return defaultCacheTtlHashed;
    }

    public void setDefaultCacheTtlHashed(long defaultCacheTtlHashed) {
        this.defaultCacheTtlHashed = defaultCacheTtlHashed;
    }

    public int getCacheSizeKb() {
        return cacheSizeKb;
    }

    public void setCacheSizeKb(int cacheSizeKb) {
        this.cacheSizeKb = cacheSizeKb;
    }

    public boolean isAllowCsvStream() {
        return allowCsvStream;
    }

    public void setAllowCsvStream(boolean allowCsvStream) {
        this.allowCsvStream = allowCsvStream;
    }

    public int getMaxCsvMb() {
        return maxCsvMb;
    }

    public void setMaxCsvMb(int maxCsvMb) {
        this.maxCsvMb = maxCsvMb;
    }

    public int getTruncateCellsHtml() {
        return truncateCellsHtml;
    }

    public void setTruncateCellsHtml(int truncateCellsHtml) {
        this.truncateCellsHtml = truncateCellsHtml;
    }

    public boolean isForceHttpsUrls() {
        return forceHttpsUrls;
    }

    public void setForceHttpsUrls(boolean forceHttpsUrls) {
        this.forceHttpsUrls = forceHttpsUrls;
    }

    public boolean isHashUrls() {
        return hashUrls;
    }

    public void setHashUrls(boolean hashUrls) {
        this.hashUrls = hashUrls;
    }

    public boolean isTemplateDebug() {
        return templateDebug;
    }

    public void setTemplateDebug(boolean templateDebug) {
        this.templateDebug = templateDebug;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
