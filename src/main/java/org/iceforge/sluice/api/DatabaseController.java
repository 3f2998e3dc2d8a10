package org.iceforge.sluice.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.sluice.cache.CacheDirector;
import org.iceforge.sluice.cache.CachePolicy;
import org.iceforge.sluice.cache.DatabaseRoute;
import org.iceforge.sluice.cache.DatabaseRouteResolver;
import org.iceforge.sluice.facet.FacetMode;
import org.iceforge.sluice.facet.FacetPlanRequest;
import org.iceforge.sluice.facet.FacetPlanner;
import org.iceforge.sluice.facet.FacetRequest;
import org.iceforge.sluice.facet.FacetResult;
import org.iceforge.sluice.governance.ExportGuard;
import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.GovernanceConfigHolder;
import org.iceforge.sluice.governance.RequestOverrides;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.iceforge.sluice.query.NamedParameters;
import org.iceforge.sluice.query.QueryGovernor;
import org.iceforge.sluice.query.QueryResult;
import org.iceforge.sluice.query.QuerySpec;
import org.iceforge.sluice.query.TableCatalog;
import org.iceforge.sluice.query.TableNotFoundException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Database, query and table views. Every request reads one configuration snapshot and uses
 * it throughout, so a concurrent reload never mixes settings within a response.
 */
@RestController
public class DatabaseController {

    private final GovernanceConfigHolder configs;
    private final DatabaseProperties databases;
    private final QueryGovernor governor;
    private final TableCatalog catalog;
    private final FacetPlanner facets;
    private final DatabaseRouteResolver routes;
    private final CacheDirector cache;
    private final CsvTableExporter csv;

    public DatabaseController(GovernanceConfigHolder configs,
                              DatabaseProperties databases,
                              QueryGovernor governor,
                              TableCatalog catalog,
                              FacetPlanner facets,
                              DatabaseRouteResolver routes,
                              CacheDirector cache,
                              CsvTableExporter csv) {
        this.configs = Objects.requireNonNull(configs);
        this.databases = Objects.requireNonNull(databases);
        this.governor = Objects.requireNonNull(governor);
        this.catalog = Objects.requireNonNull(catalog);
        this.facets = Objects.requireNonNull(facets);
        this.routes = Objects.requireNonNull(routes);
        this.cache = Objects.requireNonNull(cache);
        this.csv = Objects.requireNonNull(csv);
    }

    /** Table listing, or the result of {@code ?sql=} when present. */
    @GetMapping("/{database}")
    public ResponseEntity<?> database(@PathVariable("database") String segment,
                                      @RequestParam MultiValueMap<String, String> params,
                                      HttpServletRequest request) {
        GovernanceConfig config = configs.current();
        RequestOverrides overrides = RequestOverrides.from(params);
        DatabaseRoute route = routes.resolve(segment, null, null, overrides.forceHash(), config);
        if (route.shouldRedirect()) {
            return redirect(route.redirectPath(), request);
        }
        CachePolicy policy = cache.cachePolicy(route, overrides, config);
        String db = route.name();

        String sql = params.getFirst("sql");
        if (sql == null || sql.isBlank()) {
            TableCatalog.Listing listing = catalog.tables(db, config);
            ApiModels.DatabaseResponse body = new ApiModels.DatabaseResponse(
                    db, cache.databasePath(db, config), route.expectedHash(), listing.names(), listing.truncated());
            return ok(body, policy);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : NamedParameters.extract(sql)) {
            values.put(name, params.getFirst(name));
        }
        QuerySpec spec = QuerySpec.userSql(db, sql, values)
                .withRowLimit(overrides.pageSize(config))
                .withTimeLimit(overrides.timeLimitMs());
        QueryResult result = governor.execute(spec, config);

        ApiModels.QueryResponse body = new ApiModels.QueryResponse(
                db, result.columns(), result.rows(), result.truncated(), millis(result),
                new ApiModels.QueryResponse.Query(sql, spec.params()));
        return ok(body, policy);
    }

    /** Browse a table with its facets. */
    @GetMapping("/{database}/{table}")
    public ResponseEntity<?> table(@PathVariable("database") String segment,
                                   @PathVariable("table") String table,
                                   @RequestParam MultiValueMap<String, String> params,
                                   HttpServletRequest request) {
        GovernanceConfig config = configs.current();
        RequestOverrides overrides = RequestOverrides.from(params);
        DatabaseRoute route = routes.resolve(segment, table, null, overrides.forceHash(), config);
        if (route.shouldRedirect()) {
            return redirect(route.redirectPath(), request);
        }
        String db = route.name();
        if (!catalog.exists(db, table, config)) {
            throw new TableNotFoundException(db, table);
        }

        String baseSql = TableCatalog.browseSql(table);
        QueryResult result = governor.execute(QuerySpec.system(db, baseSql, Map.of())
                .withRowLimit(overrides.pageSize(config))
                .withTimeLimit(overrides.timeLimitMs()), config);

        List<FacetRequest> wanted = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String column : databases.get(db).declaredFacets(table)) {
            if (seen.add(column)) wanted.add(FacetRequest.declared(column));
        }
        for (String column : overrides.facets()) {
            if (seen.add(column)) wanted.add(FacetRequest.requested(column));
        }
        wanted.addAll(FacetPlanner.suggestionsFor(result.columns()));

        List<FacetResult> planned = facets.plan(new FacetPlanRequest(
                db, table, baseSql, Map.of(), result.columns(), wanted, overrides.facetSize(config)), config);

        List<ApiModels.Facet> facetResults = new ArrayList<>();
        List<ApiModels.SuggestedFacet> suggested = new ArrayList<>();
        for (FacetResult r : planned) {
            if (r.mode() == FacetMode.REQUESTED) {
                facetResults.add(ApiModels.Facet.from(r));
            } else if (!r.skipped()) {
                suggested.add(new ApiModels.SuggestedFacet(r.column(), toggleUrl(request, r.column(), config)));
            }
        }

        ApiModels.TableResponse body = new ApiModels.TableResponse(
                db, table, result.columns(), result.rows(), result.truncated(), millis(result),
                facetResults, suggested);
        return ok(body, cache.cachePolicy(route, overrides, config));
    }

    /** Whole table as CSV. */
    @GetMapping("/{database}/{table}/-/csv")
    public ResponseEntity<StreamingResponseBody> tableCsv(@PathVariable("database") String segment,
                                                          @PathVariable("table") String table,
                                                          @RequestParam MultiValueMap<String, String> params,
                                                          HttpServletRequest request) {
        GovernanceConfig config = configs.current();
        RequestOverrides overrides = RequestOverrides.from(params);
        DatabaseRoute route = routes.resolve(segment, table, "/-/csv", overrides.forceHash(), config);
        if (route.shouldRedirect()) {
            return redirect(route.redirectPath(), request);
        }
        ExportGuard.checkCsvStream(config);
        String db = route.name();
        if (!catalog.exists(db, table, config)) {
            throw new TableNotFoundException(db, table);
        }

        StreamingResponseBody body = out -> csv.export(db, table, config, out);
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + table + ".csv\"")
                .header(HttpHeaders.CACHE_CONTROL, cache.cachePolicy(route, overrides, config).cacheControl())
                .header("Referrer-Policy", CacheDirector.REFERRER_POLICY)
                .body(body);
    }

    /** The raw database file, for immutable file-backed databases only. */
    @GetMapping("/{database}/-/download")
    public ResponseEntity<StreamingResponseBody> download(@PathVariable("database") String segment,
                                                          @RequestParam MultiValueMap<String, String> params,
                                                          HttpServletRequest request) {
        GovernanceConfig config = configs.current();
        RequestOverrides overrides = RequestOverrides.from(params);
        DatabaseRoute route = routes.resolve(segment, null, "/-/download", overrides.forceHash(), config);
        if (route.shouldRedirect()) {
            return redirect(route.redirectPath(), request);
        }
        String db = route.name();
        Path file = ExportGuard.checkDownload(config, db, databases.get(db));

        StreamingResponseBody body = out -> Files.copy(file, out);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.getFileName() + "\"")
                .header(HttpHeaders.CACHE_CONTROL, cache.cachePolicy(route, overrides, config).cacheControl())
                .header("Referrer-Policy", CacheDirector.REFERRER_POLICY)
                .body(body);
    }

    private static <T> ResponseEntity<T> ok(T body, CachePolicy policy) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, policy.cacheControl())
                .header("Referrer-Policy", CacheDirector.REFERRER_POLICY)
                .body(body);
    }

    private static <T> ResponseEntity<T> redirect(String path, HttpServletRequest request) {
        String query = queryWithout(request.getQueryString(), RequestOverrides.HASH);
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, query.isEmpty() ? path : path + "?" + query)
                .header("Referrer-Policy", CacheDirector.REFERRER_POLICY)
                .build();
    }

    private String toggleUrl(HttpServletRequest request, String column, GovernanceConfig config) {
        String query = request.getQueryString();
        String url = request.getRequestURL() + "?"
                + (query == null || query.isEmpty() ? "" : query + "&")
                + RequestOverrides.FACET + "=" + URLEncoder.encode(column, StandardCharsets.UTF_8);
        return cache.absoluteUrl(url, config);
    }

    /** Drops every {@code key} / {@code key=...} pair from a raw query string. */
    static String queryWithout(String query, String key) {
        if (query == null || query.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (String pair : query.split("&")) {
            if (pair.isEmpty() || pair.equals(key) || pair.startsWith(key + "=")) continue;
            if (sb.length() > 0) sb.append('&');
            sb.append(pair);
        }
        return sb.toString();
    }

    private static double millis(QueryResult result) {
        return result.elapsed().toNanos() / 1_000_000.0;
    }
}
