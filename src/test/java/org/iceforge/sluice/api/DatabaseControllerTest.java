package org.iceforge.sluice.api;

import org.iceforge.sluice.cache.CacheDirector;
import org.iceforge.sluice.cache.ContentHashRegistry;
import org.iceforge.sluice.cache.DatabaseRouteResolver;
import org.iceforge.sluice.cache.FileContentHasher;
import org.iceforge.sluice.facet.FacetPlanner;
import org.iceforge.sluice.governance.GovernanceConfigHolder;
import org.iceforge.sluice.governance.GovernanceProperties;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.iceforge.sluice.query.DeadlineClock;
import org.iceforge.sluice.query.H2TestDatabases;
import org.iceforge.sluice.query.QueryGovernor;
import org.iceforge.sluice.query.TableCatalog;
import org.iceforge.sluice.query.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DatabaseControllerTest {

    @TempDir
    Path dir;

    private Path fixturesFile;
    private WorkerPool pool;
    private ContentHashRegistry hashes;
    private GovernanceConfigHolder configs;
    private MockMvc mvc;

    @BeforeEach
    void setUp() throws Exception {
        fixturesFile = Files.writeString(dir.resolve("fixtures.mv.db"), "fixtures v1");

        DatabaseProperties databases = H2TestDatabases.declare("fixtures", "live");
        DatabaseProperties.DatabaseConfig fixtures = databases.get("fixtures");
        fixtures.setImmutable(true);
        fixtures.setFile(fixturesFile.toString());
        DatabaseProperties.TableConfig orders = new DatabaseProperties.TableConfig();
        orders.setFacets(List.of("STATUS"));
        fixtures.getTables().put("ORDERS", orders);

        H2TestDatabases.installSlowFunction(databases, "fixtures");
        H2TestDatabases.exec(databases, "fixtures",
                "CREATE TABLE ORDERS (ID INT PRIMARY KEY, CUSTOMER VARCHAR(10), STATUS VARCHAR(10))",
                "INSERT INTO ORDERS SELECT X, CASE WHEN MOD(X, 2) = 1 THEN 'ann' ELSE 'bob' END, "
                        + "CASE WHEN X <= 6 THEN 'open' ELSE 'closed' END FROM SYSTEM_RANGE(1, 10)");
        H2TestDatabases.exec(databases, "live", "CREATE TABLE NOTES (ID INT, BODY VARCHAR(20))");

        configs = new GovernanceConfigHolder(properties(p -> { }).toConfig());
        pool = H2TestDatabases.pool(databases, 3);
        QueryGovernor governor = new QueryGovernor(pool, DeadlineClock.system());
        hashes = new ContentHashRegistry(databases, new FileContentHasher());

        DatabaseController controller = new DatabaseController(
                configs,
                databases,
                governor,
                new TableCatalog(governor),
                new FacetPlanner(governor),
                new DatabaseRouteResolver(databases, hashes),
                new CacheDirector(hashes),
                new CsvTableExporter(governor));

        mvc = MockMvcBuilders.standaloneSetup(controller, new AdminController(configs, databases, hashes))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static GovernanceProperties properties(Consumer<GovernanceProperties> customizer) {
        GovernanceProperties p = new GovernanceProperties();
        p.setSqlTimeLimitMs(5000);
        p.setFacetTimeLimitMs(2000);
        p.setFacetSuggestTimeLimitMs(2000);
        customizer.accept(p);
        return p;
    }

    private void reload(Consumer<GovernanceProperties> customizer) {
        configs.replace(properties(customizer).toConfig());
    }

    @Test
    void maxReturnedRowsTruncatesFreeFormSql() throws Exception {
        reload(p -> p.setMaxReturnedRows(5));

        mvc.perform(get("/fixtures").param("sql", "select * from ORDERS order by ID"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows", hasSize(5)))
                .andExpect(jsonPath("$.truncated").value(true))
                .andExpect(jsonPath("$.columns[0]").value("ID"))
                .andExpect(header().string("Cache-Control", "max-age=5"))
                .andExpect(header().string("Referrer-Policy", "no-referrer"));
    }

    @Test
    void sizeOverrideAndNamedParameters() throws Exception {
        mvc.perform(get("/fixtures").param("sql", "select * from ORDERS where CUSTOMER = :who order by ID")
                        .param("who", "bob").param("_size", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows", hasSize(2)))
                .andExpect(jsonPath("$.rows[0].ID").value(2))
                .andExpect(jsonPath("$.truncated").value(true))
                .andExpect(jsonPath("$.query.params.who").value("bob"));
    }

    @Test
    void sqlDisabledRejectsFreeFormSqlButNotBrowsing() throws Exception {
        reload(p -> p.setAllowSql(false));

        mvc.perform(get("/fixtures").param("sql", "select 1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("SQL_DISABLED"))
                .andExpect(header().doesNotExist("Cache-Control"));

        mvc.perform(get("/fixtures/ORDERS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows", hasSize(10)));
    }

    @Test
    void tableViewComputesDeclaredRequestedAndSuggestedFacets() throws Exception {
        mvc.perform(get("/fixtures/ORDERS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.facetResults", hasSize(1)))
                .andExpect(jsonPath("$.facetResults[0].column").value("STATUS"))
                .andExpect(jsonPath("$.facetResults[0].results[0].value").value("open"))
                .andExpect(jsonPath("$.facetResults[0].results[0].count").value(6))
                .andExpect(jsonPath("$.suggestedFacets", hasSize(1)))
                .andExpect(jsonPath("$.suggestedFacets[0].name").value("CUSTOMER"))
                .andExpect(jsonPath("$.suggestedFacets[0].toggleUrl").value("http://localhost/fixtures/ORDERS?_facet=CUSTOMER"));

        mvc.perform(get("/fixtures/ORDERS").param("_facet", "CUSTOMER").param("_facet_size", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.facetResults", hasSize(2)))
                .andExpect(jsonPath("$.facetResults[1].column").value("CUSTOMER"))
                .andExpect(jsonPath("$.facetResults[1].results", hasSize(1)))
                .andExpect(jsonPath("$.facetResults[1].truncated").value(true))
                .andExpect(jsonPath("$.suggestedFacets", hasSize(0)));
    }

    @Test
    void adHocFacetsAreForbiddenWhenFacetingIsOff() throws Exception {
        reload(p -> p.setAllowFacet(false));

        mvc.perform(get("/fixtures/ORDERS").param("_facet", "CUSTOMER"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FACET_DISABLED"));
        mvc.perform(get("/fixtures/ORDERS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.facetResults[0].column").value("STATUS"));
    }

    @Test
    void toggleUrlsFollowForceHttps() throws Exception {
        reload(p -> p.setForceHttpsUrls(true));

        mvc.perform(get("/fixtures/ORDERS"))
                .andExpect(jsonPath("$.suggestedFacets[0].toggleUrl", startsWith("https://localhost/")));
    }

    @Test
    void hashedUrlsRedirectAndCacheForAYear() throws Exception {
        reload(p -> p.setHashUrls(true));

        MvcResult first = mvc.perform(get("/fixtures?_size=3"))
                .andExpect(status().isFound())
                .andExpect(header().doesNotExist("Cache-Control"))
                .andReturn();
        String location = first.getResponse().getHeader("Location");
        assertThat(location).matches("/fixtures-[0-9a-f]{7}\\?_size=3");
        String hashedPath = location.substring(0, location.indexOf('?'));

        mvc.perform(get(hashedPath))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value(hashedPath))
                .andExpect(header().string("Cache-Control", "max-age=31536000"));
        mvc.perform(get(hashedPath + "/ORDERS"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=31536000"));
        assertThat(mvc.perform(get("/fixtures")).andReturn().getResponse().getHeader("Location"))
                .isEqualTo(hashedPath);

        Files.writeString(fixturesFile, "fixtures v2");
        mvc.perform(post("/-/databases/fixtures/invalidate")).andExpect(status().isNoContent());

        String moved = mvc.perform(get(hashedPath))
                .andExpect(status().isFound())
                .andReturn().getResponse().getHeader("Location");
        assertThat(moved).startsWith("/fixtures-").isNotEqualTo(hashedPath);
    }

    @Test
    void hashParameterRedirectsEvenWithHashUrlsOff() throws Exception {
        mvc.perform(get("/fixtures/ORDERS?_hash=1&_size=2"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", matchesPattern("/fixtures-[0-9a-f]{7}/ORDERS\\?_size=2")));
    }

    @Test
    void ttlOverrideControlsCacheHeader() throws Exception {
        mvc.perform(get("/fixtures").param("_ttl", "0"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "no-cache"));
    }

    @Test
    void slowSqlIsInterrupted() throws Exception {
        mvc.perform(get("/fixtures").param("sql", "select SLOW(1000, ID) from ORDERS").param("_timelimit", "50"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("SQL Interrupted"))
                .andExpect(header().doesNotExist("Cache-Control"));
    }

    @Test
    void badSqlAndBadOverridesAreClientErrors() throws Exception {
        mvc.perform(get("/fixtures").param("sql", "select * from MISSING"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid SQL"));
        mvc.perform(get("/fixtures").param("sql", "update ORDERS set STATUS = 'x'"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid SQL"));
        mvc.perform(get("/fixtures").param("_size", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void unknownDatabasesAndTablesAreNotFound() throws Exception {
        mvc.perform(get("/nope")).andExpect(status().isNotFound());
        mvc.perform(get("/fixtures/NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(header().string("Referrer-Policy", "no-referrer"));
    }

    @Test
    void databaseListsTables() throws Exception {
        mvc.perform(get("/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("live"))
                .andExpect(jsonPath("$.path").value("/live"))
                .andExpect(jsonPath("$.tables[0]").value("NOTES"))
                .andExpect(jsonPath("$.truncated").value(false));
    }

    @Test
    void downloadsOnlyImmutableDatabases() throws Exception {
        MvcResult started = mvc.perform(get("/fixtures/-/download"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(content().bytes(Files.readAllBytes(fixturesFile)));

        mvc.perform(get("/live/-/download"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("EXPORT_DISABLED"));
    }

    @Test
    void exportsTablesAsCsv() throws Exception {
        reload(p -> p.setMaxReturnedRows(4));

        MvcResult started = mvc.perform(get("/fixtures/ORDERS/-/csv"))
                .andExpect(request().asyncStarted())
                .andReturn();
        String body = mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        String[] lines = body.split("\r\n");
        assertThat(lines).hasSize(11);
        assertThat(lines[0]).isEqualTo("ID,CUSTOMER,STATUS");

        reload(p -> p.setAllowCsvStream(false));
        mvc.perform(get("/fixtures/ORDERS/-/csv")).andExpect(status().isForbidden());
    }

    @Test
    void settingsShowTheCurrentSnapshot() throws Exception {
        reload(p -> p.setDefaultPageSize(7));

        mvc.perform(get("/-/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultPageSize").value(7));
    }
}
