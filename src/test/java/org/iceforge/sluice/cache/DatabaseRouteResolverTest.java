package org.iceforge.sluice.cache;

import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.GovernanceProperties;
import org.iceforge.sluice.jdbc.DatabaseNotFoundException;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DatabaseRouteResolverTest {

    private static final String HASH = "1234567890abcdef";

    private DatabaseRouteResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        DatabaseProperties databases = new DatabaseProperties();
        databases.getDatabases().put("fixtures", new DatabaseProperties.DatabaseConfig());
        databases.getDatabases().put("my-db", new DatabaseProperties.DatabaseConfig());

        ContentHasher hasher = mock(ContentHasher.class);
        when(hasher.hash(eq("fixtures"), any())).thenReturn(Optional.of(HASH));
        when(hasher.hash(eq("my-db"), any())).thenReturn(Optional.empty());

        resolver = new DatabaseRouteResolver(databases, new ContentHashRegistry(databases, hasher));
    }

    private static GovernanceConfig config(boolean hashUrls, String baseUrl) {
        GovernanceProperties p = new GovernanceProperties();
        p.setHashUrls(hashUrls);
        p.setBaseUrl(baseUrl);
        return p.toConfig();
    }

    @Test
    void plainNameServesInPlaceWhenHashUrlsIsOff() {
        DatabaseRoute route = resolver.resolve("fixtures", null, null, false, config(false, "/"));

        assertThat(route.name()).isEqualTo("fixtures");
        assertThat(route.correctHashProvided()).isFalse();
        assertThat(route.expectedHash()).isEqualTo("1234567");
        assertThat(route.shouldRedirect()).isFalse();
    }

    @Test
    void plainNameRedirectsWhenHashUrlsIsOn() {
        DatabaseRoute route = resolver.resolve("fixtures", "my table", null, false, config(true, "/"));

        assertThat(route.redirectPath()).isEqualTo("/fixtures-1234567/my+table");
    }

    @Test
    void hashParameterForcesTheRedirect() {
        DatabaseRoute route = resolver.resolve("fixtures", null, "/-/download", true, config(false, "/data/"));

        assertThat(route.redirectPath()).isEqualTo("/data/fixtures-1234567/-/download");
    }

    @Test
    void currentHashIsServedAndStaleHashIsRedirected() {
        DatabaseRoute current = resolver.resolve("fixtures-1234567", null, null, false, config(false, "/"));
        assertThat(current.correctHashProvided()).isTrue();
        assertThat(current.shouldRedirect()).isFalse();

        DatabaseRoute stale = resolver.resolve("fixtures-aaaaaaa", null, null, false, config(true, "/"));
        assertThat(stale.name()).isEqualTo("fixtures");
        assertThat(stale.providedHash()).isEqualTo("aaaaaaa");
        assertThat(stale.redirectPath()).isEqualTo("/fixtures-1234567");
    }

    @Test
    void namesWithDashesAndUnhashedDatabases() {
        DatabaseRoute route = resolver.resolve("my-db", null, null, true, config(true, "/"));

        assertThat(route.name()).isEqualTo("my-db");
        assertThat(route.expectedHash()).isNull();
        assertThat(route.shouldRedirect()).isFalse();
    }

    @Test
    void unknownSegmentsAreNotFound() {
        assertThatThrownBy(() -> resolver.resolve("nope", null, null, false, config(false, "/")))
                .isInstanceOf(DatabaseNotFoundException.class);
        assertThatThrownBy(() -> resolver.resolve("nope-1234567", null, null, false, config(false, "/")))
                .isInstanceOf(DatabaseNotFoundException.class);
    }
}
