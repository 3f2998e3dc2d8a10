package org.iceforge.sluice.governance;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestOverridesTest {

    private final GovernanceConfig config = GovernanceConfig.defaults();

    @Test
    void absentParametersMeanNoOverride() {
        RequestOverrides o = RequestOverrides.from(Map.of());

        assertThat(o).isEqualTo(RequestOverrides.none());
        assertThat(o.pageSize(config)).isNull();
        assertThat(o.facetSize(config)).isEqualTo(30);
    }

    @Test
    void parsesSizeAndMax() {
        assertThat(RequestOverrides.from(Map.of("_size", List.of("25"))).pageSize(config)).isEqualTo(25);
        assertThat(RequestOverrides.from(Map.of("_size", List.of("max"))).pageSize(config)).isEqualTo(1000);
        assertThatThrownBy(() -> RequestOverrides.from(Map.of("_size", List.of("lots"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("_size");
        assertThatThrownBy(() -> RequestOverrides.from(Map.of("_size", List.of("-4"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timeLimitIsClampedToOneMillisecond() {
        assertThat(RequestOverrides.from(Map.of("_timelimit", List.of("0"))).timeLimitMs()).isEqualTo(1L);
        assertThat(RequestOverrides.from(Map.of("_timelimit", List.of("250"))).timeLimitMs()).isEqualTo(250L);
        assertThatThrownBy(() -> RequestOverrides.from(Map.of("_timelimit", List.of("soon"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonDigitTtlIsIgnored() {
        assertThat(RequestOverrides.from(Map.of("_ttl", List.of("60"))).ttlSeconds()).isEqualTo(60L);
        assertThat(RequestOverrides.from(Map.of("_ttl", List.of("0"))).ttlSeconds()).isZero();
        assertThat(RequestOverrides.from(Map.of("_ttl", List.of("-5"))).ttlSeconds()).isNull();
        assertThat(RequestOverrides.from(Map.of("_ttl", List.of("1h"))).ttlSeconds()).isNull();
    }

    @Test
    void facetsAreDeduplicatedInOrder() {
        RequestOverrides o = RequestOverrides.from(Map.of("_facet", List.of("b", "a", "b", " ")));
        assertThat(o.facets()).containsExactly("b", "a");
    }

    @Test
    void facetSizeIsClampedToMaxReturnedRows() {
        GovernanceProperties p = new GovernanceProperties();
        p.setMaxReturnedRows(10);
        GovernanceConfig small = p.toConfig();

        assertThat(RequestOverrides.from(Map.of("_facet_size", List.of("50"))).facetSize(small)).isEqualTo(10);
        assertThat(RequestOverrides.from(Map.of("_facet_size", List.of("max"))).facetSize(small)).isEqualTo(10);
        assertThat(RequestOverrides.from(Map.of("_facet_size", List.of("0"))).facetSize(small)).isEqualTo(1);
        assertThat(RequestOverrides.from(Map.of()).facetSize(small)).isEqualTo(10);
    }

    @Test
    void hashFlagOnlyNeedsToBePresent() {
        assertThat(RequestOverrides.from(Map.of("_hash", List.of(""))).forceHash()).isTrue();
        assertThat(RequestOverrides.from(Map.of("other", List.of("1"))).forceHash()).isFalse();
    }
}
