package org.iceforge.sluice.jdbc;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Databases exposed for querying, keyed by the name used in URLs.
 * <p>
 * Discovery is static: a database only exists if it is declared here.
 */
@ConfigurationProperties(prefix = "sluice")
public class DatabaseProperties {

    /** Map of database name -> config. Insertion order is preserved for listings. */
    private Map<String, DatabaseConfig> databases = new LinkedHashMap<>();

    public Map<String, DatabaseConfig> getDatabases() {
        return databases;
    }

    public void setDatabases(Map<String, DatabaseConfig> databases) {
        this.databases = databases;
    }

    public DatabaseConfig get(String name) {
        return databases.get(name);
    }

    public static class DatabaseConfig {

        /** Optional forced provider id (e.g. "default"). */
        private String provider;

        private String jdbcUrl;

        private String username;

        private String password;

        /** Driver properties (non-secret preferred). */
        private Map<String, String> properties = new LinkedHashMap<>();

        /**
         * Backing file. Used for content hashing and raw download; only meaningful when
         * {@link #isImmutable()} is true.
         */
        private String file;

        /** Immutable databases get content hashes and read-only connections. */
        private boolean immutable = false;

        /** Per-table settings, e.g. facets declared up front. */
        private Map<String, TableConfig> tables = new LinkedHashMap<>();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Map<String, String> getProperties() {
            return properties;
        }

        public void setProperties(Map<String, String> properties) {
            this.properties = properties;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public boolean isImmutable() {
            return immutable;
        }

        public void setImmutable(boolean immutable) {
            this.immutable = immutable;
        }

        public Map<String, TableConfig> getTables() {
            return tables;
        }

        public void setTables(Map<String, TableConfig> tables) {
            this.tables = tables;
        }

        public List<String> declaredFacets(String table) {
            TableConfig t = tables == null ? null : tables.get(table);
            return t == null || t.getFacets() == null ? List.of() : List.copyOf(t.getFacets());
        }
    }

    public static class TableConfig {

        /** Facets always computed for this table, even when ad hoc facets are disabled. */
        private List<String> facets = new ArrayList<>();

        public List<String> getFacets() {
            return facets;
        }

        public void setFacets(List<String> facets) {
            this.facets = facets;
        }
    }
}
