package org.iceforge.sluice.cache;

import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public ContentHasher contentHasher() {
        return new FileContentHasher();
    }

    @Bean
    public ContentHashRegistry contentHashRegistry(DatabaseProperties databases, ContentHasher contentHasher) {
        return new ContentHashRegistry(databases, contentHasher);
    }

    @Bean
    public DatabaseRouteResolver databaseRouteResolver(DatabaseProperties databases, ContentHashRegistry registry) {
        return new DatabaseRouteResolver(databases, registry);
    }

    @Bean
    public CacheDirector cacheDirector(ContentHashRegistry registry) {
        return new CacheDirector(registry);
    }
}
