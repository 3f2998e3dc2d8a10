package org.iceforge.sluice.jdbc;

import org.iceforge.sluice.jdbc.spi.DefaultDriverManagerJdbcConnectionProvider;
import org.iceforge.sluice.jdbc.spi.JdbcClientFactory;
import org.iceforge.sluice.jdbc.spi.JdbcConnectionProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class JdbcConfig {

    /**
     * Default provider (DriverManager). Deployments can add their own provider beans.
     */
    @Bean
    public JdbcConnectionProvider defaultJdbcConnectionProvider() {
        return new DefaultDriverManagerJdbcConnectionProvider();
    }

    @Bean
    public JdbcClientFactory jdbcClientFactory(DatabaseProperties props, List<JdbcConnectionProvider> providers) {
        return new JdbcClientFactory(props, providers);
    }
}
