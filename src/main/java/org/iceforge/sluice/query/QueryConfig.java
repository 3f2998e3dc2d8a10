package org.iceforge.sluice.query;

import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.GovernanceConfigHolder;
import org.iceforge.sluice.governance.GovernanceProperties;
import org.iceforge.sluice.jdbc.spi.JdbcClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueryConfig {

    @Bean
    public GovernanceConfigHolder governanceConfigHolder(GovernanceProperties props) {
        return new GovernanceConfigHolder(props.toConfig());
    }

    @Bean(destroyMethod = "close")
    public WorkerPool workerPool(GovernanceConfigHolder holder, JdbcClientFactory jdbcClientFactory) {
        GovernanceConfig config = holder.current();
        int cacheSizeKb = config.cacheSizeKb();
        return new WorkerPool(config.numSqlThreads(), db -> jdbcClientFactory.openConnection(db, cacheSizeKb));
    }

    @Bean
    public DeadlineClock deadlineClock() {
        return DeadlineClock.system();
    }

    @Bean
    public QueryGovernor queryGovernor(WorkerPool workerPool, DeadlineClock deadlineClock) {
        return new QueryGovernor(workerPool, deadlineClock);
    }

    @Bean
    public TableCatalog tableCatalog(QueryGovernor queryGovernor) {
        return new TableCatalog(queryGovernor);
    }
}
