package org.iceforge.warden.server.config;

import org.iceforge.warden.server.audit.JdbcQueryHistoryAuditSink;
import org.iceforge.warden.server.audit.QueryHistoryRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
@ConditionalOnProperty(prefix = "warden.audit", name = "history-enabled", havingValue = "true", matchIfMissing = true)
public class AuditConfig {

    @Bean(destroyMethod = "close")
    public JdbcQueryHistoryAuditSink queryHistoryAuditSink(@Qualifier("wardenAdminDataSource") DataSource admin,
                                                           WardenProperties props) {
        JdbcQueryHistoryAuditSink sink = new JdbcQueryHistoryAuditSink(admin, props.getAudit().getQueueCapacity());
        if (props.getAudit().isCreateTable()) {
            sink.createTableIfMissing();
        }
        return sink;
    }

    @Bean
    public QueryHistoryRepository queryHistoryRepository(@Qualifier("wardenAdminDataSource") DataSource admin) {
        return new QueryHistoryRepository(admin);
    }
}
