package com.vivek.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link CheckpointStore} bean.
 * <p>
 * When a {@link DataSource} is available a {@link JdbcCheckpointStore} is created and its table
 * ensured. Otherwise an {@link InMemoryCheckpointStore} is used; runs can then not be resumed
 * after the process exits.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<DataSource> dataSource,
                                           CheckpointProperties properties) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory checkpoint store (runs will not persist across restarts)");
            return new InMemoryCheckpointStore();
        }
        log.info("Configuring JDBC checkpoint store (table {})", properties.getTableName());
        var store = new JdbcCheckpointStore(ds, properties.getTableName());
        store.createTables();
        return store;
    }
}
