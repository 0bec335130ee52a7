package com.vivek.core.persistence;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CheckpointerConfigTest {

    @Test
    @SuppressWarnings("unchecked")
    void fallsBackToMemoryWithoutDataSource() throws Exception {
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);

        var store = new CheckpointerConfig().checkpointStore(provider, new CheckpointProperties());

        assertInstanceOf(InMemoryCheckpointStore.class, store);
    }

    @Test
    @SuppressWarnings("unchecked")
    void usesJdbcWhenDataSourcePresent() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(dataSource);
        var properties = new CheckpointProperties();
        properties.setTableName("runs_test");

        var store = new CheckpointerConfig().checkpointStore(provider, properties);

        assertInstanceOf(JdbcCheckpointStore.class, store);
        store.save(RunCheckpoint.started("R1", "req", Instant.parse("2026-05-01T12:00:00Z")));
        assertTrue(store.load("R1").isPresent());
    }
}
