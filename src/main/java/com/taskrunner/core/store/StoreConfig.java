package com.taskrunner.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Wires the JDBC stores against the application {@link DataSource} and creates their
 * tables on startup. There is no in-memory fallback: the engine's durability depends on
 * the database.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public TaskStore taskStore(DataSource dataSource, Clock clock) throws Exception {
        log.info("Configuring JDBC task store");
        var store = new TaskStore(dataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    public RunnerStateStore runnerStateStore(DataSource dataSource, Clock clock) throws Exception {
        var store = new RunnerStateStore(dataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    public NodeStore nodeStore(DataSource dataSource, Clock clock) throws Exception {
        var store = new NodeStore(dataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    public WorkspaceStore workspaceStore(DataSource dataSource, Clock clock) throws Exception {
        var store = new WorkspaceStore(dataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    public AlarmStore alarmStore(DataSource dataSource) throws Exception {
        var store = new AlarmStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    public RecoveryRecordStore recoveryRecordStore(DataSource dataSource) throws Exception {
        var store = new RecoveryRecordStore(dataSource);
        store.createTables();
        return store;
    }
}
