package com.roundpilot.core.config;

import com.roundpilot.core.persistence.JdbcRoundStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} for the durable round store.
 */
@Configuration
public class RoundpilotConfig {

    private static final Logger log = LoggerFactory.getLogger(RoundpilotConfig.class);

    /**
     * JDBC-backed round store. Creates the round tables on startup.
     */
    @Bean
    public JdbcRoundStore roundStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC round store");
        var store = new JdbcRoundStore(dataSource);
        store.createTables();
        return store;
    }
}
