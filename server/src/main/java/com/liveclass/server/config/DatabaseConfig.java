package com.liveclass.server.config;

import com.liveclass.server.dao.ClassRecordStore;
import com.liveclass.server.dao.JdbcClassRecordStore;
import com.liveclass.server.dao.JdbcPresenceStore;
import com.liveclass.server.dao.PresenceStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * PostgreSQL-backed stores over a HikariCP pool. Active unless {@code classroom.store=memory}.
 */
@Configuration
@ConditionalOnProperty(name = "classroom.store", havingValue = "jdbc", matchIfMissing = true)
public class DatabaseConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    @Value("${classroom.db.url}")
    private String url;

    @Value("${classroom.db.username:}")
    private String username;

    @Value("${classroom.db.password:}")
    private String password;

    @Value("${classroom.db.driver:org.postgresql.Driver}")
    private String driver;

    // Connection pool settings
    @Value("${classroom.db.pool.maximumPoolSize:20}")
    private int maximumPoolSize;

    @Value("${classroom.db.pool.minimumIdle:5}")
    private int minimumIdle;

    @Value("${classroom.db.pool.connectionTimeout:30000}")
    private long connectionTimeout;

    @Value("${classroom.db.pool.idleTimeout:600000}")
    private long idleTimeout;

    @Value("${classroom.db.pool.maxLifetime:1800000}")
    private long maxLifetime;

    @Value("${classroom.db.init-schema:true}")
    private boolean initSchema;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName(driver);
        config.setPoolName("classroom-db");

        // Pool settings
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeout);
        config.setIdleTimeout(idleTimeout);
        config.setMaxLifetime(maxLifetime);

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("Database connection pool initialized: url={}, poolSize={}, minIdle={}",
                url, maximumPoolSize, minimumIdle);

        if (initSchema) {
            initializeSchema(dataSource);
        }
        return dataSource;
    }

    @Bean
    public PresenceStore presenceStore(DataSource dataSource) {
        return new JdbcPresenceStore(dataSource);
    }

    @Bean
    public ClassRecordStore classRecordStore(DataSource dataSource) {
        return new JdbcClassRecordStore(dataSource);
    }

    /**
     * Creates {@code socket_users} and {@code live_classes} if missing.
     */
    static void initializeSchema(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
        DatabasePopulatorUtils.execute(populator, dataSource);
        log.info("Database schema initialized");
    }
}
