package com.di.epistream.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * JDBC wiring used when {@code epistream.store.type=jdbc}: one HikariCP pool sized for the
 * load workers, a {@link JdbcTemplate} for the stores and a {@link TransactionTemplate} that
 * scopes each country partition.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "jdbc")
public class StoreConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(EpiStreamProperties properties) {
        EpiStreamProperties.Store store = properties.getStore();
        int workers = properties.getLoad().getWorkers();
        // one connection per load worker plus one for the coordinating thread
        int poolSize = Math.max(store.getMaximumPoolSize(), workers + 1);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(store.getJdbcUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setDriverClassName(store.getDriverClassName());
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(Math.min(store.getMinimumIdle(), poolSize));
        config.setIdleTimeout(store.getIdleTimeoutMs());
        config.setConnectionTimeout(store.getConnectionTimeoutMs());
        config.setMaxLifetime(store.getMaxLifetimeMs());
        config.setPoolName("epistream-store");
        if (store.getJdbcUrl() != null && store.getJdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
            config.addDataSourceProperty("reWriteBatchedInserts", "true");
        }
        log.info("[POOL] Creating store pool | url={} | maxPoolSize={}", sanitizeUrl(store.getJdbcUrl()), poolSize);
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public DataSourceInitializer schemaInitializer(DataSource dataSource,
                                                   EpiStreamProperties properties,
                                                   @Value("classpath:schema.sql") Resource schema) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(schema));
        initializer.setEnabled(properties.getStore().isInitializeSchema());
        return initializer;
    }

    private static String sanitizeUrl(String url) {
        if (url == null) return "<none>";
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) : url;
    }
}
