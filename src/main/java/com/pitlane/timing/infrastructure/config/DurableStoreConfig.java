package com.pitlane.timing.infrastructure.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DurableStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(DurableStoreConfig.class);

    @Bean(destroyMethod = "close")
    public DataSource dataSource(DurableStoreProperties properties) {
        createParentDirectories(properties.getPath());
        logger.info("Opening durable store at {}", properties.getPath());
        return new HikariDataSource(hikariConfig(properties));
    }

    public static HikariConfig hikariConfig(DurableStoreProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("timing-store");
        config.setJdbcUrl(properties.jdbcUrl());
        config.setDriverClassName("org.sqlite.JDBC");
        config.setMaximumPoolSize(properties.getPoolSize());
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(properties.getBusyTimeoutMillis()));
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        return config;
    }

    private static void createParentDirectories(String path) {
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory for durable store " + path, e);
        }
    }
}
