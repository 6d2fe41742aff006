package com.embedbot.runtime;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public final class ControlDatabase {

    private ControlDatabase() {
    }

    public static HikariDataSource open(AppConfig.ControlDbConfig config) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new IllegalStateException("Control database URL is not configured (EMBEDBOT_CONTROL_DB_URL)");
        }
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("embedbot-control");
        hikari.setJdbcUrl(config.getUrl());
        hikari.setUsername(config.getUser());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getPoolSize());
        HikariDataSource dataSource = new HikariDataSource(hikari);
        ControlSchema.initialize(dataSource);
        return dataSource;
    }
}
