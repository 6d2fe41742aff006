package com.embedbot.vectorstore;

import javax.sql.DataSource;

import com.embedbot.tenant.DecryptedCredential;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class HikariTenantDataSourceFactory implements TenantDataSourceFactory {
    private final VectorStoreDialect dialect;
    private final int poolSize;

    public HikariTenantDataSourceFactory(VectorStoreDialect dialect, int poolSize) {
        this.dialect = dialect;
        this.poolSize = poolSize;
    }

    @Override
    public DataSource create(DecryptedCredential credential) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("embedbot-tenant-" + credential.tenantId());
        config.setJdbcUrl(dialect.jdbcUrl(credential.store()));
        config.setUsername(credential.store().user());
        config.setPassword(credential.storePassword());
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(0);
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }
}
