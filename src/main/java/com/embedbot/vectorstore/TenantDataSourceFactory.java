package com.embedbot.vectorstore;

import javax.sql.DataSource;

import com.embedbot.tenant.DecryptedCredential;

@FunctionalInterface
public interface TenantDataSourceFactory {
    DataSource create(DecryptedCredential credential);
}
