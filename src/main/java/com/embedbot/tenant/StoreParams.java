package com.embedbot.tenant;

/**
 * Connection parameters of a tenant's vector store, without the password.
 */
public record StoreParams(String host, int port, String database, String user) {
}
